package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final Duration TTL = Duration.ofDays(7);

    @Mock
    private ImpactTransactionRepository repository;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private IdempotencyService service;

    @BeforeEach
    void setUp() {
        service = new IdempotencyService(repository, Optional.of(redisTemplate), TTL);
    }

    @Test
    @DisplayName("Redis hit answers without touching the database")
    void testFind_RedisHit() {
        UUID transactionId = UUID.randomUUID();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("idempotency:transaction:key-1")).thenReturn(transactionId.toString());

        assertEquals(Optional.of(transactionId), service.findTransactionId("key-1"));
        verify(repository, never()).findByIdempotencyKey(anyString());
    }

    @Test
    @DisplayName("Redis failure falls back to the database")
    void testFind_RedisDown_DatabaseFallback() {
        UUID transactionId = UUID.randomUUID();
        ImpactTransactionEntity entity = mock(ImpactTransactionEntity.class);
        when(entity.getId()).thenReturn(transactionId);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RuntimeException("Redis connection refused"));
        doThrow(new RuntimeException("Redis connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        when(repository.findByIdempotencyKey("key-2")).thenReturn(Optional.of(entity));

        assertEquals(Optional.of(transactionId), service.findTransactionId("key-2"));
    }

    @Test
    @DisplayName("Unknown key is a miss")
    void testFind_Miss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenReturn(null);
        when(repository.findByIdempotencyKey("key-3")).thenReturn(Optional.empty());

        assertTrue(service.findTransactionId("key-3").isEmpty());
    }

    @Test
    @DisplayName("Without Redis the database alone answers")
    void testFind_NoRedis() {
        IdempotencyService databaseOnly = new IdempotencyService(repository, Optional.empty(), TTL);
        when(repository.findByIdempotencyKey("key-4")).thenReturn(Optional.empty());

        assertTrue(databaseOnly.findTransactionId("key-4").isEmpty());
        databaseOnly.remember("key-4", UUID.randomUUID());
    }

    @Test
    @DisplayName("Remember caches the key with its TTL")
    void testRemember_CachesWithTtl() {
        UUID transactionId = UUID.randomUUID();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        service.remember("key-5", transactionId);

        verify(valueOperations).set("idempotency:transaction:key-5", transactionId.toString(), TTL);
    }

    @Test
    @DisplayName("Blank key is rejected")
    void testBlankKey_Rejected() {
        assertThrows(ValidationFailedException.class, () -> service.findTransactionId(" "));
        assertThrows(ValidationFailedException.class, () -> service.remember(null, UUID.randomUUID()));
    }
}
