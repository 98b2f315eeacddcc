package com.flagship.impact_ledger.pricing;

import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pricing configuration and its audit trail against PostgreSQL.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class GlobalConfigServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("impact_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private GlobalConfigService configService;

    @Autowired
    private PricingOracle pricingOracle;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @AfterEach
    void resetRate() {
        jdbcTemplate.update("UPDATE global_config SET config_value = '0.11' WHERE config_key = ?",
                ConfigKeys.CURRENT_CSR_PRICE);
        jdbcTemplate.update("DELETE FROM config_audit_log");
    }

    @Test
    @DisplayName("Seeded rate is 0.11")
    void testSeededRate() {
        assertEquals(0, new BigDecimal("0.11").compareTo(pricingOracle.getRate()));
        assertEquals("10.00", configService.getValue(ConfigKeys.CORSAIR_THRESHOLD));
    }

    @Test
    @DisplayName("Rate change is versioned and audited with old value, new value and actor")
    void testSetRate_Audited() {
        printTestHeader("Set Rate - Audited");
        long versionBefore = configService.getVersion(ConfigKeys.CURRENT_CSR_PRICE);

        BigDecimal previous = pricingOracle.setRate(new BigDecimal("0.12"), "alice@example.com");
        pricingOracle.setRate(new BigDecimal("0.15"), "bob@example.com");

        assertEquals(0, new BigDecimal("0.11").compareTo(previous));
        assertEquals(0, new BigDecimal("0.15").compareTo(pricingOracle.getRate()));
        assertEquals(versionBefore + 2, configService.getVersion(ConfigKeys.CURRENT_CSR_PRICE));

        List<ConfigAuditEntry> history = configService.getAuditHistory(ConfigKeys.CURRENT_CSR_PRICE);
        printOutput("History", history);
        assertEquals(2, history.size());
        assertTrue(history.stream().anyMatch(e ->
                "0.11".equals(e.getOldValue()) && "0.12".equals(e.getNewValue()) && "alice@example.com".equals(e.getChangedBy())));
        assertTrue(history.stream().anyMatch(e ->
                "0.12".equals(e.getOldValue()) && "0.15".equals(e.getNewValue()) && "bob@example.com".equals(e.getChangedBy())));
        printSuccess("Both changes audited");
    }

    @Test
    @DisplayName("Zero rate is rejected and leaves no trace")
    void testSetRate_ZeroRejected() {
        printTestHeader("Set Rate - Zero Rejected");
        long versionBefore = configService.getVersion(ConfigKeys.CURRENT_CSR_PRICE);

        assertThrows(InvalidValueException.class, () -> pricingOracle.setRate(BigDecimal.ZERO, "alice@example.com"));
        assertThrows(InvalidValueException.class,
                () -> configService.setValue(ConfigKeys.CURRENT_CSR_PRICE, "0", "alice@example.com"));
        assertThrows(InvalidValueException.class,
                () -> configService.setValue(ConfigKeys.CURRENT_CSR_PRICE, "cheap", "alice@example.com"));

        assertEquals(0, new BigDecimal("0.11").compareTo(pricingOracle.getRate()));
        assertEquals(versionBefore, configService.getVersion(ConfigKeys.CURRENT_CSR_PRICE));
        assertTrue(configService.getAuditHistory(ConfigKeys.CURRENT_CSR_PRICE).isEmpty());
        printSuccess("Previous rate unchanged, no audit row");
    }

    @Test
    @DisplayName("Concurrent rate changes each audit the value they replaced")
    void testConcurrentSetRate_AuditChainIntact() throws InterruptedException {
        printTestHeader("Concurrent Set Rate");
        int threadCount = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            String rate = "0.2" + i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    pricingOracle.setRate(new BigDecimal(rate), "admin-" + rate);
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        List<ConfigAuditEntry> history = configService.getAuditHistory(ConfigKeys.CURRENT_CSR_PRICE);
        assertEquals(threadCount, history.size());
        // Every old value is either the seed or a value another writer set
        long seeded = history.stream().filter(e -> "0.11".equals(e.getOldValue())).count();
        assertEquals(1, seeded, "Exactly one change replaced the seeded value");
        assertEquals(threadCount, history.stream().map(ConfigAuditEntry::getOldValue).distinct().count(),
                "No two changes replaced the same value");
        printSuccess("Audit chain has no gaps");
    }

    @Test
    @DisplayName("Concurrent first writes of a new key: only one audits a missing previous value")
    void testConcurrentFirstWrites_NewKey() throws InterruptedException {
        printTestHeader("Concurrent First Writes");
        String key = "NEW_KEY_" + System.nanoTime();
        int threadCount = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            String value = "v" + i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    configService.setValue(key, value, "admin-" + value);
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        List<ConfigAuditEntry> history = configService.getAuditHistory(key);
        printOutput("History", history);
        assertEquals(threadCount, history.size());
        assertEquals(1, history.stream().filter(e -> e.getOldValue() == null).count(),
                "Only the creating write has no previous value");
        assertEquals(threadCount, history.stream().map(ConfigAuditEntry::getOldValue).distinct().count());
        assertEquals(threadCount, configService.getVersion(key));
        printSuccess("Every later write audited the value it replaced");
    }

    @Test
    @DisplayName("Unknown key is not found; new keys can be created")
    void testUnknownAndNewKeys() {
        assertThrows(NotFoundException.class, () -> configService.getValue("NO_SUCH_KEY"));

        String key = "FEATURE_FLAG_" + System.nanoTime();
        assertNull(configService.setValue(key, "on", "admin@example.com"));
        assertEquals("on", configService.getValue(key));
        assertEquals(1, configService.getVersion(key));
        assertTrue(configService.getAll().stream().anyMatch(e -> key.equals(e.getKey())));
    }
}
