package com.flagship.impact_ledger.pricing;

import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GlobalConfigPricingOracleTest {

    @Mock
    private GlobalConfigService configService;

    private GlobalConfigPricingOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new GlobalConfigPricingOracle(configService);
    }

    @Test
    @DisplayName("Reads the configured rate")
    void testGetRate_ReturnsStoredValue() {
        when(configService.findValue(ConfigKeys.CURRENT_CSR_PRICE)).thenReturn(Optional.of("0.11"));

        assertEquals(new BigDecimal("0.11"), oracle.getRate());
    }

    @Test
    @DisplayName("Missing, unreadable or non-positive stored rate is an invalid value")
    void testGetRate_UnusableStoredValue() {
        when(configService.findValue(ConfigKeys.CURRENT_CSR_PRICE)).thenReturn(Optional.empty());
        assertThrows(InvalidValueException.class, () -> oracle.getRate());

        when(configService.findValue(ConfigKeys.CURRENT_CSR_PRICE)).thenReturn(Optional.of("abc"));
        assertThrows(InvalidValueException.class, () -> oracle.getRate());

        when(configService.findValue(ConfigKeys.CURRENT_CSR_PRICE)).thenReturn(Optional.of("0"));
        assertThrows(InvalidValueException.class, () -> oracle.getRate());
    }

    @Test
    @DisplayName("Setting the rate to zero is rejected and nothing is written")
    void testSetRate_ZeroRejected() {
        assertThrows(InvalidValueException.class, () -> oracle.setRate(BigDecimal.ZERO, "admin@example.com"));
        assertThrows(InvalidValueException.class, () -> oracle.setRate(new BigDecimal("-0.05"), "admin@example.com"));
        assertThrows(InvalidValueException.class, () -> oracle.setRate(null, "admin@example.com"));

        verify(configService, never()).setValue(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Setting the rate requires an actor")
    void testSetRate_ActorRequired() {
        assertThrows(ValidationFailedException.class, () -> oracle.setRate(new BigDecimal("0.12"), " "));

        verify(configService, never()).setValue(any(), any(), any());
    }

    @Test
    @DisplayName("Setting the rate stores the plain value and returns the previous one")
    void testSetRate_ReturnsPrevious() {
        when(configService.setValue(ConfigKeys.CURRENT_CSR_PRICE, "0.12", "admin@example.com")).thenReturn("0.11");

        BigDecimal previous = oracle.setRate(new BigDecimal("0.12"), "admin@example.com");

        assertEquals(new BigDecimal("0.11"), previous);
    }

    @Test
    @DisplayName("Certified asset threshold falls back to 10")
    void testCertifiedAssetThreshold_Default() {
        when(configService.findValue(ConfigKeys.CORSAIR_THRESHOLD)).thenReturn(Optional.empty());
        assertEquals(0, new BigDecimal("10").compareTo(oracle.getCertifiedAssetThreshold()));

        when(configService.findValue(ConfigKeys.CORSAIR_THRESHOLD)).thenReturn(Optional.of("not-a-number"));
        assertEquals(0, new BigDecimal("10").compareTo(oracle.getCertifiedAssetThreshold()));

        when(configService.findValue(ConfigKeys.CORSAIR_THRESHOLD)).thenReturn(Optional.of("25.00"));
        assertEquals(new BigDecimal("25.00"), oracle.getCertifiedAssetThreshold());
    }
}
