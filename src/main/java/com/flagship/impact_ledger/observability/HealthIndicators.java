package com.flagship.impact_ledger.observability;

import com.flagship.impact_ledger.outbox.OutboxEventRepository;
import com.flagship.impact_ledger.pricing.PricingOracle;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health checks specific to the ledger.
 */
public class HealthIndicators {

    /**
     * Degrades as unpublished ledger events pile up.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Down when no usable impact rate is configured: every transaction creation would fail.
     */
    @Component("pricingHealth")
    public static class PricingHealthIndicator implements HealthIndicator {

        private final PricingOracle pricingOracle;

        public PricingHealthIndicator(PricingOracle pricingOracle) {
            this.pricingOracle = pricingOracle;
        }

        @Override
        public Health health() {
            try {
                return Health.up()
                        .withDetail("rate", pricingOracle.getRate().toPlainString())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
