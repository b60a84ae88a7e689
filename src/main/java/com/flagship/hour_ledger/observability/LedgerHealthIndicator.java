package com.flagship.hour_ledger.observability;

import com.flagship.hour_ledger.ledger.StudentBalanceRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when any student balance has consumed more hours than were purchased.
 * The ledger refuses such deductions, so an overdrawn row means the data was changed
 * outside the service.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final StudentBalanceRepository balanceRepository;

    public LedgerHealthIndicator(StudentBalanceRepository balanceRepository) {
        this.balanceRepository = balanceRepository;
    }

    @Override
    public Health health() {
        try {
            long overdrawn = balanceRepository.countOverdrawn();

            Health.Builder builder = overdrawn == 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("overdrawnBalances", overdrawn)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
