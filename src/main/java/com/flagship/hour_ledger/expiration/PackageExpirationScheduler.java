package com.flagship.hour_ledger.expiration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Runs bulk package expiration on a cron schedule.
 * Disabled unless {@code ledger.expiration.scheduler.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "ledger.expiration.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PackageExpirationScheduler {

    private final PackageExpirationService expirationService;

    @Scheduled(cron = "${ledger.expiration.scheduler.cron:0 15 3 * * *}")
    public void expirePackages() {
        try {
            List<ExpirationResult> results = expirationService.processBulkExpiration();
            if (results.isEmpty()) {
                return;
            }
            BigDecimal totalHours = results.stream()
                    .map(ExpirationResult::getHoursExpired)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            log.info("Scheduled expiration run: packages={}, hoursExpired={}", results.size(), totalHours);

        } catch (Exception e) {
            log.error("Error in scheduled package expiration run", e);
        }
    }
}
