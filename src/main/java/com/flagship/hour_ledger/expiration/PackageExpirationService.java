package com.flagship.hour_ledger.expiration;

import com.flagship.hour_ledger.config.LedgerProperties;
import com.flagship.hour_ledger.observability.CorrelationContext;
import com.flagship.hour_ledger.observability.LedgerMetrics;
import com.flagship.hour_ledger.purchase.HourPackage;
import com.flagship.hour_ledger.purchase.HourPackageEntity;
import com.flagship.hour_ledger.purchase.HourPackageRepository;
import com.flagship.hour_ledger.purchase.PackageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Package expiration lifecycle: finding packages that are about to expire or have
 * expired, extending expiry dates, and removing the unused hours of expired packages
 * from student balances once their grace period is over.
 *
 * Removing hours is applied at most once per package; the package row records when it
 * happened.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PackageExpirationService {

    private final HourPackageRepository packageRepository;
    private final ExpiredPackageProcessor processor;
    private final LedgerProperties properties;
    private final LedgerMetrics ledgerMetrics;

    @Transactional(readOnly = true)
    public List<HourPackage> getPackagesExpiringSoon() {
        return getPackagesExpiringSoon(properties.getExpiringSoonDays());
    }

    /**
     * Completed packages whose expiry falls between now and {@code daysAhead} days from now.
     */
    @Transactional(readOnly = true)
    public List<HourPackage> getPackagesExpiringSoon(int daysAhead) {
        if (daysAhead < 0) {
            throw new IllegalArgumentException("Days ahead must not be negative");
        }
        Instant now = Instant.now();
        return toDomain(packageRepository.findCompletedExpiringBetween(now, now.plus(Duration.ofDays(daysAhead))));
    }

    @Transactional(readOnly = true)
    public List<HourPackage> getExpiredPackages() {
        return toDomain(packageRepository.findCompletedExpiredBefore(Instant.now()));
    }

    @Transactional(readOnly = true)
    public List<HourPackage> getExpiredPackagesForStudent(UUID studentId) {
        return toDomain(packageRepository.findCompletedExpiredBeforeForStudent(studentId, Instant.now()));
    }

    /**
     * Hours included in the package minus the non-refunded hours drawn from it, never negative.
     */
    @Transactional(readOnly = true)
    public BigDecimal calculateHoursToExpire(HourPackage hourPackage) {
        return processor.unusedHours(hourPackage);
    }

    /**
     * Removes the unused hours of one expired package from its student's purchased total.
     * Failures are reported in the result. Processing a package twice expires nothing the
     * second time.
     */
    public ExpirationResult processExpiredPackage(UUID packageId) {
        MDC.put(CorrelationContext.PACKAGE_ID_MDC_KEY, String.valueOf(packageId));
        try {
            ExpirationResult result = processor.expire(packageId);
            ledgerMetrics.recordExpiration(result.getHoursExpired().signum() > 0 ? "expired" : "nothing_to_expire");
            if (result.getHoursExpired().signum() > 0) {
                ledgerMetrics.recordHoursExpired(result.getHoursExpired());
            }
            return result;
        } catch (Exception e) {
            String errorMessage = String.format("Error processing expired package %s: %s", packageId, e.getMessage());
            log.error(errorMessage);
            ledgerMetrics.recordExpiration("error");
            UUID studentId = packageRepository.findById(packageId)
                    .map(HourPackageEntity::getStudentId)
                    .orElse(null);
            return ExpirationResult.failure(packageId, studentId, errorMessage);
        } finally {
            MDC.remove(CorrelationContext.PACKAGE_ID_MDC_KEY);
        }
    }

    public List<ExpirationResult> processBulkExpiration() {
        return processBulkExpiration(properties.getExpiration().getGraceHours());
    }

    /**
     * Processes every completed package that expired more than {@code graceHours} ago and
     * has not been processed yet.
     */
    public List<ExpirationResult> processBulkExpiration(int graceHours) {
        if (graceHours < 0) {
            throw new IllegalArgumentException("Grace hours must not be negative");
        }
        return ledgerMetrics.timeExpirationBatch(() -> {
            Instant cutoff = Instant.now().minus(Duration.ofHours(graceHours));
            List<HourPackageEntity> candidates = packageRepository.findUnprocessedExpiredBefore(cutoff);

            List<ExpirationResult> results = new ArrayList<>(candidates.size());
            for (HourPackageEntity candidate : candidates) {
                results.add(processExpiredPackage(candidate.getId()));
            }

            long failed = results.stream().filter(r -> !r.isSuccess()).count();
            log.info("Processed {} expired packages (grace {}h): failed={}", results.size(), graceHours, failed);
            return results;
        });
    }

    /**
     * Moves a package's expiry date {@code extensionDays} days later, counted from its
     * current expiry or, with {@code extendFromNow}, from now.
     *
     * @throws IllegalArgumentException if the days are not positive, the package does not
     *         exist, or it never expires
     * @throws IllegalStateException if the package's unused hours were already expired
     */
    @Transactional
    public ExtensionResult extendPackageExpiration(UUID packageId, int extensionDays,
                                                   String reason, boolean extendFromNow) {
        if (extensionDays <= 0) {
            throw new IllegalArgumentException("Extension days must be positive");
        }
        HourPackageEntity entity = packageRepository.findByIdForUpdate(packageId)
                .orElseThrow(() -> new IllegalArgumentException("Package not found: " + packageId));
        if (entity.getType() == PackageType.SUBSCRIPTION || entity.getExpiresAt() == null) {
            throw new IllegalArgumentException("Package " + packageId + " has no expiry to extend");
        }

        Instant now = Instant.now();
        Instant originalExpiry = entity.getExpiresAt();
        Instant base = extendFromNow ? now : originalExpiry;
        Instant newExpiry = base.plus(Duration.ofDays(extensionDays));

        entity.extendExpiry(newExpiry);
        packageRepository.save(entity);

        String auditLog = String.format(
                "Package %s extended by %d days from %s to %s. Reason: %s. Extended at %s",
                packageId, extensionDays, originalExpiry, newExpiry,
                reason == null || reason.isBlank() ? "No reason provided" : reason, now);
        log.info(auditLog);

        return ExtensionResult.builder()
                .packageId(packageId)
                .originalExpiry(originalExpiry)
                .newExpiry(newExpiry)
                .extensionDays(extensionDays)
                .reason(reason)
                .auditLog(auditLog)
                .build();
    }

    private static List<HourPackage> toDomain(List<HourPackageEntity> entities) {
        return entities.stream()
                .map(HourPackageEntity::toDomain)
                .toList();
    }
}
