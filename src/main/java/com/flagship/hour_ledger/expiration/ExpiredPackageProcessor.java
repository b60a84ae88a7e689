package com.flagship.hour_ledger.expiration;

import com.flagship.hour_ledger.ledger.HourConsumptionRepository;
import com.flagship.hour_ledger.ledger.Hours;
import com.flagship.hour_ledger.ledger.StudentBalanceEntity;
import com.flagship.hour_ledger.ledger.StudentBalanceService;
import com.flagship.hour_ledger.purchase.HourPackage;
import com.flagship.hour_ledger.purchase.HourPackageEntity;
import com.flagship.hour_ledger.purchase.HourPackageRepository;
import com.flagship.hour_ledger.purchase.PackageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Expires one package in its own transaction, so a batch keeps going when a single
 * package fails.
 *
 * The package row is locked first, then the balance row; package completion takes the
 * locks in the same order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class ExpiredPackageProcessor {

    private final HourPackageRepository packageRepository;
    private final HourConsumptionRepository consumptionRepository;
    private final StudentBalanceService balanceService;

    /**
     * Hours of the package not covered by non-refunded consumption, never negative.
     */
    public BigDecimal unusedHours(HourPackage hourPackage) {
        BigDecimal consumed = consumptionRepository.sumActiveHoursByPackage(hourPackage.getId());
        BigDecimal unused = hourPackage.getHoursIncluded().subtract(consumed);
        return Hours.normalize(unused.max(BigDecimal.ZERO));
    }

    /**
     * @throws IllegalArgumentException if the package does not exist
     * @throws IllegalStateException if the package is not a completed, expired package
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ExpirationResult expire(UUID packageId) {
        HourPackageEntity entity = packageRepository.findByIdForUpdate(packageId)
                .orElseThrow(() -> new IllegalArgumentException("Package not found: " + packageId));
        Instant now = Instant.now();

        if (entity.isExpirationProcessed()) {
            log.info("Expiration of package {} already processed at {}", packageId, entity.getExpirationProcessedAt());
            return ExpirationResult.builder()
                    .success(true)
                    .packageId(packageId)
                    .studentId(entity.getStudentId())
                    .hoursExpired(Hours.ZERO)
                    .processedAt(entity.getExpirationProcessedAt())
                    .auditLog(String.format("Package %s already expired at %s", packageId, entity.getExpirationProcessedAt()))
                    .build();
        }

        HourPackage hourPackage = entity.toDomain();
        if (hourPackage.getStatus() != PackageStatus.COMPLETED) {
            throw new IllegalStateException(String.format(
                    "Package %s is %s; only completed packages expire", packageId, hourPackage.getStatus()));
        }
        if (!hourPackage.isExpiredAt(now)) {
            throw new IllegalStateException("Package " + packageId + " has not expired");
        }

        // FIFO attribution does not cap a package's consumption, so the balance bounds what can be removed
        StudentBalanceEntity balance = balanceService.findOrCreateForUpdate(entity.getStudentId());
        BigDecimal removable = balance.getRemainingHours().max(BigDecimal.ZERO);
        BigDecimal hoursToExpire = Hours.normalize(Hours.min(unusedHours(hourPackage), removable));

        if (Hours.isPositive(hoursToExpire)) {
            balance.expire(hoursToExpire);
            balanceService.save(balance);
        }
        entity.markExpirationProcessed(now);
        packageRepository.save(entity);

        String auditLog = String.format(
                "Package %s expired for student %s. %s hours expired. Processed at %s",
                packageId, entity.getStudentId(), hoursToExpire, now);
        log.info(auditLog);

        return ExpirationResult.builder()
                .success(true)
                .packageId(packageId)
                .studentId(entity.getStudentId())
                .hoursExpired(hoursToExpire)
                .processedAt(now)
                .auditLog(auditLog)
                .build();
    }
}
