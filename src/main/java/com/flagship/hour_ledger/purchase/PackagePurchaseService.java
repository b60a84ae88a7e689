package com.flagship.hour_ledger.purchase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.hour_ledger.ledger.StudentBalanceEntity;
import com.flagship.hour_ledger.ledger.StudentBalanceService;
import com.flagship.hour_ledger.observability.CorrelationContext;
import com.flagship.hour_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records hour package purchases and applies payment gateway outcomes to them.
 *
 * State machine:
 * - PENDING → COMPLETED (hours and amount credited to the student balance)
 * - PENDING → FAILED
 * - Terminal states (COMPLETED, FAILED) cannot transition
 *
 * Completion and the balance credit happen in one transaction with the package row
 * locked, so a gateway confirmation delivered twice credits the balance once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PackagePurchaseService {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final HourPackageRepository packageRepository;
    private final StudentBalanceService balanceService;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Records a package in PENDING status when the student starts paying for it.
     *
     * Idempotent on the payment reference: a second call with the same reference returns
     * the package recorded by the first.
     *
     * @throws IllegalArgumentException if hours are not positive, the amount is negative,
     *         or a subscription is given an expiry
     */
    @Transactional
    public HourPackage recordPendingPurchase(UUID studentId, PackageType type, BigDecimal hours,
                                            BigDecimal amount, Instant expiresAt,
                                            String paymentReference, Map<String, Object> metadata) {
        if (studentId == null) {
            throw new IllegalArgumentException("Student ID is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Package type is required");
        }
        if (hours == null || hours.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Package hours must be positive");
        }
        if (amount == null || amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Package amount must not be negative");
        }
        if (type == PackageType.SUBSCRIPTION && expiresAt != null) {
            throw new IllegalArgumentException("Subscription packages do not expire");
        }

        if (paymentReference != null) {
            Optional<HourPackageEntity> existing = packageRepository.findByPaymentReference(paymentReference);
            if (existing.isPresent()) {
                log.info("Purchase already recorded for payment reference {}: packageId={}",
                        paymentReference, existing.get().getId());
                ledgerMetrics.recordPurchase("duplicate");
                return existing.get().toDomain();
            }
        }

        HourPackage hourPackage = HourPackage.create(UUID.randomUUID(), studentId, type,
                hours, amount, expiresAt, paymentReference);
        HourPackageEntity saved = packageRepository.save(
                HourPackageEntity.fromDomain(hourPackage, writeMetadata(metadata)));

        ledgerMetrics.recordPurchase("pending");
        log.info("Recorded pending {} purchase for student {}: packageId={}, hours={}, amount={}",
                type, studentId, saved.getId(), hours, amount);
        return saved.toDomain();
    }

    /**
     * Completes a pending package and credits its hours and amount to the student's balance.
     * Completing an already completed package returns it unchanged.
     *
     * @throws IllegalArgumentException if the package does not exist
     * @throws IllegalStateException if the package has failed
     */
    @Transactional
    public HourPackage completePurchase(UUID packageId) {
        MDC.put(CorrelationContext.PACKAGE_ID_MDC_KEY, String.valueOf(packageId));
        try {
            HourPackageEntity entity = packageRepository.findByIdForUpdate(packageId)
                    .orElseThrow(() -> new IllegalArgumentException("Package not found: " + packageId));

            if (entity.getStatus() == PackageStatus.COMPLETED) {
                log.info("Package already completed");
                ledgerMetrics.recordPurchase("already_completed");
                return entity.toDomain();
            }

            HourPackage completed = entity.toDomain().complete();
            entity.updateFromDomain(completed);

            StudentBalanceEntity balance = balanceService.findOrCreateForUpdate(entity.getStudentId());
            balance.credit(entity.getHoursIncluded(), entity.getAmount());
            balanceService.save(balance);
            HourPackageEntity saved = packageRepository.save(entity);

            ledgerMetrics.recordPurchase("completed");
            log.info("Package completed: studentId={}, hours={}, purchasedTotal={}",
                    entity.getStudentId(), entity.getHoursIncluded(), balance.getHoursPurchased());
            return saved.toDomain();

        } catch (RuntimeException e) {
            ledgerMetrics.recordPurchase("complete_error");
            log.error("Package completion failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PACKAGE_ID_MDC_KEY);
        }
    }

    /**
     * Marks a pending package as failed. The balance is not touched.
     *
     * @throws IllegalStateException if the package is not PENDING
     */
    @Transactional
    public HourPackage failPurchase(UUID packageId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        HourPackageEntity entity = packageRepository.findByIdForUpdate(packageId)
                .orElseThrow(() -> new IllegalArgumentException("Package not found: " + packageId));

        HourPackage failed = entity.toDomain().fail(reason);
        entity.updateFromDomain(failed);
        HourPackageEntity saved = packageRepository.save(entity);

        ledgerMetrics.recordPurchase("failed");
        log.warn("Package {} failed: {}", packageId, reason);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<HourPackage> getPackage(UUID packageId) {
        return packageRepository.findById(packageId)
                .map(HourPackageEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<HourPackage> getPackagesForStudent(UUID studentId) {
        return packageRepository.findByStudentIdOrderByCreatedAtAsc(studentId).stream()
                .map(HourPackageEntity::toDomain)
                .toList();
    }

    /**
     * Completed, unexpired packages in the order hours are drawn from them.
     */
    @Transactional(readOnly = true)
    public List<HourPackage> getActivePackages(UUID studentId) {
        return packageRepository.findEligiblePackages(studentId, Instant.now()).stream()
                .map(HourPackageEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public Map<String, Object> getMetadata(UUID packageId) {
        HourPackageEntity entity = packageRepository.findById(packageId)
                .orElseThrow(() -> new IllegalArgumentException("Package not found: " + packageId));
        try {
            return objectMapper.readValue(entity.getMetadata(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored metadata of package " + packageId + " is not valid JSON", e);
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Package metadata cannot be serialized", e);
        }
    }
}
