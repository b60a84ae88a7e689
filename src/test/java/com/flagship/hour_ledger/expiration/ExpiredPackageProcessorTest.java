package com.flagship.hour_ledger.expiration;

import com.flagship.hour_ledger.ledger.HourConsumptionRepository;
import com.flagship.hour_ledger.ledger.StudentBalanceEntity;
import com.flagship.hour_ledger.ledger.StudentBalanceService;
import com.flagship.hour_ledger.purchase.HourPackage;
import com.flagship.hour_ledger.purchase.HourPackageEntity;
import com.flagship.hour_ledger.purchase.HourPackageRepository;
import com.flagship.hour_ledger.purchase.PackageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpiredPackageProcessorTest {

    @Mock
    private HourPackageRepository packageRepository;

    @Mock
    private HourConsumptionRepository consumptionRepository;

    @Mock
    private StudentBalanceService balanceService;

    private ExpiredPackageProcessor processor;
    private final UUID studentId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        processor = new ExpiredPackageProcessor(packageRepository, consumptionRepository, balanceService);
    }

    private HourPackageEntity stored(Instant expiresAt, boolean completed) {
        HourPackage hourPackage = HourPackage.create(UUID.randomUUID(), studentId, PackageType.PACKAGE,
                new BigDecimal("10.00"), new BigDecimal("250.00"), expiresAt, null);
        HourPackageEntity entity = HourPackageEntity.fromDomain(completed ? hourPackage.complete() : hourPackage, "{}");
        when(packageRepository.findByIdForUpdate(entity.getId())).thenReturn(Optional.of(entity));
        return entity;
    }

    private StudentBalanceEntity balance(String purchased, String consumed) {
        StudentBalanceEntity balance = StudentBalanceEntity.open(studentId);
        balance.credit(new BigDecimal(purchased), new BigDecimal("250.00"));
        if (new BigDecimal(consumed).signum() > 0) {
            balance.consume(new BigDecimal(consumed));
        }
        when(balanceService.findOrCreateForUpdate(studentId)).thenReturn(balance);
        return balance;
    }

    private Instant yesterday() {
        return Instant.now().minus(Duration.ofDays(1));
    }

    @Test
    @DisplayName("Unused hours of an expired package leave the purchased total")
    void testExpire_RemovesUnusedHours() {
        HourPackageEntity entity = stored(yesterday(), true);
        StudentBalanceEntity balance = balance("10", "4");
        when(consumptionRepository.sumActiveHoursByPackage(entity.getId())).thenReturn(new BigDecimal("4.00"));

        ExpirationResult result = processor.expire(entity.getId());

        assertTrue(result.isSuccess());
        assertEquals(new BigDecimal("6.00"), result.getHoursExpired());
        assertEquals(studentId, result.getStudentId());
        assertEquals(new BigDecimal("4.00"), balance.getHoursPurchased());
        assertEquals(0, balance.getRemainingHours().signum());
        assertTrue(entity.isExpirationProcessed());
        assertTrue(result.getAuditLog().contains("6.00 hours expired"));
        verify(balanceService).save(balance);
    }

    @Test
    @DisplayName("Hours to expire never exceed what the balance has left")
    void testExpire_CappedByRemainingBalance() {
        HourPackageEntity entity = stored(yesterday(), true);
        StudentBalanceEntity balance = balance("10", "7");
        when(consumptionRepository.sumActiveHoursByPackage(entity.getId())).thenReturn(BigDecimal.ZERO);

        ExpirationResult result = processor.expire(entity.getId());

        assertEquals(new BigDecimal("3.00"), result.getHoursExpired());
        assertEquals(0, balance.getRemainingHours().signum());
    }

    @Test
    @DisplayName("Second run on the same package expires nothing")
    void testExpire_AlreadyProcessed() {
        HourPackageEntity entity = stored(yesterday(), true);
        entity.markExpirationProcessed(Instant.now());

        ExpirationResult result = processor.expire(entity.getId());

        assertTrue(result.isSuccess());
        assertEquals(0, result.getHoursExpired().signum());
        verifyNoInteractions(balanceService, consumptionRepository);
    }

    @Test
    @DisplayName("Packages that are not expired or not completed are refused")
    void testExpire_RejectsIneligiblePackages() {
        HourPackageEntity active = stored(Instant.now().plus(Duration.ofDays(3)), true);
        HourPackageEntity pending = stored(yesterday(), false);

        assertThrows(IllegalStateException.class, () -> processor.expire(active.getId()));
        assertThrows(IllegalStateException.class, () -> processor.expire(pending.getId()));
        assertFalse(active.isExpirationProcessed());
        verifyNoInteractions(balanceService);
    }

    @Test
    @DisplayName("Unused hours ignore refunded consumption and never go negative")
    void testUnusedHours() {
        HourPackage hourPackage = HourPackage.create(UUID.randomUUID(), studentId, PackageType.PACKAGE,
                new BigDecimal("5.00"), BigDecimal.TEN, null, null);
        when(consumptionRepository.sumActiveHoursByPackage(hourPackage.getId())).thenReturn(new BigDecimal("7.50"));

        assertEquals(new BigDecimal("0.00"), processor.unusedHours(hourPackage));
    }
}
