package com.flagship.hour_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Typed settings for the hour ledger, bound from the {@code ledger.*} namespace.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /**
     * Smallest difference between booked and actual session duration that triggers
     * an hour adjustment.
     */
    @NotNull
    @DecimalMin(value = "0.00", inclusive = false)
    private BigDecimal adjustmentThreshold = new BigDecimal("0.1");

    /**
     * Look-ahead window used when listing packages that are about to expire.
     */
    @Min(1)
    private int expiringSoonDays = 7;

    @Valid
    private Expiration expiration = new Expiration();

    @Getter
    @Setter
    public static class Expiration {

        /**
         * Hours after expiry before a package's unused hours are removed from the balance.
         */
        @Min(0)
        private int graceHours = 24;

        @Valid
        private Scheduler scheduler = new Scheduler();
    }

    @Getter
    @Setter
    public static class Scheduler {

        private boolean enabled = false;

        @NotBlank
        private String cron = "0 15 3 * * *";
    }
}
