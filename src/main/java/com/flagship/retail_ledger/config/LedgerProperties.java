package com.flagship.retail_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Settings under {@code ledger.*}.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /**
     * Whether a CREDIT return may push a counterparty balance below zero (a credit note).
     */
    private boolean allowNegativeReturnCredit = true;

    /**
     * Upper bound on rows in one bulk request.
     */
    @Min(1)
    @Max(5000)
    private int bulkMaxRows = 500;
}
