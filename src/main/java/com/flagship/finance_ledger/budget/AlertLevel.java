package com.flagship.finance_ledger.budget;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Classification of how much of a budget has been spent.
 */
public enum AlertLevel {
    /**
     * Below 50% of the limit.
     */
    NORMAL("normal", BigDecimal.ZERO),

    /**
     * 50% or more.
     */
    CAUTION("caution", BigDecimal.valueOf(50)),

    /**
     * 80% or more.
     */
    WARNING("warning", BigDecimal.valueOf(80)),

    /**
     * The limit has been reached or passed.
     */
    EXCEEDED("exceeded", BigDecimal.valueOf(100));

    private final String wireName;
    private final BigDecimal threshold;

    AlertLevel(String wireName, BigDecimal threshold) {
        this.wireName = wireName;
        this.threshold = threshold;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static AlertLevel forPercent(BigDecimal percentUsed) {
        if (percentUsed.compareTo(EXCEEDED.threshold) >= 0) {
            return EXCEEDED;
        }
        if (percentUsed.compareTo(WARNING.threshold) >= 0) {
            return WARNING;
        }
        if (percentUsed.compareTo(CAUTION.threshold) >= 0) {
            return CAUTION;
        }
        return NORMAL;
    }
}
