package com.flagship.finance_ledger.budget;

import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Spending limit for one category.
 *
 * {@code spent} is derived: it always equals the sum of the non-deleted
 * expense transactions in the category. Changes produce a new instance.
 */
@Value
@With
public class Budget {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    String category;
    BigDecimal limit;
    BigDecimal spent;

    /**
     * {@code spent / limit * 100}, rounded to two places; zero when there is no limit.
     */
    public BigDecimal getPercentUsed() {
        if (limit.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return spent.multiply(HUNDRED).divide(limit, 2, RoundingMode.HALF_UP);
    }

    /**
     * Recomputed on every call so it always reflects the latest spent value.
     */
    public AlertLevel getAlertLevel() {
        return AlertLevel.forPercent(getPercentUsed());
    }
}
