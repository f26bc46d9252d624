package com.flagship.finance_ledger.bill;

import lombok.Value;
import lombok.With;

import java.math.BigDecimal;

/**
 * An upcoming payment held in the bill schedule.
 */
@Value
@With
public class Bill {
    String id;
    String name;
    BigDecimal amount;
    String dueDate;
    String category;
    boolean paid;

    /**
     * Unpaid and due strictly before {@code referenceDate}. Never stored.
     */
    public boolean isOverdueOn(String referenceDate) {
        return !paid && dueDate.compareTo(referenceDate) < 0;
    }
}
