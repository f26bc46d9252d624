package com.flagship.finance_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A single income or expense entry.
 *
 * Immutable after creation. Every index references the same instance; none of
 * them owns it. Dates are {@code YYYY-MM-DD} strings so that string order is
 * calendar order.
 */
@Value
public class Transaction {
    String id;
    TransactionType type;
    BigDecimal amount;
    String category;
    String description;
    String date;

    @JsonIgnore
    public boolean isExpense() {
        return type == TransactionType.EXPENSE;
    }

    @JsonIgnore
    public boolean isIncome() {
        return type == TransactionType.INCOME;
    }
}
