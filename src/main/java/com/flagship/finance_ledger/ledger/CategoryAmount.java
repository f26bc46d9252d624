package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Expense total for one category.
 */
@Value
public class CategoryAmount {
    String category;
    BigDecimal totalAmount;
}
