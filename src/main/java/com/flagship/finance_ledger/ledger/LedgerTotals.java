package com.flagship.finance_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Whole-ledger statistics. Balance is income minus expenses.
 */
@Value
@Builder
public class LedgerTotals {
    BigDecimal totalIncome;
    BigDecimal totalExpenses;
    BigDecimal balance;
    int transactionCount;
    int budgetCount;
    int billCount;
}
