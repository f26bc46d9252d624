package com.flagship.finance_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Income, expenses and per-category expense breakdown for one {@code YYYY-MM}.
 */
@Value
@Builder
public class MonthlySummary {
    String month;
    BigDecimal totalIncome;
    BigDecimal totalExpenses;
    BigDecimal netSavings;
    int transactionCount;
    List<CategoryAmount> categoryBreakdown;
}
