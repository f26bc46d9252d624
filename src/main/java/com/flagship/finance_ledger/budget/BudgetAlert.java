package com.flagship.finance_ledger.budget;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A budget whose spending has crossed at least the caution threshold.
 */
@Value
public class BudgetAlert {
    String category;
    AlertLevel level;
    BigDecimal percentUsed;
    BigDecimal spent;
    BigDecimal limit;
    String message;

    public static BudgetAlert from(Budget budget) {
        AlertLevel level = budget.getAlertLevel();
        return new BudgetAlert(
            budget.getCategory(),
            level,
            budget.getPercentUsed(),
            budget.getSpent(),
            budget.getLimit(),
            messageFor(level, budget)
        );
    }

    private static String messageFor(AlertLevel level, Budget budget) {
        return switch (level) {
            case EXCEEDED -> String.format("Budget exceeded! You've spent $%s of $%s",
                budget.getSpent().toBigInteger(), budget.getLimit().toBigInteger());
            case WARNING -> "Warning: 80%+ of budget used";
            case CAUTION -> "Caution: 50%+ of budget used";
            case NORMAL -> "Within budget";
        };
    }
}
