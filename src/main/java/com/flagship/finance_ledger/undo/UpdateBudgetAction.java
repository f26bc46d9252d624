package com.flagship.finance_ledger.undo;

import lombok.Value;

import java.math.BigDecimal;

/**
 * The limit of an existing budget was replaced. Only the limit is restored;
 * spent is derived from transactions.
 */
@Value
public class UpdateBudgetAction implements Action {
    String category;
    BigDecimal previousLimit;

    @Override
    public ActionType getType() {
        return ActionType.UPDATE_BUDGET;
    }
}
