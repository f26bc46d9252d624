package com.flagship.finance_ledger.undo;

import lombok.Value;

@Value
public class AddBudgetAction implements Action {
    String category;

    @Override
    public ActionType getType() {
        return ActionType.ADD_BUDGET;
    }
}
