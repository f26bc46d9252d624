package com.flagship.finance_ledger.undo;

import lombok.Value;

@Value
public class AddBillAction implements Action {
    String billId;

    @Override
    public ActionType getType() {
        return ActionType.ADD_BILL;
    }
}
