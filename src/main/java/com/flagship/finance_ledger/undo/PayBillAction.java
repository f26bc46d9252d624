package com.flagship.finance_ledger.undo;

import lombok.Value;

@Value
public class PayBillAction implements Action {
    String billId;
    boolean previouslyPaid;

    @Override
    public ActionType getType() {
        return ActionType.PAY_BILL;
    }
}
