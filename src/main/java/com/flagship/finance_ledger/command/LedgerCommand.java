package com.flagship.finance_ledger.command;

import java.util.Optional;

/**
 * Named commands accepted at the ledger boundary.
 * Mutating commands are the ones that may change ledger state.
 */
public enum LedgerCommand {
    ADD_TRANSACTION("add_transaction", true),
    DELETE_TRANSACTION("delete_transaction", true),
    GET_TRANSACTIONS("get_transactions", false),
    GET_RECENT_TRANSACTIONS("get_recent_transactions", false),
    GET_TRANSACTIONS_BY_DATE("get_transactions_by_date", false),
    SET_BUDGET("set_budget", true),
    GET_BUDGETS("get_budgets", false),
    GET_ALERTS("get_alerts", false),
    ADD_BILL("add_bill", true),
    GET_BILLS("get_bills", false),
    PAY_BILL("pay_bill", true),
    DELETE_BILL("delete_bill", true),
    GET_TOP_EXPENSES("get_top_expenses", false),
    GET_TOP_CATEGORIES("get_top_categories", false),
    GET_MONTHLY_SUMMARY("get_monthly_summary", false),
    GET_CATEGORY_SUGGESTIONS("get_category_suggestions", false),
    GET_PAYEE_SUGGESTIONS("get_payee_suggestions", false),
    GET_ALL_CATEGORIES("get_all_categories", false),
    UNDO("undo", true),
    GET_DASHBOARD("get_dashboard", false);

    private final String wireName;
    private final boolean mutating;

    LedgerCommand(String wireName, boolean mutating) {
        this.wireName = wireName;
        this.mutating = mutating;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isMutating() {
        return mutating;
    }

    public static Optional<LedgerCommand> fromWireName(String name) {
        for (LedgerCommand command : values()) {
            if (command.wireName.equals(name)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
