package com.flagship.finance_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a ledger transaction.
 * Only expenses count towards category spending and budgets.
 */
public enum TransactionType {
    INCOME("income"),
    EXPENSE("expense");

    private final String wireName;

    TransactionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a transaction kind from its wire name ("income" / "expense").
     *
     * @throws InvalidInputException if the value is not a recognized kind
     */
    @JsonCreator
    public static TransactionType fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TransactionType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidInputException(
            String.format("Unrecognized transaction type '%s'. Expected 'income' or 'expense'.", value));
    }
}
