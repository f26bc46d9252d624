package com.flagship.finance_ledger.command;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Failure kinds a command can report.
 *
 * Only INVALID_INPUT is a rejection. NOT_FOUND and LOG_EMPTY are expected,
 * non-exceptional outcomes the caller checks for.
 */
public enum ErrorKind {
    INVALID_INPUT,
    NOT_FOUND,
    LOG_EMPTY;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
