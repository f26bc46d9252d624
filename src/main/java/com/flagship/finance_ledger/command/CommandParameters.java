package com.flagship.finance_ledger.command;

import com.flagship.finance_ledger.ledger.InvalidInputException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/**
 * Named-field parameter bundle of a command.
 * Missing or malformed required fields are rejected as invalid input.
 */
public class CommandParameters {

    private final Map<String, Object> values;

    public CommandParameters(Map<String, Object> values) {
        this.values = values != null ? values : Collections.emptyMap();
    }

    public String requireString(String name) {
        Object value = values.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new InvalidInputException("Missing required parameter '" + name + "'");
        }
        return value.toString();
    }

    public String optionalString(String name, String defaultValue) {
        Object value = values.get(name);
        return value == null ? defaultValue : value.toString();
    }

    /**
     * Accepts a JSON number or a numeric string.
     */
    public BigDecimal requireAmount(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new InvalidInputException("Missing required parameter '" + name + "'");
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Parameter '" + name + "' is not a number: " + value);
        }
    }

    public int optionalInt(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return new BigDecimal(value.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidInputException("Parameter '" + name + "' is not an integer: " + value);
        }
    }
}
