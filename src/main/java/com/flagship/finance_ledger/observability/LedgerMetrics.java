package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.ledger.FinanceLedger;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger commands.
 *
 * Metrics exposed:
 * - ledger.commands: Counter of dispatched commands, tagged by command and outcome
 * - ledger.command.duration: Timer per command
 * - ledger.undo: Counter of reversed actions, tagged by action type
 * - ledger.transactions / ledger.budgets / ledger.bills / ledger.undo.depth: Gauges
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one dispatched command with its outcome ("success", "invalid_input", ...).
     */
    public void recordCommand(String command, String outcome) {
        registry.counter("ledger.commands",
                "command", sanitizeTag(command),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordCommandLatency(String command, Duration duration) {
        Timer.builder("ledger.command.duration")
                .description("Time spent executing a ledger command")
                .tag("command", sanitizeTag(command))
                .register(registry)
                .record(duration);
    }

    public void recordUndo(String actionType) {
        registry.counter("ledger.undo", "action", sanitizeTag(actionType)).increment();
    }

    /**
     * Registers size gauges. Gauges read plain counters, never traverse an index.
     */
    public void registerLedgerGauges(FinanceLedger ledger) {
        Gauge.builder("ledger.transactions", ledger, FinanceLedger::getTransactionCount)
                .description("Transactions currently in the ledger")
                .register(registry);
        Gauge.builder("ledger.budgets", ledger, FinanceLedger::getBudgetCount)
                .description("Budgets currently defined")
                .register(registry);
        Gauge.builder("ledger.bills", ledger, FinanceLedger::getBillCount)
                .description("Bills in the schedule")
                .register(registry);
        Gauge.builder("ledger.undo.depth", ledger, FinanceLedger::getUndoDepth)
                .description("Actions that can still be undone")
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
