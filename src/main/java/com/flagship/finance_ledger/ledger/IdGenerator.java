package com.flagship.finance_ledger.ledger;

import java.time.Clock;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Per-ledger identifier source.
 *
 * Identifiers look like {@code txn_<epochSeconds>_<counter>}. The counter is
 * owned by the generator instance, so two ledgers never share state. Ids are
 * unique per ledger; they are not guaranteed to sort in creation order.
 */
public class IdGenerator {

    private static final Pattern COUNTER = Pattern.compile("\\d{1,18}");

    private final String prefix;
    private final Clock clock;
    private long counter;

    public IdGenerator(String prefix, Clock clock) {
        this.prefix = prefix;
        this.clock = clock;
    }

    /**
     * Next id that {@code inUse} does not report as taken.
     */
    public String next(Predicate<String> inUse) {
        String id;
        do {
            counter++;
            id = prefix + "_" + clock.instant().getEpochSecond() + "_" + counter;
        } while (inUse.test(id));
        return id;
    }

    /**
     * Moves the counter past an id issued elsewhere, e.g. one replayed from a
     * snapshot. Ids with another prefix or shape are ignored.
     */
    public void advancePast(String id) {
        if (id == null || !id.startsWith(prefix + "_")) {
            return;
        }
        String suffix = id.substring(id.lastIndexOf('_') + 1);
        if (COUNTER.matcher(suffix).matches()) {
            counter = Math.max(counter, Long.parseLong(suffix));
        }
    }
}
