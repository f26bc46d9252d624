package com.flagship.finance_ledger.config;

import com.flagship.finance_ledger.ledger.FinanceLedger;
import com.flagship.finance_ledger.snapshot.LedgerSnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the single in-process ledger instance.
 *
 * A stored snapshot is replayed here, before the ledger is handed to the
 * dispatcher, so no command ever sees a half-loaded ledger.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Slf4j
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FinanceLedger financeLedger(LedgerProperties properties, Clock clock, LedgerSnapshotStore snapshotStore) {
        log.info("Creating ledger: undoCapacity={}, categoryBuckets={}, defaultCategories={}",
                properties.undo().capacity(),
                properties.categories().bucketCount(),
                properties.categories().defaults().size());
        FinanceLedger ledger = new FinanceLedger(
                properties.undo().capacity(),
                properties.categories().bucketCount(),
                properties.categories().defaults(),
                clock);

        snapshotStore.read().ifPresent(snapshot -> {
            snapshot.replayInto(ledger);
            log.info("Restored ledger from snapshot: transactions={}, budgets={}, bills={}",
                    ledger.getTransactionCount(), ledger.getBudgetCount(), ledger.getBillCount());
        });
        return ledger;
    }
}
