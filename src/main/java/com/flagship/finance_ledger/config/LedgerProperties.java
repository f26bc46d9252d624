package com.flagship.finance_ledger.config;

import com.flagship.finance_ledger.ledger.FinanceLedger;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.List;

/**
 * Ledger settings bound from the {@code ledger.*} namespace.
 * Missing sections fall back to the ledger's built-in defaults.
 */
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
        Undo undo,
        Categories categories,
        Autocomplete autocomplete,
        Snapshot snapshot
) {

    @ConstructorBinding
    public LedgerProperties {
        undo = undo != null ? undo : new Undo(null);
        categories = categories != null ? categories : new Categories(null, null);
        autocomplete = autocomplete != null ? autocomplete : new Autocomplete(null);
        snapshot = snapshot != null ? snapshot : new Snapshot(null, null);
    }

    public record Undo(Integer capacity) {
        public Undo {
            capacity = capacity != null ? capacity : FinanceLedger.DEFAULT_UNDO_CAPACITY;
            if (capacity <= 0) {
                throw new IllegalArgumentException("ledger.undo.capacity must be positive");
            }
        }
    }

    public record Categories(Integer bucketCount, List<String> defaults) {
        public Categories {
            bucketCount = bucketCount != null ? bucketCount : FinanceLedger.DEFAULT_BUCKET_COUNT;
            if (bucketCount <= 0) {
                throw new IllegalArgumentException("ledger.categories.bucket-count must be positive");
            }
            defaults = defaults != null ? List.copyOf(defaults) : FinanceLedger.DEFAULT_CATEGORIES;
        }
    }

    public record Autocomplete(Integer maxResults) {
        public Autocomplete {
            maxResults = maxResults != null ? maxResults : 10;
            if (maxResults <= 0) {
                throw new IllegalArgumentException("ledger.autocomplete.max-results must be positive");
            }
        }
    }

    /**
     * File snapshot written by the command boundary. Off by default.
     */
    public record Snapshot(Boolean enabled, String path) {
        public Snapshot {
            enabled = enabled != null && enabled;
            path = path != null && !path.isBlank() ? path : "data/ledger-snapshot.json";
        }
    }
}
