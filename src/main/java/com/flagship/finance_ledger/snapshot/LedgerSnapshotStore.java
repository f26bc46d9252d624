package com.flagship.finance_ledger.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_ledger.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file holding the latest ledger snapshot.
 *
 * Writes go to a sibling temp file first and are then moved over the target,
 * so a reader never sees a half-written snapshot.
 */
@Component
@Slf4j
public class LedgerSnapshotStore {

    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final Path path;

    public LedgerSnapshotStore(ObjectMapper objectMapper, LedgerProperties properties) {
        this.objectMapper = objectMapper;
        this.enabled = properties.snapshot().enabled();
        this.path = Path.of(properties.snapshot().path());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return empty when snapshots are disabled or no file exists yet
     */
    public Optional<LedgerSnapshot> read() {
        if (!enabled || !Files.exists(path)) {
            return Optional.empty();
        }
        try {
            LedgerSnapshot snapshot = objectMapper.readValue(path.toFile(), LedgerSnapshot.class);
            log.info("Read ledger snapshot: path={}, capturedAt={}", path, snapshot.getCapturedAt());
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ledger snapshot " + path, e);
        }
    }

    public void write(LedgerSnapshot snapshot) {
        if (!enabled) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote ledger snapshot: path={}, transactions={}", path, snapshot.getTransactions().size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ledger snapshot " + path, e);
        }
    }
}
