package com.flagship.expense_splitter.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_splitter.ledger.LedgerSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Stores the ledger as one gzip-compressed JSON file.
 *
 * Writes go to a temporary file next to the target, which is then moved into place, so a
 * crash mid-write leaves the previous state intact. A missing file reads as an empty ledger.
 */
@Component
@ConditionalOnProperty(name = "splitter.storage.type", havingValue = FileLedgerStore.TYPE)
@Slf4j
public class FileLedgerStore implements LedgerStore {

    public static final String TYPE = "file";

    private final ObjectMapper objectMapper;
    private final Path path;

    public FileLedgerStore(ObjectMapper objectMapper,
                           @Value("${splitter.storage.file.path}") Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    @Override
    public LedgerSnapshot load() {
        if (!Files.exists(path)) {
            log.info("No ledger file at {}, starting with an empty ledger", path);
            return LedgerSnapshot.empty();
        }
        try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
            return objectMapper.readValue(in, LedgerSnapshot.class);
        } catch (IOException e) {
            throw new LedgerStorageException("Failed to read ledger file " + path, e);
        }
    }

    @Override
    public void save(LedgerSnapshot snapshot) {
        Path temp = null;
        try {
            Path directory = path.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(temp))) {
                objectMapper.writeValue(out, snapshot);
            }
            moveIntoPlace(temp);
            log.debug("Wrote ledger file {} with {} groups", path, snapshot.getGroups().size());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new LedgerStorageException("Failed to write ledger file " + path, e);
        }
    }

    @Override
    public String getStorageType() {
        return TYPE;
    }

    public Path getPath() {
        return path;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to a plain replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary ledger file {}: {}", temp, e.getMessage());
        }
    }
}
