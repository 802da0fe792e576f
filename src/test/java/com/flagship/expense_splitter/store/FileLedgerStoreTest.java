package com.flagship.expense_splitter.store;

import com.flagship.expense_splitter.config.JacksonConfig;
import com.flagship.expense_splitter.ledger.LedgerSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

import static org.junit.jupiter.api.Assertions.*;

class FileLedgerStoreTest {

    @TempDir
    Path tempDir;

    private FileLedgerStore storeAt(Path path) {
        return new FileLedgerStore(JacksonConfig.createObjectMapper(), path);
    }

    @Test
    @DisplayName("Missing file reads as an empty ledger")
    void testMissingFile() {
        LedgerSnapshot snapshot = storeAt(tempDir.resolve("ledger.json.gz")).load();

        assertTrue(snapshot.getGroups().isEmpty());
        assertNull(snapshot.getCurrentGroup());
    }

    @Test
    @DisplayName("Groups, balances, log entries and current group survive a round trip")
    void testRoundTrip() {
        Path path = tempDir.resolve("nested").resolve("ledger.json.gz");
        LedgerSnapshot snapshot = LedgerSnapshotFixtures.populatedSnapshot();

        storeAt(path).save(snapshot);
        LedgerSnapshot loaded = storeAt(path).load();

        LedgerSnapshotFixtures.assertSameLedger(snapshot, loaded);
    }

    @Test
    @DisplayName("File is gzip-compressed JSON and no temporary files are left behind")
    void testFileFormat() throws IOException {
        Path path = tempDir.resolve("ledger.json.gz");
        FileLedgerStore store = storeAt(path);

        store.save(LedgerSnapshotFixtures.populatedSnapshot());
        store.save(LedgerSnapshotFixtures.populatedSnapshot());

        try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
            String json = new String(in.readAllBytes());
            assertTrue(json.contains("\"currentGroup\":\"flat\""));
            assertTrue(json.contains("\"type\":\"split\""));
        }
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(path), files.toList());
        }
    }

    @Test
    @DisplayName("Corrupt files raise LedgerStorageException")
    void testCorruptFile() throws IOException {
        Path path = tempDir.resolve("ledger.json.gz");
        Files.writeString(path, "not gzip");

        assertThrows(LedgerStorageException.class, () -> storeAt(path).load());
    }
}
