package com.flagship.expense_splitter.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_splitter.ledger.LedgerSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Keeps the ledger in process, as serialized JSON so callers never share state with the store.
 *
 * Lost on restart. Meant for tests and demos.
 */
@Component
@ConditionalOnProperty(name = "splitter.storage.type", havingValue = InMemoryLedgerStore.TYPE)
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    public static final String TYPE = "memory";

    private final ObjectMapper objectMapper;
    private byte[] state;

    public InMemoryLedgerStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized LedgerSnapshot load() {
        if (state == null) {
            return LedgerSnapshot.empty();
        }
        try {
            return objectMapper.readValue(state, LedgerSnapshot.class);
        } catch (IOException e) {
            throw new LedgerStorageException("Failed to read in-memory ledger", e);
        }
    }

    @Override
    public synchronized void save(LedgerSnapshot snapshot) {
        try {
            state = objectMapper.writeValueAsBytes(snapshot);
            log.debug("Stored ledger in memory: {} groups, {} bytes", snapshot.getGroups().size(), state.length);
        } catch (IOException e) {
            throw new LedgerStorageException("Failed to serialize ledger", e);
        }
    }

    @Override
    public String getStorageType() {
        return TYPE;
    }
}
