package com.flagship.expense_splitter.store;

import com.flagship.expense_splitter.ledger.LedgerSnapshot;

/**
 * Whole-state persistence for the ledger.
 *
 * Every operation loads the complete snapshot, changes it in memory and saves it back.
 * Implementations never hand out an object graph they keep internally.
 */
public interface LedgerStore {

    /**
     * @return the stored snapshot, or an empty one if nothing was saved yet
     * @throws LedgerStorageException if the stored state cannot be read
     */
    LedgerSnapshot load();

    /**
     * Replaces the stored state with the given snapshot.
     *
     * @throws LedgerStorageException if the state cannot be written
     */
    void save(LedgerSnapshot snapshot);

    /**
     * Value of {@code splitter.storage.type} that selects this store.
     */
    String getStorageType();
}
