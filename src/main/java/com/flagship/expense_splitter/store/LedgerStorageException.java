package com.flagship.expense_splitter.store;

/**
 * The ledger could not be read from or written to its store.
 */
public class LedgerStorageException extends RuntimeException {

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
