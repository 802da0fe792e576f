package com.flagship.expense_splitter.ledger;

import com.flagship.expense_splitter.split.TransactionChange;
import lombok.Value;

import java.time.Instant;

/**
 * One applied operation of a group: what was requested and how it moved the balances.
 *
 * The change is kept verbatim so that the entry can be undone.
 */
@Value
public class LogEntry {
    LoggedCommand command;
    TransactionChange change;
    Instant recordedAt;

    public TransactionChange reversedChange() {
        return change.reversed();
    }
}
