package com.flagship.expense_splitter.split;

import lombok.Value;

import java.util.List;

/**
 * Outcome of allocating one expense: the balance change plus the parsed directives that
 * produced it, kept for the log entry.
 */
@Value
public class Allocation {
    TransactionChange change;
    List<Target> payers;
    List<Target> receivers;
}
