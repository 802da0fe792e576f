package com.flagship.expense_splitter.settlement;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_splitter.ledger.exception.SplitterException;
import lombok.Value;

/**
 * A recommended payment: {@code from} pays {@code amount} minor units to {@code to}.
 */
@Value
public class SettlementTransaction {
    String from;
    String to;
    long amount;

    @JsonCreator
    public SettlementTransaction(@JsonProperty("from") String from,
                                 @JsonProperty("to") String to,
                                 @JsonProperty("amount") long amount) {
        if (amount <= 0) {
            throw SplitterException.semantic("Settlement amount must be positive, got " + amount);
        }
        if (from == null || from.equals(to)) {
            throw SplitterException.semantic("Settlement needs two different members");
        }
        this.from = from;
        this.to = to;
        this.amount = amount;
    }
}
