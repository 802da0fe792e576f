package com.flagship.expense_splitter.ledger;

import com.flagship.expense_splitter.settlement.SettlementTransaction;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A confirmed settlement plan, applied as a whole.
 */
@Value
public class SettlementCommand implements LoggedCommand {
    List<SettlementTransaction> transactions;

    public static final String COMMAND_TYPE = "settle";

    @Override
    public String getCommandType() {
        return COMMAND_TYPE;
    }

    @Override
    public String describe(CurrencyCode currency) {
        return "Settlement: " + transactions.stream()
            .map(tx -> String.format("%s -> %s %s", tx.getFrom(), tx.getTo(), currency.format(tx.getAmount())))
            .collect(Collectors.joining(", "));
    }
}
