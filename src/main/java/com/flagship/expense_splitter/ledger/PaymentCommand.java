package com.flagship.expense_splitter.ledger;

import lombok.Value;

/**
 * A direct payment from one member to another.
 */
@Value
public class PaymentCommand implements LoggedCommand {
    long amount;
    String from;
    String to;

    public static final String COMMAND_TYPE = "pay";

    @Override
    public String getCommandType() {
        return COMMAND_TYPE;
    }

    @Override
    public String describe(CurrencyCode currency) {
        return String.format("Payment: %s paid %s to %s", from, currency.format(amount), to);
    }
}
