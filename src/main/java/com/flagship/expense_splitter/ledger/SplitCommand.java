package com.flagship.expense_splitter.ledger;

import com.flagship.expense_splitter.split.Target;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An expense split between members.
 */
@Value
public class SplitCommand implements LoggedCommand {
    String description;
    long amount;
    List<Target> payers;
    List<Target> receivers;
    boolean balanceRest;

    public static final String COMMAND_TYPE = "split";

    @Override
    public String getCommandType() {
        return COMMAND_TYPE;
    }

    @Override
    public String describe(CurrencyCode currency) {
        String to = receivers.isEmpty() ? "everyone" : render(receivers, currency);
        String label = description == null || description.isBlank() ? "Expense" : description;
        return String.format("%s: %s paid by %s for %s%s",
            label, currency.format(amount), render(payers, currency), to,
            balanceRest ? " (rest balanced)" : "");
    }

    private static String render(List<Target> targets, CurrencyCode currency) {
        return targets.stream()
            .map(target -> target.isWildcard()
                ? target.getMember()
                : target.getMember() + " " + currency.format(target.getAmount()))
            .collect(Collectors.joining(", "));
    }
}
