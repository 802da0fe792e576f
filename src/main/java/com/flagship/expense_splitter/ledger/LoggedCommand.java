package com.flagship.expense_splitter.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The operation that produced a log entry.
 *
 * Stored next to the balance change so that log listings can explain each entry, and
 * serialized with a {@code type} discriminator so every store can read it back.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SplitCommand.class, name = SplitCommand.COMMAND_TYPE),
    @JsonSubTypes.Type(value = PaymentCommand.class, name = PaymentCommand.COMMAND_TYPE),
    @JsonSubTypes.Type(value = SettlementCommand.class, name = SettlementCommand.COMMAND_TYPE)
})
public interface LoggedCommand {

    /**
     * Discriminator, also used as the metrics/log label.
     */
    @JsonIgnore
    String getCommandType();

    /**
     * One-line human readable summary, amounts rendered in the group's currency.
     */
    String describe(CurrencyCode currency);
}
