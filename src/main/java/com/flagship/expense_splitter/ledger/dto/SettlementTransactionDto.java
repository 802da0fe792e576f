package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_splitter.settlement.SettlementTransaction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * One payment of a settlement plan, as proposed to and confirmed by the client.
 */
@Value
public class SettlementTransactionDto {

    @NotBlank(message = "Payer is required")
    @JsonProperty("from")
    String from;

    @NotBlank(message = "Payee is required")
    @JsonProperty("to")
    String to;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;

    public static SettlementTransactionDto from(SettlementTransaction transaction) {
        return new SettlementTransactionDto(transaction.getFrom(), transaction.getTo(), transaction.getAmount());
    }

    public SettlementTransaction toDomain() {
        return new SettlementTransaction(from, to, amount);
    }
}
