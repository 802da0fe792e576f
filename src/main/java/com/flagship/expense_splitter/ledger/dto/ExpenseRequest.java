package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;

/**
 * Request DTO for recording an expense.
 *
 * {@code from} and {@code to} hold directives such as {@code "alice"}, {@code "bob:12,50"} or
 * {@code "carol:25%"}; the amount is in minor units.
 */
@Value
public class ExpenseRequest {

    @Size(max = 255, message = "Description must be at most 255 characters")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;

    @NotNull(message = "Payers are required")
    @JsonProperty("from")
    List<String> from;

    @JsonProperty("to")
    List<String> to;

    @JsonProperty("balance_rest")
    Boolean balanceRest;

    public List<String> toOrEmpty() {
        return to == null ? List.of() : to;
    }

    public boolean isBalanceRestEnabled() {
        return Boolean.TRUE.equals(balanceRest);
    }
}
