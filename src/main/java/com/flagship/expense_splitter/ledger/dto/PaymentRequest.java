package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for a direct payment between two members, amount in minor units.
 */
@Value
public class PaymentRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Payer is required")
    @JsonProperty("from")
    String from;

    @NotBlank(message = "Payee is required")
    @JsonProperty("to")
    String to;
}
