package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

/**
 * A settlement plan the client confirmed, usually the one returned by the plan endpoint.
 */
@Value
public class SettlementRequest {

    @NotEmpty(message = "At least one transaction is required")
    @Valid
    @JsonProperty("transactions")
    List<SettlementTransactionDto> transactions;
}
