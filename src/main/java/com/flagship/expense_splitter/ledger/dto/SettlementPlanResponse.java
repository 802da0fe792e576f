package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Proposed settlement of a group. Nothing has been applied yet.
 */
@Value
public class SettlementPlanResponse {

    @JsonProperty("group")
    String group;

    @JsonProperty("transactions")
    List<SettlementTransactionDto> transactions;
}
