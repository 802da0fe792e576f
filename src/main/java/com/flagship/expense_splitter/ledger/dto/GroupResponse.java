package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_splitter.ledger.Group;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Response DTO for a group: balances in minor units, in member order.
 */
@Value
@Builder
public class GroupResponse {

    @JsonProperty("name")
    String name;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balances")
    Map<String, Long> balances;

    @JsonProperty("log_size")
    int logSize;

    public static GroupResponse from(Group group) {
        return GroupResponse.builder()
            .name(group.getName())
            .currency(group.getCurrency().name())
            .balances(group.getBalances())
            .logSize(group.getLog().size())
            .build();
    }
}
