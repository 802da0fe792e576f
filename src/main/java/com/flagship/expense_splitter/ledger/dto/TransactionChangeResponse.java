package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_splitter.ledger.Group;
import com.flagship.expense_splitter.split.TransactionChange;
import lombok.Value;

import java.util.Map;

/**
 * Balance change applied by an expense or a settlement, with the resulting balances.
 */
@Value
public class TransactionChangeResponse {

    @JsonProperty("group")
    String group;

    @JsonProperty("change")
    Map<String, Long> change;

    @JsonProperty("balances")
    Map<String, Long> balances;

    public static TransactionChangeResponse from(Group group, TransactionChange change) {
        return new TransactionChangeResponse(group.getName(), change.asMap(), group.getBalances());
    }
}
