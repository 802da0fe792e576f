package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class GroupListResponse {

    @JsonProperty("current_group")
    String currentGroup;

    @JsonProperty("groups")
    List<GroupResponse> groups;
}
