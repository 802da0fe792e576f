package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

/**
 * Member names to add to or remove from a group.
 */
@Value
public class MembersRequest {

    @NotEmpty(message = "At least one member is required")
    @JsonProperty("members")
    List<String> members;
}
