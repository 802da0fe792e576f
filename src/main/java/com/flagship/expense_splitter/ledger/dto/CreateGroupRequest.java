package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.util.List;

/**
 * Request DTO for creating a group.
 */
@Value
public class CreateGroupRequest {

    @NotBlank(message = "Group name is required")
    @JsonProperty("name")
    String name;

    @NotEmpty(message = "At least one member is required")
    @JsonProperty("members")
    List<String> members;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;
}
