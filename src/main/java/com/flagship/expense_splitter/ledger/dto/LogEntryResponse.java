package com.flagship.expense_splitter.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_splitter.ledger.CurrencyCode;
import com.flagship.expense_splitter.ledger.LogEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One log entry with its position, usable as the index for undo.
 */
@Value
@Builder
public class LogEntryResponse {

    @JsonProperty("index")
    int index;

    @JsonProperty("type")
    String type;

    @JsonProperty("description")
    String description;

    @JsonProperty("change")
    Map<String, Long> change;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    public static LogEntryResponse from(int index, LogEntry entry, CurrencyCode currency) {
        return LogEntryResponse.builder()
            .index(index)
            .type(entry.getCommand().getCommandType())
            .description(entry.getCommand().describe(currency))
            .change(entry.getChange().asMap())
            .recordedAt(entry.getRecordedAt())
            .build();
    }
}
