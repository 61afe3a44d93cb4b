package com.conversions.realtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Body of the {@code postgres_changes} event delivered to clients. The field
 * names are fixed by existing clients.
 */
@JsonPropertyOrder({"event", "schema", "table", "new", "old", "channel"})
public record ChangeMessage(
        @JsonProperty("event") String event,
        @JsonProperty("schema") String schema,
        @JsonProperty("table") String table,
        @JsonProperty("new") Map<String, Object> newData,
        @JsonProperty("old") Map<String, Object> oldData,
        @JsonProperty("channel") @JsonInclude(JsonInclude.Include.NON_NULL) String channel
) {

    public static final String DEFAULT_SCHEMA = "public";

    /**
     * Builds the message for a record. {@code new} is null for deletes and
     * {@code old} is null for inserts; updates and unknown operations carry
     * the row in both.
     */
    public static ChangeMessage of(ChangeRecord record, String table, String channel) {
        ChangeOperation operation = record.operation();
        Map<String, Object> data = record.entityData();
        return new ChangeMessage(
                operation.name(),
                DEFAULT_SCHEMA,
                table,
                operation == ChangeOperation.DELETE ? null : data,
                operation == ChangeOperation.INSERT ? null : data,
                channel);
    }
}
