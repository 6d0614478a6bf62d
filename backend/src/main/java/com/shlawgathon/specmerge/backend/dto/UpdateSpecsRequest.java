package com.shlawgathon.specmerge.backend.dto;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Body of {@code POST /api/update-specs}: {@code {parameter: {value, unit, savedAt?}}}, or
 * the shorthand {@code {parameter: "value unit"}} where the last word is the unit.
 * Entries are kept in request order, duplicates included, so the service can apply
 * last-in-request-wins explicitly. An entry of any other shape is kept with the reason it
 * could not be read, so it is rejected on its own.
 */
@Schema(description = "Map of parameter to corrected value",
        example = "{\"tear_size_limit\": {\"value\": \"2.8\", \"unit\": \"mm\"}, \"max_pressure\": \"5 bar\"}")
public class UpdateSpecsRequest {

    private final List<OverrideEntry> entries = new ArrayList<>();

    @JsonAnySetter
    public void add(String parameter, JsonNode node) {
        entries.add(toEntry(parameter, node));
    }

    public List<OverrideEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private static OverrideEntry toEntry(String parameter, JsonNode node) {
        if (node == null || node.isNull()) {
            return new OverrideEntry(parameter, null, null, null);
        }
        if (node.isObject()) {
            JsonNode value = node.get("value");
            if (value != null && !value.isNull() && !value.isValueNode()) {
                return OverrideEntry.unreadable(parameter, "Value must be text or a number");
            }
            JsonNode savedAt = node.get("savedAt");
            Instant stamp = null;
            if (savedAt != null && !savedAt.isNull()) {
                try {
                    stamp = Instant.parse(savedAt.asText());
                } catch (DateTimeParseException e) {
                    return OverrideEntry.unreadable(parameter, "savedAt must be an ISO-8601 instant");
                }
            }
            return new OverrideEntry(parameter, text(value), text(node.get("unit")), stamp);
        }
        if (node.isTextual() || node.isNumber()) {
            String[] parts = node.asText().trim().split("\\s+");
            if (parts.length < 2) {
                return new OverrideEntry(parameter, parts[0], null, null);
            }
            String value = String.join(" ", Arrays.copyOf(parts, parts.length - 1));
            return new OverrideEntry(parameter, value, parts[parts.length - 1], null);
        }
        return OverrideEntry.unreadable(parameter, "Expected {value, unit} or a \"value unit\" string");
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
