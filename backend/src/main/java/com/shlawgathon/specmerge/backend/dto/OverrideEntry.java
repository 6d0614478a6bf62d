package com.shlawgathon.specmerge.backend.dto;

import java.time.Instant;

/**
 * One parameter correction as it appeared in an update request.
 *
 * @param problem why the entry could not be read, or null when it could
 */
public record OverrideEntry(String parameter, String value, String unit, Instant savedAt, String problem) {

    public OverrideEntry(String parameter, String value, String unit, Instant savedAt) {
        this(parameter, value, unit, savedAt, null);
    }

    public static OverrideEntry unreadable(String parameter, String problem) {
        return new OverrideEntry(parameter, null, null, null, problem);
    }
}
