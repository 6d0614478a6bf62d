package com.shlawgathon.specmerge.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * User correction for one parameter. At most one per parameter; a write only
 * replaces the stored one when its {@code savedAt} is newer.
 */
@Value
@Builder
@AllArgsConstructor
@Document(collection = "spec_overrides")
public class SpecOverride {

    @Id
    @With
    String id;

    @Indexed(unique = true)
    String parameter;

    String value;
    String unit;
    Instant savedAt;
    String savedBy;
}
