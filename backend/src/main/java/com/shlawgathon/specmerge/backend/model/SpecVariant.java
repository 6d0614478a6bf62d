package com.shlawgathon.specmerge.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One extracted observation of one parameter from one document.
 * Immutable; the variant store only ever inserts these.
 */
@Value
@Builder
@AllArgsConstructor
@Document(collection = "spec_variants")
public class SpecVariant {

    @Id
    @With
    String id;

    @Indexed
    String parameter;

    String value;
    String unit;
    SourceType sourceType;
    Instant uploadedAt;

    // Original text fragment, kept for audit only
    String raw;

    // Source filename or identifier
    String origin;

    String batchId;

    @CreatedDate
    @With
    Instant addedAt;
}
