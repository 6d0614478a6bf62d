package com.shlawgathon.specmerge.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field defect observation to be judged against the master projection.
 * Metadata is passed through to results untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "defect_records")
public class DefectRecord {

    @Id
    private String id;

    @Indexed
    private String defectType;

    private Double measuredValue;
    private String unit;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private String batchId;

    @CreatedDate
    private Instant receivedAt;
}
