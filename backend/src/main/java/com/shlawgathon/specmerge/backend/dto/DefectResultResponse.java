package com.shlawgathon.specmerge.backend.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.shlawgathon.specmerge.backend.engine.SpecComparison;
import com.shlawgathon.specmerge.backend.model.ClassificationStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Original defect fields, metadata flattened in, plus the decision.
 * A metadata key that collides with a named field is written with a {@code meta_} prefix.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Defect with its repair decision")
public class DefectResultResponse {

    static final String RESERVED_PREFIX = "meta_";

    private static final Set<String> RESERVED_KEYS = Set.of(
            "id", "defectType", "measuredValue", "unit", "decision", "status", "reason", "judgedAgainst");

    private String id;
    private String defectType;
    private Double measuredValue;
    private String unit;

    @JsonIgnore
    private Map<String, Object> metadata;

    @Schema(description = "Repairable, Serviceable, Not Repairable, or Insufficient Data")
    private String decision;

    private ClassificationStatus status;

    @Schema(description = "Why the defect could not be judged")
    private String reason;

    private List<SpecComparison> judgedAgainst;

    @JsonAnyGetter
    public Map<String, Object> flattenedMetadata() {
        if (metadata == null) {
            return null;
        }
        Map<String, Object> flattened = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            String name = RESERVED_KEYS.contains(key) ? RESERVED_PREFIX + key : key;
            flattened.putIfAbsent(name, value);
        });
        return flattened;
    }
}
