package com.shlawgathon.specmerge.backend.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field defect observation. Any property besides the named ones is kept as metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Field defect observation")
public class DefectRecordRequest {

    @NotBlank
    @Schema(description = "Defect type", example = "tear")
    private String defectType;

    @Schema(description = "Measured size of the defect", example = "2.0")
    private Double measuredValue;

    @Schema(description = "Unit of the measured value", example = "mm")
    private String unit;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonAnySetter
    public void putMetadata(String key, Object value) {
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        metadata.put(key, value);
    }
}
