package com.shlawgathon.specmerge.backend.dto;

import com.shlawgathon.specmerge.backend.engine.SpecValue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Authoritative value for one parameter plus the values it beat")
public class MergedRecordResponse {

    @Schema(description = "Canonical parameter key", example = "tear_size_limit")
    private String parameter;

    @Schema(description = "Display name", example = "Tear Size Limit")
    private String displayName;

    @Schema(description = "True when a user override supplied the chosen value")
    private boolean overridden;

    private SpecValue chosen;

    private List<SpecValue> alternatives;
}
