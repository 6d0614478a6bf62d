package com.shlawgathon.specmerge.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-parameter outcome of an override update")
public class UpdateSpecsResponse {

    @Builder.Default
    @Schema(description = "Parameters whose override was written")
    private List<String> accepted = new ArrayList<>();

    @Builder.Default
    @Schema(description = "Parameters skipped because a newer override is stored")
    private List<String> stale = new ArrayList<>();

    @Builder.Default
    @Schema(description = "Rejected entries with the reason")
    private Map<String, String> rejected = new LinkedHashMap<>();
}
