package com.shlawgathon.specmerge.backend.dto;

import com.shlawgathon.specmerge.backend.engine.SpecValue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Every value per parameter, authoritative value first")
public class GroupedViewResponse implements SpecsViewResponse {

    @Builder.Default
    private String view = "grouped";

    @Builder.Default
    private int version = VERSION;

    private String strategy;

    private Map<String, List<SpecValue>> groups;
}
