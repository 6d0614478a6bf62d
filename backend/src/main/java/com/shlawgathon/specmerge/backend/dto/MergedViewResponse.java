package com.shlawgathon.specmerge.backend.dto;

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
@Schema(description = "One resolved record per parameter")
public class MergedViewResponse implements SpecsViewResponse {

    @Builder.Default
    private String view = "merged";

    @Builder.Default
    private int version = VERSION;

    private String strategy;

    private List<MergedRecordResponse> records;
}
