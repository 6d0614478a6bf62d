package com.shlawgathon.specmerge.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Variants extracted from one processed upload")
public class ExtractionBatchRequest {

    @Schema(description = "Default origin for variants that carry none", example = "spec_rev_b.docx")
    private String origin;

    @Valid
    @NotEmpty
    @Builder.Default
    private List<ExtractedVariantRequest> variants = new ArrayList<>();
}
