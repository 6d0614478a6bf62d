package com.shlawgathon.specmerge.backend.dto;

import com.shlawgathon.specmerge.backend.model.SourceType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One extracted (parameter, value) observation from the parsing pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Extracted parameter observation")
public class ExtractedVariantRequest {

    @NotBlank
    @Schema(description = "Parameter key, display name or alias", example = "tear_size_limit")
    private String parameter;

    @NotBlank
    @Schema(description = "Extracted scalar", example = "2.8")
    private String value;

    @Schema(description = "Extracted unit, not converted", example = "mm")
    private String unit;

    @NotNull
    @Schema(description = "Document type the value came from", example = "DOCX")
    private SourceType sourceType;

    @Schema(description = "Upload time; defaults to receive time")
    private Instant uploadedAt;

    @Schema(description = "Original text fragment", example = "Tear size limit: 2.8 mm")
    private String raw;

    @Schema(description = "Source filename", example = "spec_rev_b.docx")
    private String origin;
}
