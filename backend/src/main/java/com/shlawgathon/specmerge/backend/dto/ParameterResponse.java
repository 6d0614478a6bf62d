package com.shlawgathon.specmerge.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Controlled vocabulary entry")
public class ParameterResponse {

    private String key;
    private String displayName;
    private String canonicalUnit;
    private List<String> aliases;
    private BigDecimal serviceableRatio;
}
