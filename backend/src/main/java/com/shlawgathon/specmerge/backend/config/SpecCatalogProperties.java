package com.shlawgathon.specmerge.backend.config;

import com.shlawgathon.specmerge.backend.model.RuleMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Controlled parameter vocabulary and the defect-type lookup table.
 * Bound from the {@code specs} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "specs")
public class SpecCatalogProperties {

    @Valid
    @NotEmpty
    private List<ParameterDefinition> parameters = new ArrayList<>();

    @Valid
    private List<DefectRuleDefinition> defectRules = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ParameterDefinition {

        @NotBlank
        private String key;

        private String displayName;

        // Empty for dimensionless and flag parameters
        @Builder.Default
        private String canonicalUnit = "";

        @Builder.Default
        private List<String> aliases = new ArrayList<>();

        /**
         * Fraction of the hard limit at or below which a measurement is Repairable.
         * Required for any parameter governed by a THRESHOLD rule.
         */
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("1")
        private BigDecimal serviceableRatio;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DefectRuleDefinition {

        @NotBlank
        private String defectType;

        @Builder.Default
        private RuleMode mode = RuleMode.THRESHOLD;

        @Valid
        @Builder.Default
        private List<GoverningDefinition> governing = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GoverningDefinition {

        @NotBlank
        private String parameter;

        // Metadata key of a secondary measurement; null means the defect's measured value
        private String measurement;
    }
}
