package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.config.SpecCatalogProperties;
import com.shlawgathon.specmerge.backend.model.RuleMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Controlled parameter vocabulary plus the defect-type lookup table.
 * Built once from configuration and validated eagerly, so a bad table fails startup
 * rather than a classification.
 */
@Component
public class ParameterCatalog {

    private final Map<String, SpecParameter> parametersByKey = new LinkedHashMap<>();
    private final Map<String, SpecParameter> parametersByName = new LinkedHashMap<>();
    private final Map<String, DefectRule> rulesByType = new LinkedHashMap<>();

    public ParameterCatalog(SpecCatalogProperties properties) {
        for (SpecCatalogProperties.ParameterDefinition definition : properties.getParameters()) {
            SpecParameter parameter = new SpecParameter(
                    definition.getKey().trim(),
                    definition.getDisplayName(),
                    definition.getCanonicalUnit(),
                    definition.getAliases(),
                    definition.getServiceableRatio());
            if (parametersByKey.putIfAbsent(parameter.key(), parameter) != null) {
                throw new IllegalStateException("Duplicate parameter key: " + parameter.key());
            }
            registerName(parameter.key(), parameter);
            registerName(parameter.displayName(), parameter);
            parameter.aliases().forEach(alias -> registerName(alias, parameter));
        }

        for (SpecCatalogProperties.DefectRuleDefinition definition : properties.getDefectRules()) {
            DefectRule rule = toRule(definition);
            if (rulesByType.putIfAbsent(normalize(rule.defectType()), rule) != null) {
                throw new IllegalStateException("Duplicate defect rule: " + rule.defectType());
            }
        }
    }

    /**
     * Resolve a key, display name or alias to its vocabulary entry.
     *
     * @throws UnknownParameterException if the name is not in the vocabulary
     */
    public SpecParameter resolve(String name) {
        return find(name).orElseThrow(() -> new UnknownParameterException(name));
    }

    public Optional<SpecParameter> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(parametersByName.get(normalize(name)));
    }

    public Optional<DefectRule> ruleFor(String defectType) {
        if (defectType == null || defectType.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rulesByType.get(normalize(defectType)));
    }

    public Collection<SpecParameter> parameters() {
        return Collections.unmodifiableCollection(parametersByKey.values());
    }

    public Collection<DefectRule> rules() {
        return Collections.unmodifiableCollection(rulesByType.values());
    }

    private void registerName(String name, SpecParameter parameter) {
        if (name == null || name.isBlank()) {
            return;
        }
        SpecParameter existing = parametersByName.putIfAbsent(normalize(name), parameter);
        if (existing != null && !existing.key().equals(parameter.key())) {
            throw new IllegalStateException("Parameter name '" + name + "' used by both "
                    + existing.key() + " and " + parameter.key());
        }
    }

    private DefectRule toRule(SpecCatalogProperties.DefectRuleDefinition definition) {
        RuleMode mode = definition.getMode() != null ? definition.getMode() : RuleMode.THRESHOLD;
        List<GoverningParameter> governing = new ArrayList<>();
        for (SpecCatalogProperties.GoverningDefinition g : definition.getGoverning()) {
            SpecParameter parameter = find(g.getParameter()).orElseThrow(() -> new IllegalStateException(
                    "Defect rule '" + definition.getDefectType() + "' references unknown parameter: "
                            + g.getParameter()));
            if (mode == RuleMode.THRESHOLD && parameter.serviceableRatio() == null) {
                throw new IllegalStateException("Parameter " + parameter.key()
                        + " is governed by a threshold rule but has no serviceable-ratio");
            }
            governing.add(new GoverningParameter(parameter.key(), g.getMeasurement()));
        }

        switch (mode) {
            case THRESHOLD -> {
                if (governing.isEmpty()) {
                    throw new IllegalStateException("Threshold rule '" + definition.getDefectType()
                            + "' needs at least one governing parameter");
                }
            }
            case FLAG -> {
                if (governing.size() != 1) {
                    throw new IllegalStateException("Flag rule '" + definition.getDefectType()
                            + "' needs exactly one governing parameter");
                }
            }
            case MATCH -> {
                if (governing.size() != 1 || governing.get(0).usesMeasuredValue()) {
                    throw new IllegalStateException("Match rule '" + definition.getDefectType()
                            + "' needs exactly one governing parameter with a measurement field");
                }
            }
            case ALWAYS_NOT_REPAIRABLE -> {
                // no parameters consulted
            }
        }
        return new DefectRule(definition.getDefectType().trim(), mode, governing);
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", " ");
    }
}
