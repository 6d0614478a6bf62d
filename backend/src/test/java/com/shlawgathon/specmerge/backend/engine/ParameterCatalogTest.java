package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.config.SpecCatalogProperties;
import com.shlawgathon.specmerge.backend.model.RuleMode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.shlawgathon.specmerge.backend.engine.SpecFixtures.governing;
import static com.shlawgathon.specmerge.backend.engine.SpecFixtures.parameter;
import static com.shlawgathon.specmerge.backend.engine.SpecFixtures.rule;
import static org.junit.jupiter.api.Assertions.*;

class ParameterCatalogTest {

    private final ParameterCatalog catalog = SpecFixtures.catalog();

    @Test
    void shouldResolveKeyDisplayNameAndAliases() {
        assertEquals("tear_size_limit", catalog.resolve("tear_size_limit").key());
        assertEquals("tear_size_limit", catalog.resolve("Tear Size Limit").key());
        assertEquals("tear_size_limit", catalog.resolve("tear-limit").key());
        assertEquals("tear_size_limit", catalog.resolve("  TEAR   SIZE ").key());
        assertEquals("max_pressure", catalog.resolve("Operating Pressure").key());
    }

    @Test
    void shouldRejectUnknownParameter() {
        UnknownParameterException e = assertThrows(UnknownParameterException.class,
                () -> catalog.resolve("flux_capacitance"));
        assertEquals("flux_capacitance", e.getParameter());
        assertTrue(catalog.find("").isEmpty());
        assertTrue(catalog.find(null).isEmpty());
    }

    @Test
    void shouldLookUpRulesCaseInsensitively() {
        DefectRule rule = catalog.ruleFor("Oversize Hole").orElseThrow();

        assertEquals(RuleMode.THRESHOLD, rule.mode());
        assertEquals(2, rule.governing().size());
        assertTrue(rule.governing().get(0).usesMeasuredValue());
        assertEquals("deviation", rule.governing().get(1).measurement());
        assertTrue(catalog.ruleFor("bubble").isEmpty());
    }

    @Test
    void shouldKeepConfiguredParameterOrder() {
        assertEquals("tear_size_limit", catalog.parameters().iterator().next().key());
        assertEquals(8, catalog.parameters().size());
        assertEquals(8, catalog.rules().size());
    }

    @Test
    void shouldFailWhenRuleReferencesUnknownParameter() {
        SpecCatalogProperties properties = SpecFixtures.properties();
        properties.getDefectRules().add(rule("bubble", RuleMode.THRESHOLD, governing("bubble_limit", null)));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new ParameterCatalog(properties));
        assertTrue(e.getMessage().contains("bubble_limit"));
    }

    @Test
    void shouldFailWhenThresholdParameterHasNoRatio() {
        SpecCatalogProperties properties = SpecFixtures.properties();
        properties.getDefectRules().add(rule("wrong-material", RuleMode.THRESHOLD, governing("material_type", null)));

        assertThrows(IllegalStateException.class, () -> new ParameterCatalog(properties));
    }

    @Test
    void shouldFailWhenFlagRuleHasTwoParameters() {
        SpecCatalogProperties properties = SpecFixtures.properties();
        properties.getDefectRules().add(rule("peel", RuleMode.FLAG,
                governing("coating_required", null), governing("material_type", null)));

        assertThrows(IllegalStateException.class, () -> new ParameterCatalog(properties));
    }

    @Test
    void shouldFailWhenMatchRuleHasNoMeasurementField() {
        SpecCatalogProperties properties = SpecFixtures.properties();
        properties.getDefectRules().add(rule("wrong-alloy", RuleMode.MATCH, governing("material_type", null)));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new ParameterCatalog(properties));
        assertTrue(e.getMessage().contains("wrong-alloy"));
    }

    @Test
    void shouldFailWhenThresholdRuleHasNoParameters() {
        SpecCatalogProperties properties = SpecFixtures.properties();
        properties.getDefectRules().add(rule("smudge", RuleMode.THRESHOLD));

        assertThrows(IllegalStateException.class, () -> new ParameterCatalog(properties));
    }

    @Test
    void shouldFailWhenAliasIsShared() {
        SpecCatalogProperties properties = new SpecCatalogProperties();
        properties.setParameters(new ArrayList<>(List.of(
                parameter("length_tolerance", "Length Tolerance", "mm", "0.5", "tolerance"),
                parameter("width_tolerance", "Width Tolerance", "mm", "0.5", "tolerance"))));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new ParameterCatalog(properties));
        assertTrue(e.getMessage().contains("length_tolerance"));
    }

    @Test
    void shouldFailOnDuplicateKey() {
        SpecCatalogProperties properties = new SpecCatalogProperties();
        properties.setParameters(new ArrayList<>(List.of(
                parameter("cap_diameter", "Cap Diameter", "mm", "0.95"),
                parameter("cap_diameter", "Cap Dia", "mm", "0.95"))));

        assertThrows(IllegalStateException.class, () -> new ParameterCatalog(properties));
    }
}
