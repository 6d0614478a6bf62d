package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.ClassificationStatus;
import com.shlawgathon.specmerge.backend.model.DefectRecord;
import com.shlawgathon.specmerge.backend.model.MergeStrategy;
import com.shlawgathon.specmerge.backend.model.RepairDecision;
import com.shlawgathon.specmerge.backend.model.SourceType;
import com.shlawgathon.specmerge.backend.model.SpecOverride;
import com.shlawgathon.specmerge.backend.model.SpecVariant;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.shlawgathon.specmerge.backend.engine.SpecFixtures.T0;
import static com.shlawgathon.specmerge.backend.engine.SpecFixtures.override;
import static com.shlawgathon.specmerge.backend.engine.SpecFixtures.variant;
import static org.junit.jupiter.api.Assertions.*;

class DefectClassifierTest {

    private final DefectClassifier classifier = new DefectClassifier(SpecFixtures.catalog(), new UnitConverter());
    private final MasterProjector projector = new MasterProjector(new MergeResolver());

    private final List<SpecVariant> variants = new ArrayList<>();
    private final List<SpecOverride> overrides = new ArrayList<>();

    private void spec(String parameter, String value, String unit) {
        variants.add(variant("v" + variants.size(), parameter, value, unit, SourceType.DOCX, T0));
    }

    private Map<String, MergedRecord> master() {
        return projector.project(MergeStrategy.PRIORITY, variants, overrides).records();
    }

    private static DefectRecord defect(String type, Double measured, String unit, Map<String, Object> metadata) {
        return DefectRecord.builder()
                .id("d-" + type)
                .defectType(type)
                .measuredValue(measured)
                .unit(unit)
                .metadata(new LinkedHashMap<>(metadata))
                .build();
    }

    private static DefectRecord defect(String type, Double measured, String unit) {
        return defect(type, measured, unit, Map.of());
    }

    private RepairDecision decide(DefectRecord defect) {
        return classifier.classify(defect, master()).decision();
    }

    @Test
    void shouldClassifyTearsAgainstResolvedLimit() {
        // Given: tear size limit resolved to 2.8 mm
        spec("tear_size_limit", "2.8", "mm");

        // When / Then
        assertEquals(RepairDecision.REPAIRABLE, decide(defect("tear", 2.0, "mm")));
        assertEquals(RepairDecision.NOT_REPAIRABLE, decide(defect("tear", 4.0, "mm")));
    }

    @Test
    void shouldPlaceServiceableBandBetweenRatioAndLimit() {
        spec("tear_size_limit", "2.8", "mm");

        // 0.75 * 2.8 = 2.1
        assertEquals(RepairDecision.REPAIRABLE, decide(defect("tear", 2.1, "mm")));
        assertEquals(RepairDecision.SERVICEABLE, decide(defect("tear", 2.5, "mm")));
        assertEquals(RepairDecision.SERVICEABLE, decide(defect("tear", 2.8, "mm")));
        assertEquals(RepairDecision.NOT_REPAIRABLE, decide(defect("tear", 2.81, "mm")));
    }

    @Test
    void shouldReportJudgedAgainstValue() {
        spec("tear_size_limit", "2.8", "mm");

        DefectDecision decision = classifier.classify(defect("tear", 0.4, "cm"), master());

        SpecComparison comparison = decision.judgedAgainst().get(0);
        assertEquals("tear_size_limit", comparison.parameter());
        assertEquals("2.8", comparison.specValue());
        assertEquals(SourceType.DOCX, comparison.sourceType());
        assertEquals(0, new BigDecimal("4").compareTo(comparison.measured()));
        assertEquals(RepairDecision.NOT_REPAIRABLE, comparison.outcome());
    }

    @Test
    void shouldFailScratchWithoutResolvedSpec() {
        // Given: nothing extracted for surface finish
        spec("tear_size_limit", "2.8", "mm");

        // When / Then
        UnresolvedSpecException e = assertThrows(UnresolvedSpecException.class,
                () -> decide(defect("scratch", 0.3, "mm")));
        assertEquals("surface_finish_tolerance", e.getParameter());
    }

    @Test
    void shouldJudgeAgainstOverrideValue() {
        spec("tear_size_limit", "2.8", "mm");
        overrides.add(override("tear_size_limit", "2.0", "mm", T0.plusSeconds(60)));

        // 0.75 * 2.0 = 1.5
        DefectDecision decision = classifier.classify(defect("tear", 1.8, "mm"), master());

        assertEquals(RepairDecision.SERVICEABLE, decision.decision());
        assertEquals(SourceType.USER, decision.judgedAgainst().get(0).sourceType());
    }

    @Test
    void shouldNormalizeUnitsBeforeComparing() {
        spec("surface_finish_tolerance", "1.6", "µm");
        spec("max_temperature", "100", "C");
        spec("max_pressure", "10", "bar");

        // 0.0005 mm = 0.5 um <= 0.8 um
        assertEquals(RepairDecision.REPAIRABLE, decide(defect("scratch", 0.0005, "mm")));
        // 200 F = 93.3 C, between 90 C and 100 C
        assertEquals(RepairDecision.SERVICEABLE, decide(defect("overheat", 200.0, "F")));
        // 160 psi = 11.03 bar
        assertEquals(RepairDecision.NOT_REPAIRABLE, decide(defect("overpressure", 160.0, "psi")));
    }

    @Test
    void shouldFailOnUnconvertibleUnits() {
        spec("tear_size_limit", "2.8", "mm");

        assertThrows(UnitMismatchException.class, () -> decide(defect("tear", 2.0, "bar")));
        assertThrows(UnitMismatchException.class, () -> decide(defect("tear", 2.0, "")));
    }

    @Test
    void shouldFailOnNonNumericLimit() {
        spec("tear_size_limit", "see drawing", "mm");

        assertThrows(UnitMismatchException.class, () -> decide(defect("tear", 2.0, "mm")));
    }

    @Test
    void shouldFailOnMissingMeasurement() {
        spec("tear_size_limit", "2.8", "mm");

        assertThrows(InvalidMeasurementException.class, () -> decide(defect("tear", null, "mm")));
    }

    @Test
    void shouldTakeWorseOfMultipleComparisons() {
        // Given: 12 mm hole, +/-0.2 mm tolerance
        spec("hole_diameter", "12", "mm");
        spec("hole_tolerance", "±0.2", "mm");

        // When / Then: diameter 11.5 is Serviceable (bound 11.4), deviation 0.05 is Repairable
        assertEquals(RepairDecision.SERVICEABLE,
                decide(defect("oversize-hole", 11.5, "mm", Map.of("deviation", 0.05))));
        assertEquals(RepairDecision.REPAIRABLE,
                decide(defect("oversize-hole", 11.0, "mm", Map.of("deviation", "0.05"))));
        assertEquals(RepairDecision.NOT_REPAIRABLE,
                decide(defect("oversize-hole", 11.0, "mm", Map.of("deviation", 0.3))));
    }

    @Test
    void shouldRejectReadingAboveNegativeLimit() {
        // Given: max temperature of -10 C, Repairable bound -11 C
        spec("max_temperature", "-10", "C");

        // When / Then
        assertEquals(RepairDecision.NOT_REPAIRABLE, decide(defect("overheat", -9.5, "C")));
        assertEquals(RepairDecision.SERVICEABLE, decide(defect("overheat", -10.5, "C")));
        assertEquals(RepairDecision.SERVICEABLE, decide(defect("overheat", -10.0, "C")));
        assertEquals(RepairDecision.REPAIRABLE, decide(defect("overheat", -11.0, "C")));
    }

    @Test
    void shouldTreatZeroLimitAsHardEdge() {
        spec("max_temperature", "0", "C");

        assertEquals(RepairDecision.REPAIRABLE, decide(defect("overheat", -1.0, "C")));
        assertEquals(RepairDecision.REPAIRABLE, decide(defect("overheat", 0.0, "C")));
        assertEquals(RepairDecision.NOT_REPAIRABLE, decide(defect("overheat", 0.5, "C")));
    }

    @Test
    void shouldCompareDeviationMagnitudeAgainstSymmetricTolerance() {
        // Given: 12 mm hole, ±0.05 mm tolerance
        spec("hole_diameter", "12", "mm");
        spec("hole_tolerance", "±0.05", "mm");

        // When / Then: a deviation of -0.5 mm is far outside the band
        assertEquals(RepairDecision.NOT_REPAIRABLE,
                decide(defect("oversize-hole", 11.0, "mm", Map.of("deviation", -0.5))));
        assertEquals(RepairDecision.SERVICEABLE,
                decide(defect("oversize-hole", 11.0, "mm", Map.of("deviation", "-0.04"))));
        assertEquals(RepairDecision.REPAIRABLE,
                decide(defect("oversize-hole", 11.0, "mm", Map.of("deviation", "±0.02"))));
    }

    @Test
    void shouldKeepSignedDeviationAgainstOneSidedTolerance() {
        spec("hole_diameter", "12", "mm");
        spec("hole_tolerance", "0.05", "mm");

        assertEquals(RepairDecision.REPAIRABLE,
                decide(defect("oversize-hole", 11.0, "mm", Map.of("deviation", -0.5))));
    }

    @Test
    void shouldMatchMaterialIgnoringCase() {
        // Given: material resolved to stainless steel
        spec("material_type", "Stainless Steel", "");

        // When / Then
        assertEquals(RepairDecision.REPAIRABLE,
                decide(defect("material-mismatch", null, null, Map.of("material", "stainless steel"))));
        assertEquals(RepairDecision.NOT_REPAIRABLE,
                decide(defect("material-mismatch", null, null, Map.of("material", "Aluminium"))));
    }

    @Test
    void shouldMatchNumericValuesByValue() {
        spec("material_type", "304", "");

        assertEquals(RepairDecision.REPAIRABLE,
                decide(defect("material-mismatch", null, null, Map.of("material", 304))));
        assertEquals(RepairDecision.REPAIRABLE,
                decide(defect("material-mismatch", null, null, Map.of("material", "304.0"))));
    }

    @Test
    void shouldFailMaterialMatchWithoutSpecOrField() {
        UnresolvedSpecException e = assertThrows(UnresolvedSpecException.class,
                () -> decide(defect("material-mismatch", null, null, Map.of("material", "steel"))));
        assertEquals("material_type", e.getParameter());

        spec("material_type", "steel", "");
        assertThrows(InvalidMeasurementException.class, () -> decide(defect("material-mismatch", null, null)));
    }

    @Test
    void shouldReadSecondaryMeasurementUnitFromMetadata() {
        spec("hole_diameter", "12", "mm");
        spec("hole_tolerance", "0.2", "mm");

        DefectDecision decision = classifier.classify(defect("oversize-hole", 11.0, "mm",
                Map.of("deviation", 150, "deviation_unit", "um")), master());

        assertEquals(RepairDecision.SERVICEABLE, decision.decision());
        assertEquals(2, decision.judgedAgainst().size());
    }

    @Test
    void shouldStayNotRepairableWhenAnotherComparisonFails() {
        // Given: only the diameter is known
        spec("hole_diameter", "12", "mm");

        // When / Then
        assertEquals(RepairDecision.NOT_REPAIRABLE,
                decide(defect("oversize-hole", 12.5, "mm", Map.of("deviation", 0.05))));
        assertThrows(UnresolvedSpecException.class,
                () -> decide(defect("oversize-hole", 11.0, "mm", Map.of("deviation", 0.05))));
    }

    @Test
    void shouldFailOnMissingSecondaryMeasurement() {
        spec("hole_diameter", "12", "mm");
        spec("hole_tolerance", "0.2", "mm");

        assertThrows(InvalidMeasurementException.class, () -> decide(defect("oversize-hole", 11.0, "mm")));
        assertThrows(InvalidMeasurementException.class,
                () -> decide(defect("oversize-hole", 11.0, "mm", Map.of("deviation", "wide"))));
    }

    @Test
    void shouldReadCoatingFlag() {
        spec("coating_required", "Yes", "");
        assertEquals(RepairDecision.NOT_REPAIRABLE, decide(defect("coating-damage", null, null)));

        overrides.add(override("coating_required", "no", "", T0.plusSeconds(60)));
        assertEquals(RepairDecision.REPAIRABLE, decide(defect("coating-damage", null, null)));
    }

    @Test
    void shouldFailOnUnreadableOrMissingFlag() {
        assertThrows(UnresolvedSpecException.class, () -> decide(defect("coating-damage", null, null)));

        spec("coating_required", "maybe", "");
        assertThrows(UnitMismatchException.class, () -> decide(defect("coating-damage", null, null)));
    }

    @Test
    void shouldAlwaysRejectCracks() {
        DefectDecision decision = classifier.classify(defect("Crack", 0.1, "mm"), master());

        assertEquals(RepairDecision.NOT_REPAIRABLE, decision.decision());
        assertTrue(decision.judgedAgainst().isEmpty());
    }

    @Test
    void shouldFailOnUnknownDefectType() {
        UnknownDefectTypeException e = assertThrows(UnknownDefectTypeException.class,
                () -> decide(defect("bubble", 1.0, "mm")));
        assertEquals(ClassificationStatus.UNKNOWN_DEFECT_TYPE, e.status());
    }
}
