package com.shlawgathon.specmerge.backend.service;

import com.shlawgathon.specmerge.backend.BaseE2ETest;
import com.shlawgathon.specmerge.backend.dto.ExtractedVariantRequest;
import com.shlawgathon.specmerge.backend.dto.ExtractionBatchRequest;
import com.shlawgathon.specmerge.backend.engine.MasterProjection;
import com.shlawgathon.specmerge.backend.engine.MergedRecord;
import com.shlawgathon.specmerge.backend.model.MergeStrategy;
import com.shlawgathon.specmerge.backend.model.SourceType;
import com.shlawgathon.specmerge.backend.repository.SpecOverrideRepository;
import com.shlawgathon.specmerge.backend.repository.SpecVariantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MasterProjectionServiceE2ETest extends BaseE2ETest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MasterProjectionService masterProjectionService;

    @Autowired
    private SpecVariantService specVariantService;

    @Autowired
    private SpecOverrideService specOverrideService;

    @Autowired
    private SpecVariantRepository specVariantRepository;

    @Autowired
    private SpecOverrideRepository specOverrideRepository;

    @BeforeEach
    void setUp() {
        specVariantRepository.deleteAll();
        specOverrideRepository.deleteAll();

        specVariantService.appendBatch(ExtractionBatchRequest.builder()
                .origin("uploads")
                .variants(List.of(
                        variant("tear_size_limit", "2.8", "mm", SourceType.DOCX, T0),
                        variant("tear_size_limit", "3.0", "mm", SourceType.PDF, T0.plusSeconds(3600)),
                        variant("max_pressure", "5", "bar", SourceType.DOCX, T0),
                        variant("max_pressure", "6", "bar", SourceType.PDF, T0.plusSeconds(60)),
                        variant("max_pressure", "7", "bar", SourceType.IMAGE, T0.plusSeconds(120))))
                .build());
    }

    @Test
    void shouldProjectStoredVariantsPerStrategy() {
        // When
        MasterProjection priority = masterProjectionService.project(MergeStrategy.PRIORITY);
        MasterProjection latest = masterProjectionService.project(MergeStrategy.LATEST);

        // Then
        assertEquals("2.8", priority.records().get("tear_size_limit").chosen().value());
        assertEquals("3.0", latest.records().get("tear_size_limit").chosen().value());
        assertEquals("7", latest.records().get("max_pressure").chosen().value());
    }

    @Test
    void shouldApplyOverrideSavedAfterVariants() {
        // Given
        specOverrideService.save("Max Pressure", "5.5", "bar", null, "inspector");

        for (MergeStrategy strategy : MergeStrategy.values()) {
            // When
            MergedRecord pressure = masterProjectionService.project(strategy).records().get("max_pressure");

            // Then
            assertEquals(SourceType.USER, pressure.chosen().sourceType());
            assertEquals("5.5", pressure.chosen().value());
            assertEquals(3, pressure.alternatives().size());
        }
    }

    @Test
    void shouldSeedParameterFromOverrideAlone() {
        specOverrideService.save("coating_required", "yes", "", null, "inspector");

        MergedRecord coating = masterProjectionService.project(MergeStrategy.PRIORITY).records().get("coating_required");

        assertNotNull(coating);
        assertTrue(coating.overridden());
    }

    @Test
    void shouldRecomputeOnEveryRead() {
        MasterProjection before = masterProjectionService.project(MergeStrategy.PRIORITY);

        specOverrideService.save("tear_size_limit", "2.6", "mm", null, "inspector");
        MasterProjection after = masterProjectionService.project(MergeStrategy.PRIORITY);

        assertEquals("2.8", before.records().get("tear_size_limit").chosen().value());
        assertEquals("2.6", after.records().get("tear_size_limit").chosen().value());
    }

    @Test
    void shouldBeIdempotentForUnchangedStores() {
        specOverrideService.save("max_pressure", "5.5", "bar", null, "inspector");

        for (MergeStrategy strategy : MergeStrategy.values()) {
            assertEquals(masterProjectionService.project(strategy), masterProjectionService.project(strategy));
        }
    }

    private static ExtractedVariantRequest variant(String parameter, String value, String unit,
            SourceType sourceType, Instant uploadedAt) {
        return ExtractedVariantRequest.builder()
                .parameter(parameter)
                .value(value)
                .unit(unit)
                .sourceType(sourceType)
                .uploadedAt(uploadedAt)
                .raw(parameter + " " + value + " " + unit)
                .build();
    }
}
