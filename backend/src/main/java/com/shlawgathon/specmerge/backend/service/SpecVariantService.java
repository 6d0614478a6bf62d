package com.shlawgathon.specmerge.backend.service;

import com.shlawgathon.specmerge.backend.dto.ExtractedVariantRequest;
import com.shlawgathon.specmerge.backend.dto.ExtractionBatchRequest;
import com.shlawgathon.specmerge.backend.engine.ParameterCatalog;
import com.shlawgathon.specmerge.backend.engine.SpecParameter;
import com.shlawgathon.specmerge.backend.model.SpecVariant;
import com.shlawgathon.specmerge.backend.repository.SpecVariantRepository;
import com.shlawgathon.specmerge.backend.websocket.SpecEventWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Variant store. Append-only; nothing here updates or deletes a variant.
 */
@Service
public class SpecVariantService {

    private static final Logger log = LoggerFactory.getLogger(SpecVariantService.class);

    private final SpecVariantRepository variantRepository;
    private final ParameterCatalog parameterCatalog;
    private final SpecEventWebSocketHandler eventHandler;
    private final Clock clock;

    public SpecVariantService(SpecVariantRepository variantRepository,
            ParameterCatalog parameterCatalog,
            SpecEventWebSocketHandler eventHandler,
            Clock clock) {
        this.variantRepository = variantRepository;
        this.parameterCatalog = parameterCatalog;
        this.eventHandler = eventHandler;
        this.clock = clock;
    }

    /**
     * Append one extraction batch. Every variant is validated before anything is written,
     * so a bad batch leaves the store untouched.
     *
     * @throws IllegalArgumentException if any variant violates the variant invariants
     */
    public List<SpecVariant> appendBatch(ExtractionBatchRequest request) {
        String batchId = UUID.randomUUID().toString();
        Instant receivedAt = clock.instant();

        List<SpecVariant> variants = new ArrayList<>();
        for (ExtractedVariantRequest extracted : request.getVariants()) {
            variants.add(toVariant(extracted, request.getOrigin(), batchId, receivedAt));
        }

        List<SpecVariant> saved = variantRepository.insert(variants);
        List<String> parameters = saved.stream().map(SpecVariant::getParameter).distinct().sorted().toList();

        log.info("[INGEST] Batch: {} | Origin: {} | Variants: {} | Parameters: {}",
                batchId, request.getOrigin(), saved.size(), parameters);

        eventHandler.broadcast("VARIANTS_APPENDED", Map.of(
                "batchId", batchId,
                "count", saved.size(),
                "parameters", parameters));
        return saved;
    }

    public List<SpecVariant> findByParameter(String parameter) {
        return variantRepository.findByParameter(parameterCatalog.resolve(parameter).key());
    }

    public long count() {
        return variantRepository.count();
    }

    private SpecVariant toVariant(ExtractedVariantRequest extracted, String batchOrigin, String batchId,
            Instant receivedAt) {
        SpecParameter parameter = parameterCatalog.resolve(extracted.getParameter());

        if (extracted.getSourceType() == null || !extracted.getSourceType().isDocument()) {
            throw new IllegalArgumentException("Variant for " + parameter.key()
                    + " must come from a document source, got: " + extracted.getSourceType());
        }
        if (extracted.getValue() == null || extracted.getValue().isBlank()) {
            throw new IllegalArgumentException("Variant for " + parameter.key() + " has no value");
        }

        return SpecVariant.builder()
                .parameter(parameter.key())
                .value(extracted.getValue().trim())
                .unit(extracted.getUnit() != null ? extracted.getUnit().trim() : "")
                .sourceType(extracted.getSourceType())
                .uploadedAt(extracted.getUploadedAt() != null ? extracted.getUploadedAt() : receivedAt)
                .raw(extracted.getRaw())
                .origin(extracted.getOrigin() != null ? extracted.getOrigin() : batchOrigin)
                .batchId(batchId)
                .build();
    }
}
