package com.shlawgathon.specmerge.backend.controller;

import com.shlawgathon.specmerge.backend.dto.DefectBatchRequest;
import com.shlawgathon.specmerge.backend.dto.ExtractionBatchRequest;
import com.shlawgathon.specmerge.backend.model.DefectRecord;
import com.shlawgathon.specmerge.backend.model.SpecVariant;
import com.shlawgathon.specmerge.backend.service.DefectService;
import com.shlawgathon.specmerge.backend.service.SpecVariantService;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/internal")
@Tag(name = "Internal", description = "Feeds from the extraction pipeline and defect collector")
@Hidden // Hide from public Swagger UI
public class InternalIngestionController {

    private final SpecVariantService specVariantService;
    private final DefectService defectService;

    public InternalIngestionController(SpecVariantService specVariantService, DefectService defectService) {
        this.specVariantService = specVariantService;
        this.defectService = defectService;
    }

    @PostMapping("/extractions")
    @Operation(summary = "Append variants", description = "Append one batch of extracted variants")
    public ResponseEntity<Map<String, Object>> appendExtractions(@Valid @RequestBody ExtractionBatchRequest request) {
        List<SpecVariant> saved = specVariantService.appendBatch(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "batchId", saved.get(0).getBatchId(),
                "count", saved.size(),
                "parameters", saved.stream().map(SpecVariant::getParameter).distinct().sorted().toList()));
    }

    @PostMapping("/defects")
    @Operation(summary = "Store defects", description = "Store one batch of field defect records")
    public ResponseEntity<Map<String, Object>> storeDefects(@Valid @RequestBody DefectBatchRequest request) {
        List<DefectRecord> saved = defectService.storeBatch(request.getDefects());

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "batchId", saved.get(0).getBatchId(),
                "count", saved.size()));
    }
}
