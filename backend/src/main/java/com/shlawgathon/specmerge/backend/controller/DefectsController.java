package com.shlawgathon.specmerge.backend.controller;

import com.shlawgathon.specmerge.backend.dto.DefectBatchRequest;
import com.shlawgathon.specmerge.backend.dto.DefectResultResponse;
import com.shlawgathon.specmerge.backend.model.MergeStrategy;
import com.shlawgathon.specmerge.backend.service.DefectService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/defects")
@Tag(name = "Defects", description = "Defect classification against the master spec")
public class DefectsController {

    private final DefectService defectService;

    public DefectsController(DefectService defectService) {
        this.defectService = defectService;
    }

    @GetMapping
    @Operation(summary = "Classify stored defects",
            description = "Judge every stored defect against the current projection; undecidable rows report Insufficient Data")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "One result per stored defect"),
            @ApiResponse(responseCode = "400", description = "Unknown strategy"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    public ResponseEntity<List<DefectResultResponse>> listDefects(
            @Parameter(description = "priority, latest or all") @RequestParam(required = false) String strategy) {

        return ResponseEntity.ok(defectService.classifyStored(MergeStrategy.fromParam(strategy)));
    }

    @PostMapping("/classify")
    @Operation(summary = "Classify defects", description = "Judge an ad-hoc batch without storing it")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "One result per submitted defect"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    public ResponseEntity<List<DefectResultResponse>> classify(
            @Parameter(description = "priority, latest or all") @RequestParam(required = false) String strategy,
            @Valid @RequestBody DefectBatchRequest request) {

        return ResponseEntity.ok(defectService.classifyRequests(request.getDefects(), MergeStrategy.fromParam(strategy)));
    }
}
