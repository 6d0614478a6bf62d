package com.shlawgathon.specmerge.backend.controller;

import com.shlawgathon.specmerge.backend.dto.GroupedViewResponse;
import com.shlawgathon.specmerge.backend.dto.MergedRecordResponse;
import com.shlawgathon.specmerge.backend.dto.MergedViewResponse;
import com.shlawgathon.specmerge.backend.dto.ParameterResponse;
import com.shlawgathon.specmerge.backend.dto.SpecsViewResponse;
import com.shlawgathon.specmerge.backend.dto.UpdateSpecsRequest;
import com.shlawgathon.specmerge.backend.dto.UpdateSpecsResponse;
import com.shlawgathon.specmerge.backend.engine.MasterProjection;
import com.shlawgathon.specmerge.backend.engine.MergedRecord;
import com.shlawgathon.specmerge.backend.engine.ParameterCatalog;
import com.shlawgathon.specmerge.backend.engine.SpecParameter;
import com.shlawgathon.specmerge.backend.engine.SpecValue;
import com.shlawgathon.specmerge.backend.model.MergeStrategy;
import com.shlawgathon.specmerge.backend.model.SpecView;
import com.shlawgathon.specmerge.backend.service.MasterCsvExporter;
import com.shlawgathon.specmerge.backend.service.MasterProjectionService;
import com.shlawgathon.specmerge.backend.service.SpecOverrideService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Specs", description = "Master spec projection and user overrides")
public class SpecsController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final MasterProjectionService masterProjectionService;
    private final SpecOverrideService specOverrideService;
    private final MasterCsvExporter masterCsvExporter;
    private final ParameterCatalog parameterCatalog;

    public SpecsController(MasterProjectionService masterProjectionService,
            SpecOverrideService specOverrideService,
            MasterCsvExporter masterCsvExporter,
            ParameterCatalog parameterCatalog) {
        this.masterProjectionService = masterProjectionService;
        this.specOverrideService = specOverrideService;
        this.masterCsvExporter = masterCsvExporter;
        this.parameterCatalog = parameterCatalog;
    }

    @GetMapping("/specs")
    @Operation(summary = "Get master specs",
            description = "Merged view for priority/latest; grouped view for view=raw or strategy=all")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Projection computed"),
            @ApiResponse(responseCode = "400", description = "Unknown view or strategy"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    public ResponseEntity<SpecsViewResponse> getSpecs(
            @Parameter(description = "merged or raw") @RequestParam(required = false) String view,
            @Parameter(description = "priority, latest or all") @RequestParam(required = false) String strategy) {

        SpecView specView = SpecView.fromParam(view);
        MergeStrategy mergeStrategy = MergeStrategy.fromParam(strategy);
        MasterProjection projection = masterProjectionService.project(mergeStrategy);

        if (specView == SpecView.RAW || mergeStrategy == MergeStrategy.ALL) {
            return ResponseEntity.ok(GroupedViewResponse.builder()
                    .strategy(mergeStrategy.paramValue())
                    .groups(projection.groups())
                    .build());
        }

        List<MergedRecordResponse> records = projection.records().values().stream()
                .map(this::toRecordResponse)
                .toList();
        return ResponseEntity.ok(MergedViewResponse.builder()
                .strategy(mergeStrategy.paramValue())
                .records(records)
                .build());
    }

    @PostMapping("/update-specs")
    @Operation(summary = "Save overrides", description = "Write one override per distinct parameter; last entry for a key wins")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Every entry reported as accepted, stale or rejected"),
            @ApiResponse(responseCode = "400", description = "Empty or malformed body"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    public ResponseEntity<UpdateSpecsResponse> updateSpecs(
            @AuthenticationPrincipal OAuth2User principal,
            @RequestBody UpdateSpecsRequest request) {

        if (request == null || request.isEmpty()) {
            throw new IllegalArgumentException("No overrides in request");
        }
        return ResponseEntity.ok(specOverrideService.saveAll(request.entries(), savedBy(principal)));
    }

    @GetMapping("/specs/download")
    @Operation(summary = "Download master CSV", description = "One row per parameter with the chosen value only")
    public ResponseEntity<String> downloadSpecs(
            @Parameter(description = "priority, latest or all") @RequestParam(required = false) String strategy) {

        MergeStrategy mergeStrategy = MergeStrategy.fromParam(strategy).effective();
        String csv = masterCsvExporter.export(masterProjectionService.project(mergeStrategy));

        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(MasterCsvExporter.FILENAME)
                        .build()
                        .toString())
                .body(csv);
    }

    @GetMapping("/specs/parameters")
    @Operation(summary = "List parameters", description = "Controlled parameter vocabulary")
    public ResponseEntity<List<ParameterResponse>> listParameters() {
        return ResponseEntity.ok(parameterCatalog.parameters().stream()
                .map(SpecsController::toParameterResponse)
                .toList());
    }

    private MergedRecordResponse toRecordResponse(MergedRecord record) {
        return MergedRecordResponse.builder()
                .parameter(record.parameter())
                .displayName(parameterCatalog.find(record.parameter())
                        .map(SpecParameter::displayName)
                        .orElse(record.parameter()))
                .overridden(record.overridden())
                .chosen(record.chosen())
                .alternatives(record.alternatives().stream().map(SpecValue::of).toList())
                .build();
    }

    private static ParameterResponse toParameterResponse(SpecParameter parameter) {
        return ParameterResponse.builder()
                .key(parameter.key())
                .displayName(parameter.displayName())
                .canonicalUnit(parameter.canonicalUnit())
                .aliases(parameter.aliases())
                .serviceableRatio(parameter.serviceableRatio())
                .build();
    }

    private static String savedBy(OAuth2User principal) {
        if (principal == null) {
            return null;
        }
        Object login = principal.getAttribute("login");
        return login != null ? login.toString() : principal.getName();
    }
}
