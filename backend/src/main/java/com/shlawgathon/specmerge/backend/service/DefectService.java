package com.shlawgathon.specmerge.backend.service;

import com.shlawgathon.specmerge.backend.dto.DefectRecordRequest;
import com.shlawgathon.specmerge.backend.dto.DefectResultResponse;
import com.shlawgathon.specmerge.backend.engine.ClassificationException;
import com.shlawgathon.specmerge.backend.engine.DefectClassifier;
import com.shlawgathon.specmerge.backend.engine.DefectDecision;
import com.shlawgathon.specmerge.backend.engine.MasterProjection;
import com.shlawgathon.specmerge.backend.model.ClassificationStatus;
import com.shlawgathon.specmerge.backend.model.DefectRecord;
import com.shlawgathon.specmerge.backend.model.MergeStrategy;
import com.shlawgathon.specmerge.backend.repository.DefectRecordRepository;
import com.shlawgathon.specmerge.backend.websocket.SpecEventWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Stores field defect records and classifies them against the current projection.
 * Decisions are never persisted; they follow the projection they were judged against.
 */
@Service
public class DefectService {

    private static final Logger log = LoggerFactory.getLogger(DefectService.class);

    static final String INSUFFICIENT_DATA = "Insufficient Data";

    private final DefectRecordRepository defectRecordRepository;
    private final MasterProjectionService masterProjectionService;
    private final DefectClassifier defectClassifier;
    private final SpecEventWebSocketHandler eventHandler;

    public DefectService(DefectRecordRepository defectRecordRepository,
            MasterProjectionService masterProjectionService,
            DefectClassifier defectClassifier,
            SpecEventWebSocketHandler eventHandler) {
        this.defectRecordRepository = defectRecordRepository;
        this.masterProjectionService = masterProjectionService;
        this.defectClassifier = defectClassifier;
        this.eventHandler = eventHandler;
    }

    public List<DefectRecord> storeBatch(List<DefectRecordRequest> requests) {
        String batchId = UUID.randomUUID().toString();
        List<DefectRecord> saved = defectRecordRepository.saveAll(
                requests.stream().map(request -> toRecord(request, batchId)).toList());

        log.info("[INGEST] Defect batch: {} | Records: {}", batchId, saved.size());
        eventHandler.broadcast("DEFECTS_RECEIVED", Map.of("batchId", batchId, "count", saved.size()));
        return saved;
    }

    public List<DefectResultResponse> classifyStored(MergeStrategy strategy) {
        return classifyAll(defectRecordRepository.findAll(), strategy);
    }

    public List<DefectResultResponse> classifyRequests(List<DefectRecordRequest> requests, MergeStrategy strategy) {
        return classifyAll(requests.stream().map(request -> toRecord(request, null)).toList(), strategy);
    }

    /**
     * Classify every record against one projection. A record that cannot be judged
     * becomes an Insufficient Data row; the batch always completes.
     */
    public List<DefectResultResponse> classifyAll(List<DefectRecord> records, MergeStrategy strategy) {
        MasterProjection projection = masterProjectionService.project(strategy.effective());
        int undecided = 0;

        List<DefectResultResponse> results = new ArrayList<>(records.size());
        for (DefectRecord record : records) {
            try {
                DefectDecision decision = defectClassifier.classify(record, projection.records());
                results.add(toResult(record)
                        .decision(decision.decision().label())
                        .status(ClassificationStatus.DECIDED)
                        .judgedAgainst(decision.judgedAgainst())
                        .build());
            } catch (ClassificationException e) {
                undecided++;
                log.warn("[CLASSIFY] Defect: {} | Type: {} | {}: {}",
                        record.getId(), record.getDefectType(), e.status(), e.getMessage());
                results.add(toResult(record)
                        .decision(INSUFFICIENT_DATA)
                        .status(e.status())
                        .reason(e.getMessage())
                        .judgedAgainst(List.of())
                        .build());
            }
        }

        log.info("[CLASSIFY] Strategy: {} | Defects: {} | Undecided: {}",
                strategy.paramValue(), records.size(), undecided);
        return results;
    }

    private static DefectResultResponse.DefectResultResponseBuilder toResult(DefectRecord record) {
        return DefectResultResponse.builder()
                .id(record.getId())
                .defectType(record.getDefectType())
                .measuredValue(record.getMeasuredValue())
                .unit(record.getUnit())
                .metadata(record.getMetadata() != null ? record.getMetadata() : Map.of());
    }

    private static DefectRecord toRecord(DefectRecordRequest request, String batchId) {
        return DefectRecord.builder()
                .defectType(request.getDefectType())
                .measuredValue(request.getMeasuredValue())
                .unit(request.getUnit())
                .metadata(request.getMetadata() != null ? new LinkedHashMap<>(request.getMetadata()) : new LinkedHashMap<>())
                .batchId(batchId)
                .build();
    }
}
