package com.shlawgathon.specmerge.backend.service;

import com.mongodb.client.result.UpdateResult;
import com.shlawgathon.specmerge.backend.dto.OverrideEntry;
import com.shlawgathon.specmerge.backend.dto.UpdateSpecsResponse;
import com.shlawgathon.specmerge.backend.engine.ParameterCatalog;
import com.shlawgathon.specmerge.backend.engine.SpecParameter;
import com.shlawgathon.specmerge.backend.engine.UnknownParameterException;
import com.shlawgathon.specmerge.backend.model.SpecOverride;
import com.shlawgathon.specmerge.backend.repository.SpecOverrideRepository;
import com.shlawgathon.specmerge.backend.websocket.SpecEventWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Override store. One live override per parameter, last write wins by write stamp.
 * <p>
 * A write is a single conditional upsert that only matches a stored override with an
 * older stamp. When nothing matches, the upsert tries to insert and the unique index on
 * {@code parameter} rejects it if a newer override exists. Two first writes racing on
 * the insert retry once, so the later stamp still wins.
 */
@Service
public class SpecOverrideService {

    private static final Logger log = LoggerFactory.getLogger(SpecOverrideService.class);

    private final SpecOverrideRepository overrideRepository;
    private final MongoTemplate mongoTemplate;
    private final ParameterCatalog parameterCatalog;
    private final WriteStampSource writeStampSource;
    private final SpecEventWebSocketHandler eventHandler;

    public SpecOverrideService(SpecOverrideRepository overrideRepository,
            MongoTemplate mongoTemplate,
            ParameterCatalog parameterCatalog,
            WriteStampSource writeStampSource,
            SpecEventWebSocketHandler eventHandler) {
        this.overrideRepository = overrideRepository;
        this.mongoTemplate = mongoTemplate;
        this.parameterCatalog = parameterCatalog;
        this.writeStampSource = writeStampSource;
        this.eventHandler = eventHandler;
    }

    /**
     * Save one override.
     *
     * @param savedAt write stamp; null takes the next server stamp, and a stamp ahead of
     *                the server is clamped to it
     * @throws UnknownParameterException if the parameter is outside the vocabulary
     */
    public OverrideWriteResult save(String parameter, String value, String unit, Instant savedAt, String savedBy) {
        SpecParameter spec = parameterCatalog.resolve(parameter);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Override for " + spec.key() + " has no value");
        }
        Instant serverStamp = writeStampSource.next();
        Instant stamp = savedAt == null || savedAt.isAfter(serverStamp) ? serverStamp : savedAt;
        if (savedAt != null && savedAt.isAfter(serverStamp)) {
            log.warn("[OVERRIDE] Parameter: {} | SavedAt {} is ahead of server time, using {}",
                    spec.key(), savedAt, stamp);
        }

        OverrideWriteResult result = conditionalUpsert(spec.key(), value.trim(), unit, stamp, savedBy);
        if (result == OverrideWriteResult.APPLIED) {
            log.info("[OVERRIDE] Parameter: {} | Value: {} {} | SavedAt: {} | By: {}",
                    spec.key(), value.trim(), unit != null ? unit : "", stamp, savedBy);
        } else {
            log.warn("[OVERRIDE] Parameter: {} | Stale write dropped (savedAt {})", spec.key(), stamp);
        }
        return result;
    }

    /**
     * Apply every entry of one update request.
     * Entries are read in request order and the last entry for a parameter wins; each
     * distinct parameter then gets exactly one write, all sharing one request stamp
     * unless an entry carries its own. A rejected entry never blocks the others.
     */
    public UpdateSpecsResponse saveAll(List<OverrideEntry> entries, String savedBy) {
        Map<String, OverrideEntry> lastByParameter = new LinkedHashMap<>();
        Map<String, String> rejected = new LinkedHashMap<>();

        for (OverrideEntry entry : entries) {
            Optional<SpecParameter> spec = parameterCatalog.find(entry.parameter());
            if (spec.isEmpty()) {
                rejected.put(entry.parameter(), "Unknown parameter");
                continue;
            }
            String key = spec.get().key();
            // a later entry replaces an earlier one, even one that was rejected
            lastByParameter.remove(key);
            rejected.remove(key);
            if (entry.problem() != null) {
                rejected.put(key, entry.problem());
                continue;
            }
            if (entry.value() == null || entry.value().isBlank()) {
                rejected.put(key, "Value is required");
                continue;
            }
            lastByParameter.put(key, entry);
        }

        Instant requestStamp = writeStampSource.next();
        List<String> accepted = new ArrayList<>();
        List<String> stale = new ArrayList<>();

        lastByParameter.forEach((key, entry) -> {
            Instant stamp = entry.savedAt() != null ? entry.savedAt() : requestStamp;
            if (save(key, entry.value(), entry.unit(), stamp, savedBy) == OverrideWriteResult.APPLIED) {
                accepted.add(key);
            } else {
                stale.add(key);
            }
        });

        if (!rejected.isEmpty()) {
            log.warn("[OVERRIDE] Rejected entries: {}", rejected);
        }
        if (!accepted.isEmpty()) {
            eventHandler.broadcast("OVERRIDES_SAVED", Map.of("parameters", accepted));
        }

        return UpdateSpecsResponse.builder()
                .accepted(accepted)
                .stale(stale)
                .rejected(rejected)
                .build();
    }

    public Optional<SpecOverride> findByParameter(String parameter) {
        return overrideRepository.findByParameter(parameterCatalog.resolve(parameter).key());
    }

    private OverrideWriteResult conditionalUpsert(String parameter, String value, String unit, Instant stamp,
            String savedBy) {
        Query olderThanStamp = Query.query(Criteria.where("parameter").is(parameter).and("savedAt").lt(stamp));
        Update update = new Update()
                .set("value", value)
                .set("unit", unit != null ? unit.trim() : "")
                .set("savedAt", stamp)
                .set("savedBy", savedBy);

        for (int attempt = 0; attempt < 2; attempt++) {
            try {
                UpdateResult result = mongoTemplate.upsert(olderThanStamp, update, SpecOverride.class);
                if (result.getMatchedCount() > 0 || result.getUpsertedId() != null) {
                    return OverrideWriteResult.APPLIED;
                }
            } catch (DuplicateKeyException e) {
                log.debug("[OVERRIDE] Parameter: {} | Insert collided, attempt {}", parameter, attempt + 1);
            }
        }
        return OverrideWriteResult.STALE;
    }
}
