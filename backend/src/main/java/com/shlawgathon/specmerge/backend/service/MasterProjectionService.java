package com.shlawgathon.specmerge.backend.service;

import com.shlawgathon.specmerge.backend.engine.MasterProjection;
import com.shlawgathon.specmerge.backend.engine.MasterProjector;
import com.shlawgathon.specmerge.backend.model.MergeStrategy;
import com.shlawgathon.specmerge.backend.model.SpecOverride;
import com.shlawgathon.specmerge.backend.model.SpecVariant;
import com.shlawgathon.specmerge.backend.repository.SpecOverrideRepository;
import com.shlawgathon.specmerge.backend.repository.SpecVariantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Computes the master projection from a consistent snapshot of both stores.
 * Nothing is cached: every call re-reads the stores.
 */
@Service
public class MasterProjectionService {

    private static final Logger log = LoggerFactory.getLogger(MasterProjectionService.class);

    private final SpecVariantRepository variantRepository;
    private final SpecOverrideRepository overrideRepository;
    private final MasterProjector masterProjector;

    public MasterProjectionService(SpecVariantRepository variantRepository,
            SpecOverrideRepository overrideRepository,
            MasterProjector masterProjector) {
        this.variantRepository = variantRepository;
        this.overrideRepository = overrideRepository;
        this.masterProjector = masterProjector;
    }

    // Both reads share one snapshot transaction (see MongoConfig)
    @Transactional(readOnly = true)
    public MasterProjection project(MergeStrategy strategy) {
        long started = System.nanoTime();
        List<SpecVariant> variants = variantRepository.findAll();
        List<SpecOverride> overrides = overrideRepository.findAll();

        MasterProjection projection = masterProjector.project(strategy, variants, overrides);

        log.debug("[PROJECTION] Strategy: {} | Variants: {} | Overrides: {} | Parameters: {} | {} ms",
                strategy.paramValue(), variants.size(), overrides.size(), projection.size(),
                (System.nanoTime() - started) / 1_000_000);
        return projection;
    }
}
