package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.MergeStrategy;
import com.shlawgathon.specmerge.backend.model.SpecOverride;
import com.shlawgathon.specmerge.backend.model.SpecVariant;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Applies the {@link MergeResolver} to every parameter present in a store snapshot.
 * Parameters known only through an override are included.
 */
@Component
public class MasterProjector {

    private final MergeResolver mergeResolver;

    public MasterProjector(MergeResolver mergeResolver) {
        this.mergeResolver = mergeResolver;
    }

    public MasterProjection project(MergeStrategy strategy,
            Collection<SpecVariant> variants,
            Collection<SpecOverride> overrides) {

        Map<String, List<SpecVariant>> variantsByParameter = new HashMap<>();
        for (SpecVariant variant : variants) {
            variantsByParameter.computeIfAbsent(variant.getParameter(), k -> new ArrayList<>()).add(variant);
        }

        Map<String, SpecOverride> overridesByParameter = new HashMap<>();
        for (SpecOverride override : overrides) {
            if (overridesByParameter.put(override.getParameter(), override) != null) {
                throw new IllegalStateException("More than one live override for " + override.getParameter());
            }
        }

        TreeSet<String> parameters = new TreeSet<>(variantsByParameter.keySet());
        parameters.addAll(overridesByParameter.keySet());

        SortedMap<String, MergedRecord> records = new TreeMap<>();
        for (String parameter : parameters) {
            records.put(parameter, mergeResolver.resolve(
                    parameter,
                    variantsByParameter.getOrDefault(parameter, List.of()),
                    Optional.ofNullable(overridesByParameter.get(parameter)),
                    strategy));
        }
        return new MasterProjection(strategy, records);
    }
}
