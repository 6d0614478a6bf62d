package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.MergeStrategy;
import com.shlawgathon.specmerge.backend.model.SpecOverride;
import com.shlawgathon.specmerge.backend.model.SpecVariant;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the authoritative value for one parameter.
 * <p>
 * An override always wins and hides nothing: every variant stays listed as an
 * alternative. Without one, {@code priority} ranks DOCX over PDF over IMAGE and
 * breaks ties by recency, {@code latest} takes the most recent upload and breaks ties
 * by rank, and {@code all} resolves like {@code priority}. Variant id is the last
 * tie-break so identical snapshots always resolve identically.
 * <p>
 * Stateless; safe to share.
 */
@Component
public class MergeResolver {

    private static final Comparator<SpecVariant> BY_RANK_DESC =
            Comparator.comparingInt((SpecVariant v) -> v.getSourceType().priorityRank()).reversed();

    private static final Comparator<SpecVariant> BY_RECENCY_DESC =
            Comparator.comparing(SpecVariant::getUploadedAt, Comparator.reverseOrder());

    private static final Comparator<SpecVariant> BY_ID =
            Comparator.comparing(SpecVariant::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    static final Comparator<SpecVariant> PRIORITY_ORDER =
            BY_RANK_DESC.thenComparing(BY_RECENCY_DESC).thenComparing(BY_ID);

    static final Comparator<SpecVariant> LATEST_ORDER =
            BY_RECENCY_DESC.thenComparing(BY_RANK_DESC).thenComparing(BY_ID);

    public MergedRecord resolve(String parameter,
            List<SpecVariant> variants,
            Optional<SpecOverride> override,
            MergeStrategy strategy) {

        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(strategy, "strategy");
        List<SpecVariant> candidates = variants != null ? variants : List.of();
        candidates.forEach(variant -> checkVariant(parameter, variant));

        List<SpecVariant> ordered = candidates.stream()
                .sorted(orderFor(strategy))
                .toList();

        if (override != null && override.isPresent()) {
            SpecOverride userValue = override.get();
            if (!parameter.equals(userValue.getParameter())) {
                throw new IllegalArgumentException("Override for " + userValue.getParameter()
                        + " passed while resolving " + parameter);
            }
            return new MergedRecord(parameter, SpecValue.of(userValue), ordered, true);
        }

        if (ordered.isEmpty()) {
            throw new EmptyVariantSetException(parameter);
        }
        return new MergedRecord(parameter, SpecValue.of(ordered.get(0)),
                ordered.subList(1, ordered.size()), false);
    }

    static Comparator<SpecVariant> orderFor(MergeStrategy strategy) {
        return strategy.effective() == MergeStrategy.LATEST ? LATEST_ORDER : PRIORITY_ORDER;
    }

    private static void checkVariant(String parameter, SpecVariant variant) {
        if (!parameter.equals(variant.getParameter())) {
            throw new IllegalArgumentException("Variant of " + variant.getParameter()
                    + " passed while resolving " + parameter);
        }
        if (variant.getSourceType() == null || !variant.getSourceType().isDocument()) {
            throw new IllegalArgumentException("Variant " + variant.getId()
                    + " has no document source type");
        }
        if (variant.getUploadedAt() == null) {
            throw new IllegalArgumentException("Variant " + variant.getId() + " has no upload time");
        }
    }
}
