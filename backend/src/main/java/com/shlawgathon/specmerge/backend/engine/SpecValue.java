package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.SourceType;
import com.shlawgathon.specmerge.backend.model.SpecOverride;
import com.shlawgathon.specmerge.backend.model.SpecVariant;

import java.time.Instant;

/**
 * One displayable spec value: either a stored variant or a user override.
 *
 * @param uploadedAt upload time for variants, save time for overrides
 * @param origin     source filename for variants, author for overrides
 */
public record SpecValue(
        String value,
        String unit,
        SourceType sourceType,
        Instant uploadedAt,
        String raw,
        String origin,
        String variantId) {

    public static SpecValue of(SpecVariant variant) {
        return new SpecValue(
                variant.getValue(),
                variant.getUnit(),
                variant.getSourceType(),
                variant.getUploadedAt(),
                variant.getRaw(),
                variant.getOrigin(),
                variant.getId());
    }

    public static SpecValue of(SpecOverride override) {
        String unit = override.getUnit() != null ? override.getUnit() : "";
        return new SpecValue(
                override.getValue(),
                unit,
                SourceType.USER,
                override.getSavedAt(),
                ("USER_EDIT:" + override.getValue() + " " + unit).trim(),
                override.getSavedBy(),
                null);
    }
}
