package com.shlawgathon.specmerge.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Tagged response of {@code GET /api/specs}; {@code view} tells the shape apart.
 */
@Schema(oneOf = {MergedViewResponse.class, GroupedViewResponse.class})
public interface SpecsViewResponse {

    int VERSION = 1;

    String getView();

    int getVersion();

    String getStrategy();
}
