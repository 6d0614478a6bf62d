package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.RuleMode;

import java.util.List;

public record DefectRule(String defectType, RuleMode mode, List<GoverningParameter> governing) {

    public DefectRule {
        governing = List.copyOf(governing);
    }
}
