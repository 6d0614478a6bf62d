package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.RepairDecision;

import java.util.List;

public record DefectDecision(RepairDecision decision, List<SpecComparison> judgedAgainst) {

    public DefectDecision {
        judgedAgainst = List.copyOf(judgedAgainst);
    }
}
