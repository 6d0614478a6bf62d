package com.shlawgathon.specmerge.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefectBatchRequest {

    @Valid
    @NotEmpty
    @Builder.Default
    private List<DefectRecordRequest> defects = new ArrayList<>();
}
