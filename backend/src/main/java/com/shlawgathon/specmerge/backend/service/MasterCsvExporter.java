package com.shlawgathon.specmerge.backend.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.shlawgathon.specmerge.backend.engine.MasterProjection;
import com.shlawgathon.specmerge.backend.engine.SpecValue;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flattens a projection to CSV: one row per parameter, chosen value only.
 */
@Component
public class MasterCsvExporter {

    public static final String FILENAME = "master_specs.csv";

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(MasterRow.class).withHeader();

    @JsonPropertyOrder({"parameter", "value", "unit", "source_type", "uploaded_at"})
    public record MasterRow(String parameter, String value, String unit, String source_type, String uploaded_at) {
    }

    public String export(MasterProjection projection) {
        List<MasterRow> rows = projection.records().values().stream()
                .map(record -> {
                    SpecValue chosen = record.chosen();
                    return new MasterRow(
                            record.parameter(),
                            chosen.value(),
                            chosen.unit() != null ? chosen.unit() : "",
                            chosen.sourceType().name(),
                            chosen.uploadedAt() != null ? chosen.uploadedAt().toString() : "");
                })
                .toList();
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write master CSV", e);
        }
    }
}
