package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.DefectRecord;
import com.shlawgathon.specmerge.backend.model.RepairDecision;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a defect measurement plus the resolved spec into a repair decision.
 * <p>
 * The defect type selects a rule from the {@link ParameterCatalog}. Under a threshold
 * rule each governing comparison is
 * <ul>
 *   <li>Not Repairable when {@code measured > limit}</li>
 *   <li>Repairable when {@code measured <= limit - |limit| * (1 - serviceableRatio)}</li>
 *   <li>Serviceable otherwise</li>
 * </ul>
 * and the decision is the worst comparison. For a positive limit the Repairable bound is
 * {@code limit * serviceableRatio}. A limit written as a {@code ±} tolerance is compared
 * against the magnitude of the measurement. A comparison that cannot be made fails the
 * whole defect, unless another comparison is already Not Repairable.
 */
@Component
public class DefectClassifier {

    private static final Set<String> TRUTHY = Set.of("yes", "true", "1", "y");
    private static final Set<String> FALSY = Set.of("no", "false", "0", "n");

    private final ParameterCatalog catalog;
    private final UnitConverter unitConverter;

    public DefectClassifier(ParameterCatalog catalog, UnitConverter unitConverter) {
        this.catalog = catalog;
        this.unitConverter = unitConverter;
    }

    /**
     * @throws ClassificationException when the defect cannot be judged
     */
    public DefectDecision classify(DefectRecord defect, Map<String, MergedRecord> master) {
        DefectRule rule = catalog.ruleFor(defect.getDefectType())
                .orElseThrow(() -> new UnknownDefectTypeException(defect.getDefectType()));

        return switch (rule.mode()) {
            case ALWAYS_NOT_REPAIRABLE -> new DefectDecision(RepairDecision.NOT_REPAIRABLE, List.of());
            case FLAG -> {
                SpecComparison flag = compareFlag(rule.governing().get(0), master);
                yield new DefectDecision(flag.outcome(), List.of(flag));
            }
            case MATCH -> {
                SpecComparison match = compareMatch(defect, rule.governing().get(0), master);
                yield new DefectDecision(match.outcome(), List.of(match));
            }
            case THRESHOLD -> classifyThreshold(defect, rule, master);
        };
    }

    private DefectDecision classifyThreshold(DefectRecord defect, DefectRule rule, Map<String, MergedRecord> master) {
        List<SpecComparison> comparisons = new ArrayList<>();
        ClassificationException firstFailure = null;

        for (GoverningParameter governing : rule.governing()) {
            try {
                comparisons.add(compareThreshold(defect, governing, master));
            } catch (ClassificationException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        RepairDecision decision = comparisons.stream()
                .map(SpecComparison::outcome)
                .reduce(RepairDecision.REPAIRABLE, RepairDecision::worse);

        if (firstFailure != null && decision != RepairDecision.NOT_REPAIRABLE) {
            throw firstFailure;
        }
        return new DefectDecision(decision, comparisons);
    }

    private SpecComparison compareThreshold(DefectRecord defect, GoverningParameter governing,
            Map<String, MergedRecord> master) {

        SpecParameter parameter = catalog.resolve(governing.parameter());
        SpecValue spec = resolvedValue(parameter, master);
        String canonicalUnit = parameter.canonicalUnit();

        BigDecimal limit = inCanonicalUnit(parameter, unitConverter.parse(spec.value()), spec.unit());
        BigDecimal measured = inCanonicalUnit(parameter, measurement(defect, governing), measurementUnit(defect, governing));
        if (unitConverter.isSymmetricTolerance(spec.value())) {
            measured = measured.abs();
        }
        BigDecimal repairableBound = limit.subtract(
                limit.abs().multiply(BigDecimal.ONE.subtract(parameter.serviceableRatio())));

        RepairDecision outcome;
        if (measured.compareTo(limit) > 0) {
            outcome = RepairDecision.NOT_REPAIRABLE;
        } else if (measured.compareTo(repairableBound) <= 0) {
            outcome = RepairDecision.REPAIRABLE;
        } else {
            outcome = RepairDecision.SERVICEABLE;
        }

        return new SpecComparison(parameter.key(), spec.value(), spec.unit(), spec.sourceType(),
                limit, measured, canonicalUnit, outcome);
    }

    private SpecComparison compareFlag(GoverningParameter governing, Map<String, MergedRecord> master) {
        SpecParameter parameter = catalog.resolve(governing.parameter());
        SpecValue spec = resolvedValue(parameter, master);
        String flag = spec.value().trim().toLowerCase(Locale.ROOT);

        RepairDecision outcome;
        if (TRUTHY.contains(flag)) {
            outcome = RepairDecision.NOT_REPAIRABLE;
        } else if (FALSY.contains(flag)) {
            outcome = RepairDecision.REPAIRABLE;
        } else {
            throw new UnitMismatchException("Parameter " + parameter.key() + ": flag value '"
                    + spec.value() + "' is neither yes nor no");
        }
        return new SpecComparison(parameter.key(), spec.value(), spec.unit(), spec.sourceType(),
                null, null, parameter.canonicalUnit(), outcome);
    }

    private SpecComparison compareMatch(DefectRecord defect, GoverningParameter governing,
            Map<String, MergedRecord> master) {

        SpecParameter parameter = catalog.resolve(governing.parameter());
        SpecValue spec = resolvedValue(parameter, master);
        Object observed = defect.getMetadata() != null ? defect.getMetadata().get(governing.measurement()) : null;
        if (observed == null || observed.toString().isBlank()) {
            throw new InvalidMeasurementException("Defect has no value for '" + governing.measurement() + "'");
        }

        // numbers compare by value, anything else as text ignoring case
        boolean matches;
        try {
            matches = unitConverter.parse(observed.toString()).compareTo(unitConverter.parse(spec.value())) == 0;
        } catch (UnitMismatchException e) {
            matches = observed.toString().trim().equalsIgnoreCase(spec.value().trim());
        }
        RepairDecision outcome = matches ? RepairDecision.REPAIRABLE : RepairDecision.NOT_REPAIRABLE;
        return new SpecComparison(parameter.key(), spec.value(), spec.unit(), spec.sourceType(),
                null, null, parameter.canonicalUnit(), outcome);
    }

    private static SpecValue resolvedValue(SpecParameter parameter, Map<String, MergedRecord> master) {
        MergedRecord record = master.get(parameter.key());
        if (record == null || record.chosen() == null
                || record.chosen().value() == null || record.chosen().value().isBlank()) {
            throw new UnresolvedSpecException(parameter.key());
        }
        return record.chosen();
    }

    private BigDecimal inCanonicalUnit(SpecParameter parameter, BigDecimal value, String unit) {
        try {
            return unitConverter.convert(value, unit, parameter.canonicalUnit());
        } catch (UnitMismatchException e) {
            throw new UnitMismatchException("Parameter " + parameter.key() + ": " + e.getMessage());
        }
    }

    private BigDecimal measurement(DefectRecord defect, GoverningParameter governing) {
        if (governing.usesMeasuredValue()) {
            if (defect.getMeasuredValue() == null || defect.getMeasuredValue().isNaN()
                    || defect.getMeasuredValue().isInfinite()) {
                throw new InvalidMeasurementException("Defect has no measured value");
            }
            return BigDecimal.valueOf(defect.getMeasuredValue());
        }

        Object raw = defect.getMetadata() != null ? defect.getMetadata().get(governing.measurement()) : null;
        if (raw instanceof Number || (raw instanceof String text && !text.isBlank())) {
            try {
                return unitConverter.parse(raw.toString());
            } catch (UnitMismatchException e) {
                throw new InvalidMeasurementException("Measurement '" + governing.measurement()
                        + "' is not numeric: " + raw);
            }
        }
        throw new InvalidMeasurementException("Defect has no measurement '" + governing.measurement() + "'");
    }

    private static String measurementUnit(DefectRecord defect, GoverningParameter governing) {
        if (!governing.usesMeasuredValue() && defect.getMetadata() != null) {
            Object unit = defect.getMetadata().get(governing.measurement() + "_unit");
            if (unit != null) {
                return unit.toString();
            }
        }
        return defect.getUnit();
    }
}
