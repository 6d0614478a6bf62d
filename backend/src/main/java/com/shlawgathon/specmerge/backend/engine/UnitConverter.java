package com.shlawgathon.specmerge.backend.engine;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Map;

/**
 * Converts values between the units the extraction pipeline produces.
 * Only conversions listed here exist; anything else is a {@link UnitMismatchException}.
 */
@Component
public class UnitConverter {

    private static final MathContext MC = MathContext.DECIMAL64;

    private static final BigDecimal THIRTY_TWO = BigDecimal.valueOf(32);
    private static final BigDecimal FIVE_NINTHS = BigDecimal.valueOf(5).divide(BigDecimal.valueOf(9), MC);

    private enum Family { LENGTH, PRESSURE, TEMPERATURE }

    private record Unit(Family family, BigDecimal toBase) {
    }

    // Length base mm, pressure base bar. Temperature is affine and handled separately.
    private static final Map<String, Unit> UNITS = Map.of(
            "mm", new Unit(Family.LENGTH, BigDecimal.ONE),
            "cm", new Unit(Family.LENGTH, BigDecimal.TEN),
            "m", new Unit(Family.LENGTH, BigDecimal.valueOf(1000)),
            "um", new Unit(Family.LENGTH, new BigDecimal("0.001")),
            "bar", new Unit(Family.PRESSURE, BigDecimal.ONE),
            "psi", new Unit(Family.PRESSURE, new BigDecimal("0.0689476")),
            "c", new Unit(Family.TEMPERATURE, BigDecimal.ONE),
            "f", new Unit(Family.TEMPERATURE, BigDecimal.ONE));

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("µm", "um"),
            Map.entry("μm", "um"),
            Map.entry("micron", "um"),
            Map.entry("microns", "um"),
            Map.entry("°c", "c"),
            Map.entry("degc", "c"),
            Map.entry("celsius", "c"),
            Map.entry("°f", "f"),
            Map.entry("degf", "f"),
            Map.entry("fahrenheit", "f"));

    /**
     * Convert {@code value} expressed in {@code fromUnit} into {@code toUnit}.
     * Blank units only match each other.
     */
    public BigDecimal convert(BigDecimal value, String fromUnit, String toUnit) {
        String from = canonical(fromUnit);
        String to = canonical(toUnit);
        if (from.equals(to)) {
            return value;
        }
        if (from.isEmpty() || to.isEmpty()) {
            throw new UnitMismatchException("Cannot compare '" + display(fromUnit) + "' with '"
                    + display(toUnit) + "'");
        }

        Unit source = UNITS.get(from);
        Unit target = UNITS.get(to);
        if (source == null || target == null || source.family() != target.family()) {
            throw new UnitMismatchException("No conversion from '" + display(fromUnit) + "' to '"
                    + display(toUnit) + "'");
        }

        if (source.family() == Family.TEMPERATURE) {
            return "f".equals(from)
                    ? value.subtract(THIRTY_TWO).multiply(FIVE_NINTHS, MC)
                    : value.divide(FIVE_NINTHS, MC).add(THIRTY_TWO);
        }
        return value.multiply(source.toBase(), MC).divide(target.toBase(), MC);
    }

    /**
     * Parse an extracted scalar, dropping a leading {@code ±} or {@code +/-}.
     */
    public BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnitMismatchException("Value is blank");
        }
        String cleaned = raw.trim().replace("±", "").replace("+/-", "").trim();
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new UnitMismatchException("Value '" + raw + "' is not numeric");
        }
    }

    /**
     * Whether an extracted value is written as a symmetric tolerance, such as {@code ±0.05}.
     */
    public boolean isSymmetricTolerance(String raw) {
        if (raw == null) {
            return false;
        }
        String trimmed = raw.trim();
        return trimmed.startsWith("±") || trimmed.startsWith("+/-");
    }

    static String canonical(String unit) {
        if (unit == null) {
            return "";
        }
        String key = unit.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(key, key);
    }

    private static String display(String unit) {
        return unit == null || unit.isBlank() ? "<none>" : unit.trim();
    }
}
