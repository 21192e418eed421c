package com.ripple.resilience.service.rules;

import com.ripple.resilience.model.ConsistencyRule;
import com.ripple.resilience.model.ConsistencySeverity;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Predefined consistency rules.
 */
public final class ConsistencyRules {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
        text -> OffsetDateTime.parse(text).toInstant(),
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
        text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));

    private ConsistencyRules() {
    }

    /**
     * Map data must contain every listed key.
     */
    public static ConsistencyRule requiredProperties(List<String> properties) {
        return requiredProperties(properties, ConsistencySeverity.CRITICAL);
    }

    public static ConsistencyRule requiredProperties(List<String> properties, ConsistencySeverity severity) {
        List<String> required = List.copyOf(properties);
        return ConsistencyRule.builder()
            .name("requiredProperties")
            .description("Validates that object has required properties: " + String.join(", ", required))
            .severity(severity)
            .autoRepair(false)
            .validator(data -> data instanceof Map && ((Map<?, ?>) data).keySet().containsAll(required))
            .build();
    }

    public static ConsistencyRule numericRange(double min, double max) {
        return numericRange(min, max, ConsistencySeverity.WARNING);
    }

    /**
     * Value must be numeric and within {@code [min, max]}. Repair clamps out-of-range values to
     * the nearest bound and replaces non-numeric values with the midpoint. Repaired integers
     * and longs stay integers and longs.
     */
    public static ConsistencyRule numericRange(double min, double max, ConsistencySeverity severity) {
        return ConsistencyRule.builder()
            .name("numericRange")
            .description("Validates that value is between " + min + " and " + max)
            .severity(severity)
            .autoRepair(true)
            .validator(data -> {
                double value = toDouble(data);
                return !Double.isNaN(value) && value >= min && value <= max;
            })
            .repairer(data -> {
                double value = toDouble(data);
                if (Double.isNaN(value)) {
                    return (min + max) / 2;
                }
                return sameKind(data, Math.min(Math.max(value, min), max));
            })
            .build();
    }

    public static ConsistencyRule stringPattern(Pattern pattern) {
        return stringPattern(pattern, ConsistencySeverity.WARNING);
    }

    public static ConsistencyRule stringPattern(Pattern pattern, ConsistencySeverity severity) {
        return ConsistencyRule.builder()
            .name("stringPattern")
            .description("Validates that string matches pattern: " + pattern.pattern())
            .severity(severity)
            .autoRepair(false)
            .validator(data -> data instanceof CharSequence && pattern.matcher((CharSequence) data).find())
            .build();
    }

    public static ConsistencyRule minSize(int minSize) {
        return minSize(minSize, ConsistencySeverity.WARNING);
    }

    /**
     * Collection, map or array data must hold at least {@code minSize} elements.
     */
    public static ConsistencyRule minSize(int minSize, ConsistencySeverity severity) {
        return ConsistencyRule.builder()
            .name("minSize")
            .description("Validates that collection has at least " + minSize + " elements")
            .severity(severity)
            .autoRepair(false)
            .validator(data -> sizeOf(data) >= minSize)
            .build();
    }

    public static ConsistencyRule notNull() {
        return notNull(ConsistencySeverity.CRITICAL);
    }

    public static ConsistencyRule notNull(ConsistencySeverity severity) {
        return ConsistencyRule.builder()
            .name("notNull")
            .description("Validates that value is not null")
            .severity(severity)
            .autoRepair(false)
            .validator(data -> data != null)
            .build();
    }

    public static ConsistencyRule validDate(Clock clock) {
        return validDate(clock, ConsistencySeverity.WARNING);
    }

    /**
     * Value must be a date/time or an ISO-8601 date string. Repair normalizes parseable values
     * to an ISO-8601 instant string and replaces unparseable ones with the current time.
     */
    public static ConsistencyRule validDate(Clock clock, ConsistencySeverity severity) {
        return ConsistencyRule.builder()
            .name("validDate")
            .description("Validates that value is a valid date")
            .severity(severity)
            .autoRepair(true)
            .validator(data -> toInstant(data).isPresent())
            .repairer(data -> toInstant(data).orElseGet(clock::instant).toString())
            .build();
    }

    public static ConsistencyRule validEmail() {
        return validEmail(ConsistencySeverity.WARNING);
    }

    public static ConsistencyRule validEmail(ConsistencySeverity severity) {
        return ConsistencyRule.builder()
            .name("validEmail")
            .description("Validates that value is a valid email address")
            .severity(severity)
            .autoRepair(false)
            .validator(data -> data instanceof CharSequence && EMAIL.matcher((CharSequence) data).matches())
            .build();
    }

    private static double toDouble(Object data) {
        if (data instanceof Number) {
            return ((Number) data).doubleValue();
        }
        if (data instanceof CharSequence) {
            try {
                return Double.parseDouble(data.toString().trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    private static Object sameKind(Object original, double value) {
        if (original instanceof Integer) {
            return (int) value;
        }
        if (original instanceof Long) {
            return (long) value;
        }
        if (original instanceof BigDecimal) {
            return BigDecimal.valueOf(value);
        }
        return value;
    }

    private static int sizeOf(Object data) {
        if (data instanceof Collection) {
            return ((Collection<?>) data).size();
        }
        if (data instanceof Map) {
            return ((Map<?, ?>) data).size();
        }
        if (data instanceof Object[]) {
            return ((Object[]) data).length;
        }
        return -1;
    }

    private static Optional<Instant> toInstant(Object data) {
        if (data instanceof Instant) {
            return Optional.of((Instant) data);
        }
        if (data instanceof Date) {
            return Optional.of(((Date) data).toInstant());
        }
        if (data instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) data).toInstant());
        }
        if (data instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) data).toInstant(ZoneOffset.UTC));
        }
        if (data instanceof LocalDate) {
            return Optional.of(((LocalDate) data).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (data instanceof CharSequence) {
            return parse(data.toString().trim());
        }
        return Optional.empty();
    }

    private static Optional<Instant> parse(String text) {
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return Optional.of(parser.apply(text));
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return Optional.empty();
    }
}
