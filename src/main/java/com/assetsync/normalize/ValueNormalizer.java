package com.assetsync.normalize;

import com.assetsync.domain.enums.FieldType;
import com.assetsync.domain.enums.Representation;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.vo.FieldValue;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes raw workbook cells and Lansweeper JSON values into {@link FieldValue}s.
 *
 * <p>Dates are tried against {@link #DATE_PATTERNS} in order and the first pattern that
 * parses the whole input wins. Month-first patterns are listed before day-first ones, so
 * {@code 03/04/2024} is always March 4th. This tie-break is positional, not locale-aware.
 *
 * <p>Only the calendar date of a timestamp is kept, exactly as written: time of day and any
 * offset are dropped, not converted.
 */
@Component
public class ValueNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ValueNormalizer.class);

    static final String UNPARSEABLE_DATE = "unparseable date";
    static final String STRUCTURED_VALUE = "unexpected structured value";

    private static final DateTimeFormatter REMOTE_TIMESTAMP = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'00:00:00'Z'");

    private static final List<DateTimeFormatter> DATE_PATTERNS = List.of(
            // 2024-11-08T00:00:00.000Z
            new DateTimeFormatterBuilder()
                    .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .appendLiteral('Z')
                    .toFormatter()
                    .withResolverStyle(ResolverStyle.STRICT),
            // 2024-11-08T00:00:00Z, what Lansweeper returns today
            strict("uuuu-MM-dd'T'HH:mm:ss'Z'"),
            // 2024-11-08 00:00:00, text-typed workbook timestamps
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd'T'HH:mm:ss"),
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            strict("uuuu-MM-dd"),
            strict("M/d/uuuu"),
            strict("d/M/uuuu"),
            strict("uuuu/M/d"),
            strict("M-d-uuuu"),
            strict("d-M-uuuu"),
            // 11/8/24
            twoDigitYear("M/d/"),
            twoDigitYear("d/M/"));

    private final Map<String, Pattern> compiledPatterns = new ConcurrentHashMap<>();

    /**
     * Normalizes a raw value for a configured field, applying its validation pattern to TEXT values.
     */
    public FieldValue normalize(Object raw, ComparableField field) {
        FieldValue value = normalize(raw, field.getType());
        if (field.getType() == FieldType.TEXT && value.getText() != null && field.getPattern() != null) {
            Pattern pattern = compiledPatterns.computeIfAbsent(field.getPattern(), Pattern::compile);
            if (!pattern.matcher(value.getText()).matches()) {
                log.warn("Value '{}' for {} does not match pattern {}", value.getText(), field.getLocalName(),
                        field.getPattern());
                return FieldValue.invalid(value.getText(), "does not match pattern " + field.getPattern());
            }
        }
        return value;
    }

    public FieldValue normalize(Object raw, FieldType type) {
        if (isEmpty(raw)) {
            return FieldValue.empty();
        }
        return switch (type) {
            case TEXT -> normalizeText(raw);
            case DATE -> normalizeDate(raw);
        };
    }

    /**
     * Renders a normalized value for the given destination. EMPTY renders as the empty string,
     * INVALID as its raw text.
     */
    public String render(FieldValue value, Representation representation) {
        return switch (value.getState()) {
            case EMPTY -> "";
            case TEXT -> value.getText();
            case INVALID -> value.getRaw();
            case DATE -> representation == Representation.REMOTE
                    ? REMOTE_TIMESTAMP.format(value.getDate())
                    : DateTimeFormatter.ISO_LOCAL_DATE.format(value.getDate());
        };
    }

    /**
     * The emptiness gate used for every gap-filling decision: null, NaN, or a string that
     * trims to nothing.
     */
    public static boolean isEmpty(Object raw) {
        if (raw == null) {
            return true;
        }
        if (raw instanceof Double d) {
            return d.isNaN();
        }
        if (raw instanceof Float f) {
            return f.isNaN();
        }
        if (raw instanceof CharSequence text) {
            return text.toString().trim().isEmpty();
        }
        return false;
    }

    private FieldValue normalizeText(Object raw) {
        if (raw instanceof CharSequence text) {
            return FieldValue.text(text.toString().trim());
        }
        if (raw instanceof Number number) {
            return FieldValue.text(renderNumber(number));
        }
        if (raw instanceof Boolean || raw instanceof TemporalAccessor || raw instanceof Date) {
            return FieldValue.text(raw.toString().trim());
        }
        return FieldValue.invalid(String.valueOf(raw), STRUCTURED_VALUE);
    }

    private FieldValue normalizeDate(Object raw) {
        Optional<LocalDate> structured = structuredDate(raw);
        if (structured.isPresent()) {
            return FieldValue.date(structured.get());
        }
        if (!(raw instanceof CharSequence)) {
            log.warn("Could not parse date from {} value: {}", raw.getClass().getSimpleName(), raw);
            return FieldValue.invalid(String.valueOf(raw), UNPARSEABLE_DATE);
        }
        String text = raw.toString().trim();
        Optional<LocalDate> parsed = parseDate(text);
        if (parsed.isPresent()) {
            return FieldValue.date(parsed.get());
        }
        log.warn("Could not parse date: {}", text);
        return FieldValue.invalid(text, UNPARSEABLE_DATE);
    }

    static Optional<LocalDate> parseDate(String text) {
        for (DateTimeFormatter formatter : DATE_PATTERNS) {
            try {
                TemporalAccessor parsed = formatter.parse(text);
                return Optional.of(LocalDate.from(parsed));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}: {}", text, formatter, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> structuredDate(Object raw) {
        if (raw instanceof LocalDate localDate) {
            return Optional.of(localDate);
        }
        if (raw instanceof LocalDateTime localDateTime) {
            return Optional.of(localDateTime.toLocalDate());
        }
        if (raw instanceof OffsetDateTime offsetDateTime) {
            return Optional.of(offsetDateTime.toLocalDate());
        }
        if (raw instanceof ZonedDateTime zonedDateTime) {
            return Optional.of(zonedDateTime.toLocalDate());
        }
        if (raw instanceof Instant instant) {
            return Optional.of(LocalDate.ofInstant(instant, ZoneOffset.UTC));
        }
        if (raw instanceof Date date) {
            return Optional.of(LocalDate.ofInstant(date.toInstant(), ZoneOffset.UTC));
        }
        return Optional.empty();
    }

    private static String renderNumber(Number number) {
        BigDecimal decimal = number instanceof BigDecimal bd ? bd : new BigDecimal(number.toString());
        return decimal.stripTrailingZeros().toPlainString();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter twoDigitYear(String monthDayPrefix) {
        return new DateTimeFormatterBuilder()
                .appendPattern(monthDayPrefix)
                .appendValueReduced(ChronoField.YEAR, 2, 2, 2000)
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
