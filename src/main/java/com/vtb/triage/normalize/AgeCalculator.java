package com.vtb.triage.normalize;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Возраст находки в днях: от даты обнаружения до даты закрытия (для Resolved) или до текущего момента
 */
public class AgeCalculator {

    private static final String RESOLVED_STATUS = "resolved";

    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private static final List<Function<String, Instant>> PARSERS = List.of(
        text -> OffsetDateTime.parse(text).toInstant(),
        Instant::parse,
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
        text -> LocalDateTime.parse(text, SPACED_DATE_TIME).toInstant(ZoneOffset.UTC),
        text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private final Clock clock;

    public AgeCalculator(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock не может быть null");
        }
        this.clock = clock;
    }

    /**
     * @return возраст в полных днях (не меньше 0) или null, если дата обнаружения не распознана
     */
    public Long ageInDays(String firstDetected, String resolvedAt, String status) {
        Instant start = parseTimestamp(firstDetected);
        if (start == null) {
            return null;
        }

        Instant end = null;
        if (status != null && RESOLVED_STATUS.equalsIgnoreCase(status.trim())) {
            end = parseTimestamp(resolvedAt);
        }
        if (end == null) {
            end = clock.instant();
        }

        long days = Duration.between(start, end).toDays();
        return Math.max(0L, days);
    }

    /**
     * Разбор временной метки; значения без зоны считаются UTC
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();

        for (Function<String, Instant> parser : PARSERS) {
            Instant parsed = tryParse(parser, text);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant tryParse(Function<String, Instant> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
