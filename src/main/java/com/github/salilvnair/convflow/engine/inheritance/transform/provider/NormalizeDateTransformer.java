package com.github.salilvnair.convflow.engine.inheritance.transform.provider;

import com.github.salilvnair.convflow.engine.inheritance.transform.core.ValueTransformer;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.function.Function;

/**
 * Reduces date and date-time values to an ISO date. Text that is not an ISO
 * date or date-time is returned unchanged.
 */
@Component
public class NormalizeDateTransformer implements ValueTransformer {

    private static final List<Function<String, LocalDate>> PARSERS = List.of(
            LocalDate::parse,
            text -> LocalDateTime.parse(text).toLocalDate(),
            text -> OffsetDateTime.parse(text).toLocalDate(),
            text -> ZonedDateTime.parse(text).toLocalDate(),
            text -> Instant.parse(text).atOffset(ZoneOffset.UTC).toLocalDate()
    );

    @Override
    public String name() {
        return "normalize_date";
    }

    @Override
    public Object transform(Object value) {
        if (value instanceof TemporalAccessor temporal) {
            return toDate(temporal).toString();
        }
        String text = String.valueOf(value).trim();
        for (Function<String, LocalDate> parser : PARSERS) {
            LocalDate date = parse(parser, text);
            if (date != null) {
                return date.toString();
            }
        }
        return text;
    }

    private LocalDate parse(Function<String, LocalDate> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private LocalDate toDate(TemporalAccessor temporal) {
        if (temporal instanceof LocalDate date) {
            return date;
        }
        if (temporal instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (temporal instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (temporal instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (temporal instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC).toLocalDate();
        }
        return LocalDate.from(temporal);
    }
}
