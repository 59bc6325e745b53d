package findata.collector.transform;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;

/**
 * Parses the date formats seen in upstream feeds.
 *
 * A value carrying an offset stays an {@link OffsetDateTime} with that offset;
 * one without stays a {@link LocalDateTime}. A bare date means start of day.
 */
final class FeedDates {

    private FeedDates() {
    }

    static Temporal parse(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException ignored) {
            // no offset, try the local forms
        }
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException ignored) {
            // date only
        }
        try {
            return LocalDate.parse(value).atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(field + " is not a valid date-time: " + value, e);
        }
    }
}
