package tw.gc.timeseries.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One (timestamp, value) observation. NaN marks a missing value.
 *
 * <p>Fields are mutable so that in-place series transforms can rewrite values.</p>
 */
@Data
@AllArgsConstructor
public class TimeSeriesItem {

    private static final Pattern ISO_DATE =
        Pattern.compile("\\d{4}-[01]\\d-[0-3]\\d");
    private static final Pattern ISO_DATE_TIME =
        Pattern.compile("\\d{4}-[01]\\d-[0-3]\\d[T ][0-2]\\d:[0-5]\\d(:[0-5]\\d(\\.\\d+)?)?(Z|[+-][0-2]\\d:?[0-5]\\d)?");

    private LocalDate timestamp;
    private double value;

    public static TimeSeriesItem of(LocalDate timestamp, double value) {
        return new TimeSeriesItem(Objects.requireNonNull(timestamp, "timestamp"), value);
    }

    public static TimeSeriesItem copyOf(TimeSeriesItem item) {
        return new TimeSeriesItem(item.timestamp, item.value);
    }

    /**
     * Build from ISO-8601 date ({@code 2016-08-31}) or date-time text. The date part is kept as
     * written; a time of day or offset is dropped.
     *
     * @throws InvalidTimestampException if the text is not an ISO date or date-time
     */
    public static TimeSeriesItem parse(String timestamp, double value) {
        return new TimeSeriesItem(parseDate(timestamp), value);
    }

    static LocalDate parseDate(String text) {
        if (text == null) {
            throw new InvalidTimestampException(null);
        }
        String trimmed = text.trim();
        if (!ISO_DATE.matcher(trimmed).matches() && !ISO_DATE_TIME.matcher(trimmed).matches()) {
            throw new InvalidTimestampException(text);
        }
        try {
            return LocalDate.parse(trimmed.substring(0, 10));
        } catch (DateTimeParseException e) {
            // pattern matched but e.g. 2016-02-30
            throw new InvalidTimestampException(text, e);
        }
    }

    public TimeSeriesItem copy() {
        return copyOf(this);
    }

    public boolean hasFiniteValue() {
        return Double.isFinite(value);
    }
}
