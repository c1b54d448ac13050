package tw.gc.timeseries.model;

import java.time.LocalDate;

/**
 * A sample paired with its display text, handed to table and chart renderers.
 */
public record FormattedPoint(LocalDate timestamp, double value, String formattedTimestamp, String formattedValue) {
}
