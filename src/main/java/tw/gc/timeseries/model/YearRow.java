package tw.gc.timeseries.model;

import java.util.List;

/**
 * One year of a month-by-month table; {@code values} has 12 entries, NaN where the month has no sample.
 */
public record YearRow(int year, List<Double> values) {
    public YearRow {
        if (values.size() != 12) {
            throw new IllegalArgumentException("values must hold 12 months");
        }
        values = List.copyOf(values);
    }
}
