package tw.gc.timeseries.model;

import java.util.Objects;

/**
 * A portfolio value series with the benchmark and risk-free series it is measured against.
 * Benchmark and risk-free may be null.
 */
public record Portfolio(TimeSeries timeSeries, TimeSeries benchmarkTimeSeries, TimeSeries riskFreeTimeSeries) {
    public Portfolio {
        Objects.requireNonNull(timeSeries, "timeSeries");
    }
}
