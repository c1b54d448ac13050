package tw.gc.timeseries.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw input record: a series key with parallel timestamp and value arrays.
 * A {@code null} value means missing and becomes NaN.
 */
public record JsonTimeSeries(String key, List<String> timestamps, List<Double> values) {

    @JsonCreator
    public JsonTimeSeries(@JsonProperty("key") String key,
                          @JsonProperty("timestamps") List<String> timestamps,
                          @JsonProperty("values") List<Double> values) {
        this.key = key == null ? "" : key;
        this.timestamps = timestamps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
        if (this.timestamps.size() != this.values.size()) {
            throw new IllegalArgumentException("timestamps and values must be the same length: "
                + this.timestamps.size() + " vs " + this.values.size());
        }
    }

    public double valueAt(int index) {
        Double v = values.get(index);
        return v == null ? Double.NaN : v;
    }
}
