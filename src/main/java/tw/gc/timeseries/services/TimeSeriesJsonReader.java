package tw.gc.timeseries.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.timeseries.config.TimeSeriesProperties;
import tw.gc.timeseries.model.JsonTimeSeries;
import tw.gc.timeseries.model.TimeSeries;
import tw.gc.timeseries.model.TimeSeriesFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads {@code {"key": ..., "timestamps": [...], "values": [...]}} records into series.
 *
 * <p>Values may be {@code null} or {@code NaN}; both become NaN. The returned series carry the
 * configured value formatter.</p>
 */
@Service
@Slf4j
public class TimeSeriesJsonReader {

    private final ObjectMapper objectMapper;
    private final TimeSeriesProperties properties;

    public TimeSeriesJsonReader(TimeSeriesProperties properties) {
        this.properties = properties;
        this.objectMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();
    }

    public JsonTimeSeries readRecord(String json) {
        Objects.requireNonNull(json, "json");
        JsonTimeSeries record;
        try {
            record = objectMapper.readValue(json, JsonTimeSeries.class);
        } catch (JsonProcessingException e) {
            throw new TimeSeriesFormatException("Invalid time series record: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new TimeSeriesFormatException("Invalid time series record: " + e.getMessage(), e);
        }
        return requireRecord(record);
    }

    /**
     * Parse one record.
     */
    public TimeSeries read(String json) {
        TimeSeries ts = toTimeSeries(readRecord(json));
        log.debug("Read series '{}' with {} items", ts.getName(), ts.count());
        return ts;
    }

    /**
     * Parse a single record or an array of records.
     */
    public List<TimeSeries> readAll(String json) {
        Objects.requireNonNull(json, "json");
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TimeSeriesFormatException("Invalid time series JSON: " + e.getOriginalMessage(), e);
        }
        List<TimeSeries> res = new ArrayList<>();
        if (root == null || root.isMissingNode()) {
            return res;
        }
        if (root.isArray()) {
            for (JsonNode node : root) {
                res.add(toTimeSeries(treeToRecord(node)));
            }
        } else {
            res.add(toTimeSeries(treeToRecord(root)));
        }
        log.debug("Read {} series", res.size());
        return res;
    }

    private JsonTimeSeries treeToRecord(JsonNode node) {
        if (node.isNull()) {
            throw new TimeSeriesFormatException("Invalid time series record: null");
        }
        try {
            return requireRecord(objectMapper.treeToValue(node, JsonTimeSeries.class));
        } catch (JsonProcessingException e) {
            throw new TimeSeriesFormatException("Invalid time series record: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new TimeSeriesFormatException("Invalid time series record: " + e.getMessage(), e);
        }
    }

    private static JsonTimeSeries requireRecord(JsonTimeSeries record) {
        if (record == null) {
            throw new TimeSeriesFormatException("Invalid time series record: null");
        }
        return record;
    }

    public TimeSeries toTimeSeries(JsonTimeSeries record) {
        TimeSeries ts = TimeSeries.fromJson(record);
        ts.setValueFormatter(TimeSeries.valueFormatter(properties.getFormat().getValueDecimals()));
        return ts;
    }
}
