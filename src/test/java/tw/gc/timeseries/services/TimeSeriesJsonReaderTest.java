package tw.gc.timeseries.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.timeseries.config.TimeSeriesProperties;
import tw.gc.timeseries.model.InvalidTimestampException;
import tw.gc.timeseries.model.JsonTimeSeries;
import tw.gc.timeseries.model.TimeSeries;
import tw.gc.timeseries.model.TimeSeriesFormatException;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeSeriesJsonReader Tests")
class TimeSeriesJsonReaderTest {

    private static final String RECORD = "{ \"key\": \"any id or name (optional)\", "
        + "\"timestamps\": [\"2016-08-31\", \"2016-09-30\", \"2016-10-31\", \"2016-11-30\"], "
        + "\"values\": [1.23, 1.27, 1.24, 1.31] }";

    private TimeSeriesProperties properties;
    private TimeSeriesJsonReader reader;

    @BeforeEach
    void setUp() {
        properties = new TimeSeriesProperties();
        reader = new TimeSeriesJsonReader(properties);
    }

    @Test
    @DisplayName("Should read a single record")
    void shouldReadRecord() {
        TimeSeries ts = reader.read(RECORD);

        assertThat(ts.count()).isEqualTo(4);
        assertThat(ts.getName()).isEqualTo("any id or name (optional)");
        assertThat(ts.start()).isEqualTo(LocalDate.of(2016, 8, 31));
        assertThat(ts.values()).containsExactly(1.23, 1.27, 1.24, 1.31);
    }

    @Test
    @DisplayName("Should map null and NaN values to NaN")
    void shouldMapMissingValues() {
        TimeSeries ts = reader.read("{\"key\":\"k\",\"timestamps\":[\"2016-08-31\",\"2016-09-30\",\"2016-10-31\"],"
            + "\"values\":[null, NaN, 2.5]}");

        assertThat(ts.values()[0]).isNaN();
        assertThat(ts.values()[1]).isNaN();
        assertThat(ts.values()[2]).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should read an array of records")
    void shouldReadArray() {
        List<TimeSeries> all = reader.readAll("[" + RECORD + ", {\"key\":\"\",\"timestamps\":[],\"values\":[]}]");

        assertThat(all).hasSize(2);
        assertThat(all.get(0).count()).isEqualTo(4);
        assertThat(all.get(1).isEmpty()).isTrue();
        assertThat(reader.readAll(RECORD)).hasSize(1);
    }

    @Test
    @DisplayName("Should apply the configured value decimals")
    void shouldApplyConfiguredDecimals() {
        properties.getFormat().setValueDecimals(3);

        TimeSeries ts = reader.read(RECORD);

        assertThat(ts.toPoints().get(0).formattedValue()).isEqualTo("1.230");
    }

    @Test
    @DisplayName("Should expose the raw record")
    void shouldReadRawRecord() {
        JsonTimeSeries json = reader.readRecord(RECORD);

        assertThat(json.key()).isEqualTo("any id or name (optional)");
        assertThat(json.timestamps()).hasSize(4);
    }

    @Test
    @DisplayName("Should reject records with unequal array lengths")
    void shouldRejectUnequalLengths() {
        assertThatThrownBy(() -> reader.read("{\"key\":\"k\",\"timestamps\":[\"2016-08-31\"],\"values\":[1,2]}"))
            .isInstanceOf(TimeSeriesFormatException.class)
            .hasMessageContaining("same length");
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> reader.read("{\"key\": "))
            .isInstanceOf(TimeSeriesFormatException.class);
        assertThatThrownBy(() -> reader.readAll("[{\"key\": 1,"))
            .isInstanceOf(TimeSeriesFormatException.class);
    }

    @Test
    @DisplayName("Should reject a null record")
    void shouldRejectNullRecord() {
        assertThatThrownBy(() -> reader.read("null"))
            .isInstanceOf(TimeSeriesFormatException.class)
            .hasMessageContaining("null");
        assertThatThrownBy(() -> reader.readAll("null"))
            .isInstanceOf(TimeSeriesFormatException.class);
        assertThatThrownBy(() -> reader.readAll("[" + RECORD + ", null]"))
            .isInstanceOf(TimeSeriesFormatException.class);
    }

    @Test
    @DisplayName("Should reject malformed timestamps")
    void shouldRejectMalformedTimestamps() {
        assertThatThrownBy(() -> reader.read("{\"key\":\"k\",\"timestamps\":[\"08/31/2016\"],\"values\":[1]}"))
            .isInstanceOf(InvalidTimestampException.class);
    }
}
