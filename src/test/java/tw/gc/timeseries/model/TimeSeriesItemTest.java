package tw.gc.timeseries.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TimeSeriesItemTest {

    @Test
    void testParseDate() {
        TimeSeriesItem item = TimeSeriesItem.parse("2016-08-31", 1.23);
        assertEquals(LocalDate.of(2016, 8, 31), item.getTimestamp());
        assertEquals(1.23, item.getValue());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "2016-08-31T00:00:00.000Z",
        "2016-08-31T23:59:59+08:00",
        "2016-08-31T10:15",
        "2016-08-31 10:15:30",
        " 2016-08-31 "
    })
    void testParseDateTimeKeepsDatePart(String text) {
        assertEquals(LocalDate.of(2016, 8, 31), TimeSeriesItem.parse(text, 0.0).getTimestamp());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2016/08/31", "31-08-2016", "2016-8-31", "yesterday", "2016-08-31Tnoon"})
    void testMalformedTimestampThrows(String text) {
        InvalidTimestampException e = assertThrows(InvalidTimestampException.class,
            () -> TimeSeriesItem.parse(text, 1.0));
        assertEquals(text, e.getText());
    }

    @Test
    void testImpossibleDateThrows() {
        InvalidTimestampException e = assertThrows(InvalidTimestampException.class,
            () -> TimeSeriesItem.parse("2016-02-30", 1.0));
        assertNotNull(e.getCause());
    }

    @Test
    void testNullTimestampThrows() {
        assertThrows(InvalidTimestampException.class, () -> TimeSeriesItem.parse(null, 1.0));
        assertThrows(NullPointerException.class, () -> TimeSeriesItem.of(null, 1.0));
    }

    @Test
    void testCopyIsIndependent() {
        TimeSeriesItem item = TimeSeriesItem.of(LocalDate.of(2016, 8, 31), 1.0);
        TimeSeriesItem copy = TimeSeriesItem.copyOf(item);
        copy.setValue(2.0);

        assertEquals(1.0, item.getValue());
        assertEquals(item.getTimestamp(), copy.getTimestamp());
        assertNotSame(item, copy);
    }

    @Test
    void testFiniteValue() {
        assertTrue(TimeSeriesItem.of(LocalDate.EPOCH, 1.0).hasFiniteValue());
        assertFalse(TimeSeriesItem.of(LocalDate.EPOCH, Double.NaN).hasFiniteValue());
        assertFalse(TimeSeriesItem.of(LocalDate.EPOCH, Double.NEGATIVE_INFINITY).hasFiniteValue());
    }
}
