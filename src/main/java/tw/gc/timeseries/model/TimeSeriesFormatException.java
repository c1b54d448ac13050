package tw.gc.timeseries.model;

/**
 * Raised when serialized time series input cannot be read.
 */
public class TimeSeriesFormatException extends RuntimeException {

    public TimeSeriesFormatException(String message) {
        super(message);
    }

    public TimeSeriesFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
