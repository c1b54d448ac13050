package tw.gc.timeseries.model;

/**
 * Thrown when a timestamp text is neither an ISO date nor an ISO date-time.
 */
public class InvalidTimestampException extends IllegalArgumentException {

    private final String text;

    public InvalidTimestampException(String text) {
        super("Not an ISO-8601 date or date-time: '" + text + "'");
        this.text = text;
    }

    public InvalidTimestampException(String text, Throwable cause) {
        super("Not an ISO-8601 date or date-time: '" + text + "'", cause);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
