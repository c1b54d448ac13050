package tw.gc.timeseries.enums;

/**
 * Policy used when projecting a series onto master timestamps.
 */
public enum SynchronizeMethod {
    /**
     * Value only where the source has a sample on the exact master date, NaN elsewhere.
     */
    EXACT("exact"),

    /**
     * Latest source value at or before the master date. NaN before the first sample.
     */
    LATEST("latest"),

    /**
     * Like {@link #LATEST}, but NaN for master dates after the last source sample.
     */
    LATEST_ONLY_WITHIN_RANGE("latestOnlyWithinRange"),

    /**
     * Like {@link #LATEST}, but master dates before the first sample get the first source value.
     */
    LATEST_START_VALUE_BEFORE_RANGE("latestStartValueBeforeRange");

    private final String code;

    SynchronizeMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parse from code string (e.g., "exact", "latestOnlyWithinRange"), enum names accepted too
     */
    public static SynchronizeMethod fromCode(String code) {
        if (code == null) {
            return LATEST;
        }
        for (SynchronizeMethod method : values()) {
            if (method.code.equalsIgnoreCase(code) || method.name().equalsIgnoreCase(code)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown synchronize method: " + code);
    }
}
