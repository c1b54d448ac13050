package tw.gc.timeseries.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "timeseries")
public class TimeSeriesProperties {

    private Calendar calendar = new Calendar();
    @Data
    public static class Calendar {
        /**
         * When true only Saturdays and Sundays are non-business days.
         */
        private boolean weekendsOnly = true;
        /**
         * Recurring holidays as MM-dd.
         */
        private List<String> fixedHolidays = new ArrayList<>();
        /**
         * One-off holidays as ISO dates (yyyy-MM-dd).
         */
        private List<String> holidays = new ArrayList<>();
    }

    private Format format = new Format();
    @Data
    public static class Format {
        private int valueDecimals = 2;
    }

    private Synchronize synchronize = new Synchronize();
    @Data
    public static class Synchronize {
        /**
         * Policy for aligning benchmark and risk-free series onto portfolio dates.
         */
        private String benchmarkMethod = "latestStartValueBeforeRange";
    }

    private Random random = new Random();
    @Data
    public static class Random {
        private boolean onlyBusinessDays = true;
        private double yearlyReturn = 0.07;
        private double yearlyVolatility = 0.15;
        private double autocorrelation = 0.0;
        private long seed = 42L;
    }
}
