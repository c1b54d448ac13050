package tw.gc.timeseries;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimeSeriesAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeSeriesAnalyticsApplication.class, args);
    }
}
