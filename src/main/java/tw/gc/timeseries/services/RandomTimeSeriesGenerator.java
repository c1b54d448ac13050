package tw.gc.timeseries.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.timeseries.calendar.BusinessDayCalendar;
import tw.gc.timeseries.config.TimeSeriesProperties;
import tw.gc.timeseries.model.TimeSeries;
import tw.gc.timeseries.model.TimeSeriesItem;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Generates reproducible random price paths for testing analytics.
 *
 * <h3>Model:</h3>
 * Daily log-normal steps starting at 100.0 with
 * <ul>
 *   <li>drift r = (1 + yearlyReturn)^(1/n) - 1 - sigma^2/2</li>
 *   <li>shock c = sigma * z, z standard normal by Box-Muller, sigma = yearlyVolatility / sqrt(n)</li>
 *   <li>value *= 1 + r + c + autocorrelation * previous c</li>
 * </ul>
 * where n is 252 for business days and 365 for calendar days. Emitted values are rounded to cents.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RandomTimeSeriesGenerator {

    private static final double START_VALUE = 100.0;

    private final BusinessDayCalendar calendar;
    private final TimeSeriesProperties properties;

    /**
     * Generate with the configured return, volatility, autocorrelation and seed.
     */
    public TimeSeries generate(String name, LocalDate start, LocalDate end) {
        TimeSeriesProperties.Random cfg = properties.getRandom();
        return generate(name, start, end, cfg.isOnlyBusinessDays(), cfg.getYearlyReturn(),
            cfg.getYearlyVolatility(), cfg.getAutocorrelation(), cfg.getSeed());
    }

    public TimeSeries generate(String name, LocalDate start, LocalDate end, boolean onlyBusinessDays,
                               double yearlyReturn, double yearlyVolatility, double autocorrelation, long seed) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (yearlyVolatility < 0.0) {
            throw new IllegalArgumentException("yearlyVolatility must be non-negative");
        }
        if (yearlyReturn <= -1.0) {
            throw new IllegalArgumentException("yearlyReturn must be greater than -1");
        }

        Random random = new Random(seed);
        LocalDate d = start;
        double n = 365.0;
        if (onlyBusinessDays) {
            n = 252.0;
            d = calendar.adjustNextBusinessDay(d);
        }
        double sigma = yearlyVolatility / Math.sqrt(n);
        double r = Math.pow(1.0 + yearlyReturn, 1.0 / n) - 1.0 - sigma * sigma / 2.0;

        List<TimeSeriesItem> items = new ArrayList<>();
        double v = START_VALUE;
        double c0 = 0.0;
        while (!d.isAfter(end)) {
            items.add(TimeSeriesItem.of(d, Math.round(100.0 * v) / 100.0));
            double c = sigma * boxMuller(random);
            v *= 1.0 + r + c + autocorrelation * c0;
            c0 = c;
            d = onlyBusinessDays ? calendar.nextBusinessDay(d) : calendar.addDays(d, 1);
        }

        TimeSeries res = new TimeSeries(name, items);
        log.info("Generated random series '{}': {} items {} to {}, seed {}",
            name, res.count(), res.start(), res.end(), seed);
        return res;
    }

    // 1 - nextDouble() lies in (0, 1], keeping the log finite
    private static double boxMuller(Random random) {
        double u = 1.0 - random.nextDouble();
        double v = 1.0 - random.nextDouble();
        return Math.sqrt(-2.0 * Math.log(u)) * Math.cos(2.0 * Math.PI * v);
    }
}
