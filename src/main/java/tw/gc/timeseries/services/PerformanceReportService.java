package tw.gc.timeseries.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.timeseries.config.TimeSeriesProperties;
import tw.gc.timeseries.enums.SynchronizeMethod;
import tw.gc.timeseries.model.Portfolio;
import tw.gc.timeseries.model.TimeSeries;
import tw.gc.timeseries.model.TimeSeriesItem;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Performance summary of value series and portfolios.
 *
 * <h3>Metrics:</h3>
 * <ul>
 *   <li>Average annual return (geometric, from first and last value)</li>
 *   <li>Maximum drawdown with peak and trough dates</li>
 *   <li>Volatility: central weighted stdev of log returns, annualized by sqrt(periodicity)</li>
 *   <li>Portfolio: excess return over the benchmark and Sharpe ratio over the average risk-free rate</li>
 * </ul>
 * Series too short for a metric report 0 for it rather than failing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PerformanceReportService {

    private static final int MIN_VOLATILITY_POINTS = 3;

    private final TimeSeriesProperties properties;

    public PerformanceReport report(TimeSeries series) {
        Objects.requireNonNull(series, "series");
        if (series.count() < 2) {
            log.warn("Series '{}' has {} items, reporting empty performance", series.getName(), series.count());
            return new PerformanceReport(series.getName(), 0, series.count(), 0.0, 0.0, series.start(),
                series.start(), 0.0);
        }

        int periodicity = series.periodicity();
        double annualReturn = series.averageAnnualReturn();

        TimeSeries drawdown = series.maxDrawdown(false);
        TimeSeriesItem peak = drawdown.getItems().get(0);
        TimeSeriesItem trough = drawdown.getItems().get(1);
        double maxDrawdown = trough.getValue() / peak.getValue() - 1.0;

        double volatility = 0.0;
        if (series.count() >= MIN_VOLATILITY_POINTS && periodicity > 0) {
            double stdev = series.copy().logReturns().centralWeightedStdev();
            volatility = Double.isFinite(stdev) ? stdev * Math.sqrt(periodicity) : 0.0;
        }

        PerformanceReport report = new PerformanceReport(series.getName(), periodicity, series.count(),
            annualReturn, maxDrawdown, peak.getTimestamp(), trough.getTimestamp(), volatility);
        log.info("Performance '{}': return {}%, max drawdown {}% ({} -> {}), volatility {}%",
            series.getName(),
            String.format("%.2f", annualReturn * 100.0),
            String.format("%.2f", maxDrawdown * 100.0),
            report.peakDate(), report.troughDate(),
            String.format("%.2f", volatility * 100.0));
        return report;
    }

    /**
     * Report the portfolio against its benchmark and risk-free rate, both aligned onto the
     * portfolio dates first.
     */
    public PortfolioReport report(Portfolio portfolio) {
        Objects.requireNonNull(portfolio, "portfolio");
        TimeSeries series = portfolio.timeSeries();
        PerformanceReport own = report(series);
        SynchronizeMethod method = SynchronizeMethod.fromCode(properties.getSynchronize().getBenchmarkMethod());
        List<LocalDate> dates = series.timestamps();

        PerformanceReport benchmark = null;
        double excessReturn = own.averageAnnualReturn();
        if (portfolio.benchmarkTimeSeries() != null) {
            benchmark = report(portfolio.benchmarkTimeSeries().synchronize(dates, method));
            excessReturn = own.averageAnnualReturn() - benchmark.averageAnnualReturn();
        }

        double riskFree = 0.0;
        if (portfolio.riskFreeTimeSeries() != null) {
            riskFree = averageFinite(portfolio.riskFreeTimeSeries().synchronize(dates, method).values());
        }

        double sharpe = own.volatility() > 0.0 ? (own.averageAnnualReturn() - riskFree) / own.volatility() : 0.0;
        log.debug("Portfolio '{}': excess return {}, risk-free {}, sharpe {}",
            series.getName(), excessReturn, riskFree, sharpe);
        return new PortfolioReport(own, benchmark, excessReturn, riskFree, sharpe);
    }

    private static double averageFinite(double[] values) {
        double sum = 0.0;
        int count = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    public record PerformanceReport(
            String name,
            int periodicity,
            int sampleSize,
            double averageAnnualReturn,
            double maxDrawdown,
            LocalDate peakDate,
            LocalDate troughDate,
            double volatility
    ) {
    }

    public record PortfolioReport(
            PerformanceReport portfolio,
            PerformanceReport benchmark,
            double excessReturn,
            double averageRiskFreeRate,
            double sharpeRatio
    ) {
    }
}
