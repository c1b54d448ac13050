package tw.gc.timeseries.model;

import lombok.Getter;
import lombok.Setter;
import tw.gc.timeseries.enums.SynchronizeMethod;
import tw.gc.timeseries.numeric.ErrorFunction;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleFunction;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ordered collection of {@link TimeSeriesItem}s with transforms, search, re-gridding and statistics.
 *
 * <p>Items must be kept in ascending timestamp order for {@link #indexOf(LocalDate)} and
 * {@link #synchronize(List, SynchronizeMethod)}; the container never sorts by itself, call
 * {@link #sort()} after reordering.</p>
 *
 * <h3>Operator families:</h3>
 * <ul>
 *   <li>In place, returning {@code this} for chaining: {@code log, exp, add, mult, neg, inverse,
 *       diff, returns, logReturns, cumSum, cumProd, sort}</li>
 *   <li>Copy producing, the receiver is left untouched: {@code copy, range, endOfMonth,
 *       maxDrawdown, smoother, synchronize, bondTotalReturn, weighted}</li>
 * </ul>
 * Missing data is NaN and is propagated, never raised.
 */
@Getter
public class TimeSeries {

    public static final double DAYS_PER_YEAR = 365.25;

    /**
     * Upper bound of the source bracket once the last sample is reached.
     */
    static final LocalDate MAX_DATE = LocalDate.MAX;

    private static final int LINEAR_SEARCH_LIMIT = 20;

    private final List<TimeSeriesItem> items;

    @Setter
    private String name;

    @Setter
    private Function<LocalDate, String> timestampFormatter = TimeSeries::formatDate;

    @Setter
    private DoubleFunction<String> valueFormatter = valueFormatter(2);

    public TimeSeries() {
        this(null, new ArrayList<>());
    }

    public TimeSeries(List<TimeSeriesItem> items) {
        this(null, items);
    }

    public TimeSeries(String name, List<TimeSeriesItem> items) {
        this.name = name;
        this.items = new ArrayList<>(Objects.requireNonNull(items, "items"));
    }

    public static TimeSeries fromJson(JsonTimeSeries json) {
        List<TimeSeriesItem> items = new ArrayList<>(json.timestamps().size());
        for (int i = 0; i < json.timestamps().size(); i++) {
            items.add(TimeSeriesItem.parse(json.timestamps().get(i), json.valueAt(i)));
        }
        return new TimeSeries(json.key(), items);
    }

    public static String formatDate(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    public static DoubleFunction<String> valueFormatter(int decimals) {
        String pattern = "%." + decimals + "f";
        return v -> String.format(Locale.ROOT, pattern, v);
    }

    // ========== Copies ==========

    public List<TimeSeriesItem> copyItems() {
        List<TimeSeriesItem> res = new ArrayList<>(items.size());
        for (TimeSeriesItem d : items) {
            res.add(d.copy());
        }
        return res;
    }

    /**
     * Deep copy: new items, same name and formatters.
     */
    public TimeSeries copy() {
        return withItems(copyItems());
    }

    /**
     * Copies of the items with {@code start <= timestamp <= end}.
     */
    public TimeSeries range(LocalDate start, LocalDate end) {
        List<TimeSeriesItem> res = new ArrayList<>();
        for (TimeSeriesItem d : items) {
            if (!d.getTimestamp().isBefore(start) && !d.getTimestamp().isAfter(end)) {
                res.add(d.copy());
            }
        }
        return withItems(res);
    }

    private TimeSeries withItems(List<TimeSeriesItem> newItems) {
        TimeSeries res = new TimeSeries(name, newItems);
        res.timestampFormatter = timestampFormatter;
        res.valueFormatter = valueFormatter;
        return res;
    }

    public TimeSeries sort() {
        items.sort(Comparator.comparing(TimeSeriesItem::getTimestamp));
        return this;
    }

    // ========== Accessors ==========

    public double[] values() {
        double[] res = new double[items.size()];
        for (int i = 0; i < res.length; i++) {
            res[i] = items.get(i).getValue();
        }
        return res;
    }

    public List<LocalDate> timestamps() {
        return items.stream().map(TimeSeriesItem::getTimestamp).collect(Collectors.toList());
    }

    public int count() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * First timestamp, or null when empty.
     */
    public LocalDate start() {
        return items.isEmpty() ? null : items.get(0).getTimestamp();
    }

    /**
     * Last timestamp, or null when empty.
     */
    public LocalDate end() {
        return items.isEmpty() ? null : items.get(items.size() - 1).getTimestamp();
    }

    public double startValue() {
        return items.isEmpty() ? Double.NaN : items.get(0).getValue();
    }

    public double endValue() {
        return items.isEmpty() ? Double.NaN : items.get(items.size() - 1).getValue();
    }

    // ========== Search ==========

    /**
     * Index of the last item with timestamp <= {@code t}; -1 if {@code t} precedes the first item.
     * Duplicate timestamps resolve to the later index.
     */
    public int indexOf(LocalDate t) {
        int n = items.size();
        if (n == 0 || t.isBefore(date(0))) {
            return -1;
        }
        if (!t.isBefore(date(n - 1))) {
            return n - 1;
        }
        if (n > LINEAR_SEARCH_LIMIT) {
            // invariant: date(low) <= t < date(hi)
            int low = 0;
            int hi = n - 1;
            while (hi > low + 1) {
                int mid = (hi + low) >>> 1;
                if (!t.isBefore(date(mid))) {
                    low = mid;
                } else {
                    hi = mid;
                }
            }
            return low;
        }
        // index 0 is already known to be <= t
        int i = 1;
        while (!t.isBefore(date(i)) && i < n - 1) {
            i++;
        }
        return i - 1;
    }

    /**
     * Value at {@link #indexOf(LocalDate)}, NaN before the first item.
     */
    public double latestValue(LocalDate t) {
        int idx = indexOf(t);
        if (idx == -1) {
            return Double.NaN;
        }
        return items.get(idx).getValue();
    }

    private LocalDate date(int idx) {
        return items.get(idx).getTimestamp();
    }

    /**
     * Items per year from the average spacing, rounded to 252, 52, 12, 4, 2 or 1.
     * 0 for fewer than two items or a zero time span.
     */
    public int periodicity() {
        if (count() < 2) {
            return 0;
        }
        double dt = (double) ChronoUnit.DAYS.between(start(), end()) / (count() - 1);
        if (dt == 0.0) {
            return 0;
        }
        double perYear = DAYS_PER_YEAR / dt;
        if (perYear > 200.0) {
            return 252;
        }
        if (perYear > 40.0) {
            return 52;
        }
        if (perYear > 10.0) {
            return 12;
        }
        if (perYear > 3.0) {
            return 4;
        }
        if (perYear > 1.5) {
            return 2;
        }
        return 1;
    }

    // ========== In-place value operators ==========

    private TimeSeries apply(DoubleUnaryOperator op) {
        for (TimeSeriesItem d : items) {
            d.setValue(op.applyAsDouble(d.getValue()));
        }
        return this;
    }

    private static double safeLog(double v) {
        if (!Double.isFinite(v) || v <= 0.0) {
            return Double.NaN;
        }
        return Math.log(v);
    }

    /**
     * Natural log; NaN for non-finite or non-positive values.
     */
    public TimeSeries log() {
        return apply(TimeSeries::safeLog);
    }

    public TimeSeries exp() {
        return apply(Math::exp);
    }

    public TimeSeries add(double v) {
        return apply(x -> x + v);
    }

    /**
     * Multiplies finite values; non-finite values are left as they are.
     */
    public TimeSeries mult(double v) {
        return apply(x -> Double.isFinite(x) ? x * v : x);
    }

    public TimeSeries neg() {
        return mult(-1.0);
    }

    /**
     * 1/x for finite non-zero values; zero and non-finite values are left unchanged.
     */
    public TimeSeries inverse() {
        return apply(x -> (Double.isFinite(x) && x != 0.0) ? 1.0 / x : x);
    }

    private interface PairOperator {
        double apply(double v0, double v1);
    }

    // first item is consumed as seed, result is one item shorter
    private TimeSeries diffOperator(PairOperator op) {
        if (items.isEmpty()) {
            return this;
        }
        double v0 = items.remove(0).getValue();
        for (TimeSeriesItem d : items) {
            double v1 = d.getValue();
            d.setValue(op.apply(v0, v1));
            v0 = v1;
        }
        return this;
    }

    public TimeSeries diff() {
        return diffOperator((v0, v1) -> (Double.isFinite(v0) && Double.isFinite(v1)) ? v1 - v0 : Double.NaN);
    }

    /**
     * Simple returns v1/v0 - 1.
     */
    public TimeSeries returns() {
        return diffOperator((v0, v1) -> (Double.isFinite(v0) && Double.isFinite(v1) && v0 != 0.0)
            ? v1 / v0 - 1.0
            : Double.NaN);
    }

    public TimeSeries logReturns() {
        return diffOperator((v0, v1) -> (Double.isFinite(v0) && Double.isFinite(v1) && v0 != 0.0)
            ? safeLog(v1 / v0)
            : Double.NaN);
    }

    private TimeSeries cumOperator(double seed, PairOperator op) {
        double v = seed;
        for (TimeSeriesItem d : items) {
            v = op.apply(v, d.getValue());
            d.setValue(v);
        }
        return this;
    }

    /**
     * Running sum. A non-finite value turns the rest of the series into NaN.
     */
    public TimeSeries cumSum() {
        return cumOperator(0.0, (acc, v) -> (Double.isFinite(acc) && Double.isFinite(v)) ? acc + v : Double.NaN);
    }

    /**
     * Running product. A non-finite value turns the rest of the series into NaN.
     */
    public TimeSeries cumProd() {
        return cumOperator(1.0, (acc, v) -> (Double.isFinite(acc) && Double.isFinite(v)) ? acc * v : Double.NaN);
    }

    // ========== Copy-producing transforms ==========

    /**
     * Last item of every month. The first item is kept as well when another date represents its month.
     */
    public TimeSeries endOfMonth() {
        Map<YearMonth, TimeSeriesItem> eom = new LinkedHashMap<>();
        for (TimeSeriesItem d : items) {
            eom.put(YearMonth.from(d.getTimestamp()), d.copy());
        }
        List<TimeSeriesItem> res = new ArrayList<>(eom.values());
        if (!items.isEmpty()) {
            TimeSeriesItem first = items.get(0);
            if (!eom.get(YearMonth.from(first.getTimestamp())).getTimestamp().equals(first.getTimestamp())) {
                res.add(first.copy());
            }
        }
        return withItems(res).sort();
    }

    /**
     * Moving-midpoint smoothing applied {@code period} times on a copy: each pass replaces
     * item i-1 by the mean of items i-2 and i, for i from 3 to the last index.
     */
    public TimeSeries smoother(int period) {
        TimeSeries res = copy();
        List<TimeSeriesItem> vs = res.items;
        for (int j = 0; j < period; j++) {
            for (int i = 3; i < vs.size(); i++) {
                vs.get(i - 1).setValue((vs.get(i - 2).getValue() + vs.get(i).getValue()) / 2.0);
            }
        }
        return res;
    }

    // ========== Statistics ==========

    /**
     * Geometric average yearly return between first and last value, using {@link #periodicity()}.
     */
    public double averageAnnualReturn() {
        if (count() < 2) {
            return 0.0;
        }
        double years = (count() - 1) / (double) periodicity();
        return Math.exp(Math.log(endValue() / startValue()) / years) - 1.0;
    }

    /**
     * Maximum drawdown from the running maximum.
     *
     * @param fullSeries true for the drawdown (value / running max - 1) at every item, false for
     *                   copies of the peak and trough items of the deepest drawdown. Without any
     *                   decline both default to the first item.
     */
    public TimeSeries maxDrawdown(boolean fullSeries) {
        double max = -9e9;
        int maxIndex = 0;
        double maxDrawdown = 0.0;
        int startIndex = 0;
        int endIndex = 0;
        List<TimeSeriesItem> res = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            TimeSeriesItem d = items.get(i);
            double v = d.getValue();
            if (v > max) {
                max = v;
                maxIndex = i;
            }
            double drawdown = v / max - 1.0;
            if (drawdown < maxDrawdown) {
                maxDrawdown = drawdown;
                startIndex = maxIndex;
                endIndex = i;
            }
            if (fullSeries) {
                res.add(TimeSeriesItem.of(d.getTimestamp(), drawdown));
            }
        }
        if (!fullSeries && !items.isEmpty()) {
            res.add(items.get(startIndex).copy());
            res.add(items.get(endIndex).copy());
        }
        return new TimeSeries(name, res);
    }

    /**
     * Scale estimate robust to fat tails: weighted least-squares slope of the sorted values against
     * standard normal quantiles, with raised-cosine weights that fade out both tails.
     * NaN when the regression is degenerate.
     */
    public double centralWeightedStdev() {
        double[] vs = values();
        Arrays.sort(vs);
        double swx = 0.0;
        double swx2 = 0.0;
        double sw = 0.0;
        double swy = 0.0;
        double swxy = 0.0;
        int n = vs.length;
        for (int i = 0; i < n; i++) {
            double u = (i + 0.5) / n;
            double x = ErrorFunction.normalInv(u, 0.0, 1.0);
            double w = (1.0 + Math.cos(2.0 * Math.PI * (u - 0.5))) / 2.0;
            double y = vs[i];
            double xw = x * w;
            swx += xw;
            swx2 += xw * x;
            sw += w;
            swy += w * y;
            swxy += xw * y;
        }
        double a = swx * swx - swx2 * sw;
        return (swy * swx - swxy * sw) / a;
    }

    // ========== Bonds ==========

    /**
     * Gross return of a par bond bought at the rate of {@code d0} and revalued at the rate of {@code d1}.
     *
     * @param maturity      years to maturity at purchase
     * @param yearlyCoupons true for annual coupons, false for a zero-coupon bond
     */
    static double bondReturn(TimeSeriesItem d0, TimeSeriesItem d1, int maturity, boolean yearlyCoupons) {
        double dt = ChronoUnit.DAYS.between(d0.getTimestamp(), d1.getTimestamp()) / DAYS_PER_YEAR;
        if (maturity <= dt) {
            return Math.pow(1.0 + d0.getValue(), dt);
        }
        if (!yearlyCoupons) {
            return Math.pow(1.0 + d0.getValue(), maturity) * Math.pow(1.0 + d1.getValue(), dt - maturity);
        }
        double v = 0.0;
        for (int i = 1; i <= maturity; i++) {
            double principal = (i == maturity) ? 1.0 : 0.0;
            v += (principal + d0.getValue()) * Math.pow(1.0 + d1.getValue(), dt - i);
        }
        return v;
    }

    /**
     * Total return index, starting at 1.0, of rolling a constant-maturity bond along a series of par rates.
     */
    public static TimeSeries bondTotalReturn(TimeSeries parRates, int maturity, boolean yearlyCoupons) {
        TimeSeries res = parRates.copy();
        List<TimeSeriesItem> vs = res.items;
        if (vs.isEmpty()) {
            return res;
        }
        double v = 1.0;
        vs.get(0).setValue(v);
        for (int i = 1; i < vs.size(); i++) {
            v *= bondReturn(parRates.items.get(i - 1), parRates.items.get(i), maturity, yearlyCoupons);
            vs.get(i).setValue(v);
        }
        return res;
    }

    // ========== Combination and re-gridding ==========

    /**
     * Weighted sum of series sharing the same grid; timestamps come from the first series.
     */
    public static TimeSeries weighted(double[] weights, List<TimeSeries> series) {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(series, "series");
        if (series.isEmpty()) {
            return new TimeSeries();
        }
        if (weights.length != series.size()) {
            throw new IllegalArgumentException("weights and series must be the same length: "
                + weights.length + " vs " + series.size());
        }
        List<TimeSeriesItem> first = series.get(0).items;
        for (TimeSeries ts : series) {
            if (ts.count() != first.size()) {
                throw new IllegalArgumentException("all series must have the same number of items");
            }
        }
        List<TimeSeriesItem> res = new ArrayList<>(first.size());
        for (int i = 0; i < first.size(); i++) {
            double v = 0.0;
            for (int j = 0; j < series.size(); j++) {
                v += weights[j] * series.get(j).items.get(i).getValue();
            }
            res.add(TimeSeriesItem.of(first.get(i).getTimestamp(), v));
        }
        return new TimeSeries(res);
    }

    public TimeSeries synchronize(List<LocalDate> masterTimestamps) {
        return synchronize(masterTimestamps, SynchronizeMethod.LATEST);
    }

    /**
     * Projects this series onto {@code masterTimestamps} (ascending), one item per master date.
     * Both sequences are walked forward once; the source bracket {@code st <= t < stn} is
     * advanced for every master date {@code t}.
     */
    public TimeSeries synchronize(List<LocalDate> masterTimestamps, SynchronizeMethod method) {
        Objects.requireNonNull(method, "method");
        List<TimeSeriesItem> out = new ArrayList<>(masterTimestamps.size());
        int n = count();
        if (n == 0) {
            for (LocalDate t : masterTimestamps) {
                out.add(TimeSeriesItem.of(t, Double.NaN));
            }
            return withItems(out);
        }
        int j = 0;
        LocalDate st = date(j);
        LocalDate stn = (j + 1 < n) ? date(j + 1) : MAX_DATE;
        for (LocalDate t : masterTimestamps) {
            // bounded by j: LocalDate.MAX is also a legal sample date
            while (j + 1 < n && !stn.isAfter(t)) {
                st = stn;
                j++;
                stn = (j + 1 < n) ? date(j + 1) : MAX_DATE;
            }
            double v = items.get(j).getValue();
            double sv = Double.NaN;
            if (st.isAfter(t) && method == SynchronizeMethod.LATEST_START_VALUE_BEFORE_RANGE) {
                sv = v;
            } else if (st.equals(t) || (method != SynchronizeMethod.EXACT && st.isBefore(t))) {
                sv = v;
            }
            if (method == SynchronizeMethod.LATEST_ONLY_WITHIN_RANGE && st.isBefore(t) && stn.equals(MAX_DATE)) {
                sv = Double.NaN;
            }
            out.add(TimeSeriesItem.of(t, sv));
        }
        return withItems(out);
    }

    // ========== Rendering hand-off ==========

    public List<FormattedPoint> toPoints() {
        List<FormattedPoint> res = new ArrayList<>(items.size());
        for (TimeSeriesItem d : items) {
            res.add(new FormattedPoint(d.getTimestamp(), d.getValue(),
                timestampFormatter.apply(d.getTimestamp()), valueFormatter.apply(d.getValue())));
        }
        return res;
    }

    /**
     * Month-by-month table, a new row whenever the year changes between consecutive items.
     * A later item in the same month overwrites an earlier one.
     */
    public List<YearRow> monthTable() {
        List<YearRow> res = new ArrayList<>();
        Integer year = null;
        Double[] months = null;
        for (TimeSeriesItem d : items) {
            int y = d.getTimestamp().getYear();
            if (year == null || year != y) {
                if (year != null) {
                    res.add(new YearRow(year, Arrays.asList(months)));
                }
                year = y;
                months = new Double[12];
                Arrays.fill(months, Double.NaN);
            }
            months[d.getTimestamp().getMonthValue() - 1] = d.getValue();
        }
        if (year != null) {
            res.add(new YearRow(year, Arrays.asList(months)));
        }
        return Collections.unmodifiableList(res);
    }

    /**
     * Optional name line followed by one {@code timestamp = value} line per item.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (name != null && !name.isEmpty()) {
            sb.append(name).append('\n');
        }
        sb.append(items.stream()
            .map(d -> timestampFormatter.apply(d.getTimestamp()) + " = " + valueFormatter.apply(d.getValue()))
            .collect(Collectors.joining("\n")));
        return sb.toString();
    }
}
