package tw.gc.timeseries.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import tw.gc.timeseries.calendar.BusinessDayCalendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Calendar period of a given periodicity, identified by an ordinal that is comparable across years.
 *
 * <h3>Ordinals:</h3>
 * <ul>
 *   <li>periodicity dividing 12 (1, 2, 3, 4, 6, 12): index of the (12/periodicity)-month bucket since 1970-01</li>
 *   <li>52: week index, weeks running Monday to Sunday</li>
 *   <li>252: epoch day of the date snapped forward to a business day (a day count, not a business-day count)</li>
 *   <li>365: epoch day</li>
 * </ul>
 * Any other periodicity yields an undefined period.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DatePeriod {

    public static final long UNDEFINED = Long.MIN_VALUE;

    private static final LocalDate EPOCH = LocalDate.of(1970, 1, 1);

    private final long value;
    private final int periodicity;

    public DatePeriod(long value, int periodicity) {
        this.value = value;
        this.periodicity = periodicity;
    }

    public static long calcValue(LocalDate date, int periodicity, BusinessDayCalendar calendar) {
        Objects.requireNonNull(date, "date");
        if (periodicity <= 0) {
            return UNDEFINED;
        }
        if (periodicity <= 12) {
            if (12 % periodicity != 0) {
                return UNDEFINED;
            }
            int monthsPerPeriod = 12 / periodicity;
            return Math.floorDiv(calendar.monthNumber(date), monthsPerPeriod);
        }
        long days = date.toEpochDay();
        switch (periodicity) {
            case 52:
                // +3 so that weeks start on Monday (1970-01-01 was a Thursday)
                return Math.floorDiv(days + 3, 7);
            case 252:
                return calendar.adjustNextBusinessDay(date).toEpochDay();
            case 365:
                return days;
            default:
                return UNDEFINED;
        }
    }

    public static DatePeriod fromDate(LocalDate date, int periodicity, BusinessDayCalendar calendar) {
        return new DatePeriod(calcValue(date, periodicity, calendar), periodicity);
    }

    public boolean isDefined() {
        return value != UNDEFINED;
    }

    /**
     * Last calendar day of the period. An undefined period maps to 1970-01-01.
     */
    public LocalDate toDate() {
        if (!isDefined()) {
            return EPOCH;
        }
        if (periodicity <= 12) {
            long monthsPerPeriod = 12 / periodicity;
            return EPOCH.plusMonths(monthsPerPeriod * (value + 1)).minusDays(1);
        }
        if (periodicity == 52) {
            return LocalDate.ofEpochDay(value * 7 + 3);
        }
        return LocalDate.ofEpochDay(value);
    }

    /**
     * Period {@code n} steps away. For 252 the business-day calendar is walked from
     * {@link #toDate()}, since the ordinal counts calendar days.
     */
    public DatePeriod addPeriod(int n, BusinessDayCalendar calendar) {
        if (!isDefined()) {
            return this;
        }
        if (periodicity != 252) {
            return new DatePeriod(value + n, periodicity);
        }
        LocalDate d = toDate();
        while (n > 0) {
            d = calendar.nextBusinessDay(d);
            n--;
        }
        while (n < 0) {
            d = calendar.previousBusinessDay(d);
            n++;
        }
        return fromDate(d, periodicity, calendar);
    }

    /**
     * Period-end dates from the period of {@code start} through the period of {@code end}, inclusive.
     */
    public static List<LocalDate> range(LocalDate start, LocalDate end, int periodicity, BusinessDayCalendar calendar) {
        DatePeriod dp = fromDate(start, periodicity, calendar);
        DatePeriod last = fromDate(end, periodicity, calendar);
        List<LocalDate> res = new ArrayList<>();
        if (!dp.isDefined() || !last.isDefined()) {
            return res;
        }
        while (dp.value <= last.value) {
            res.add(dp.toDate());
            dp = dp.addPeriod(1, calendar);
        }
        return res;
    }
}
