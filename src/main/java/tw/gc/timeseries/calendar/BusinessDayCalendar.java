package tw.gc.timeseries.calendar;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;

/**
 * Calendar provider consumed by period alignment, re-gridding and random series generation.
 *
 * <p>Implementations only decide which dates are business days; all other navigation is
 * derived from {@link #isBusinessDay(LocalDate)}.</p>
 */
public interface BusinessDayCalendar {

    /**
     * Saturday/Sunday calendar without holidays.
     */
    BusinessDayCalendar WEEKENDS = new WeekendCalendar();

    boolean isBusinessDay(LocalDate date);

    default LocalDate truncate(LocalDateTime dateTime) {
        return dateTime.toLocalDate();
    }

    default LocalDate addDays(LocalDate date, long days) {
        return date.plusDays(days);
    }

    default LocalDate addMonths(LocalDate date, long months) {
        return date.plusMonths(months);
    }

    /**
     * First business day strictly after {@code date}.
     */
    default LocalDate nextBusinessDay(LocalDate date) {
        LocalDate next = date.plusDays(1);
        while (!isBusinessDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /**
     * Last business day strictly before {@code date}.
     */
    default LocalDate previousBusinessDay(LocalDate date) {
        LocalDate prev = date.minusDays(1);
        while (!isBusinessDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    default LocalDate adjustNextBusinessDay(LocalDate date) {
        return isBusinessDay(date) ? date : nextBusinessDay(date);
    }

    default LocalDate adjustPreviousBusinessDay(LocalDate date) {
        return isBusinessDay(date) ? date : previousBusinessDay(date);
    }

    default LocalDate lastBusinessDayOfMonth(LocalDate date) {
        return adjustPreviousBusinessDay(YearMonth.from(date).atEndOfMonth());
    }

    default boolean isLastBusinessDayOfMonth(LocalDate date) {
        return date.equals(lastBusinessDayOfMonth(date));
    }

    /**
     * Months elapsed since 1970-01, negative before it.
     */
    default long monthNumber(LocalDate date) {
        return (date.getYear() - 1970L) * 12L + (date.getMonthValue() - 1);
    }

    default int weekNumber(LocalDate date) {
        return date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    default String format(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
