package tw.gc.timeseries.calendar;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Market calendar with holidays on top of the weekend rule.
 *
 * <h3>Non-business days:</h3>
 * <ul>
 *   <li>Saturdays and Sundays</li>
 *   <li>Fixed holidays recurring every year on the same month-day</li>
 *   <li>Explicit holiday dates (moving holidays, one-off closures)</li>
 * </ul>
 */
@Slf4j
public class HolidayCalendar extends WeekendCalendar {

    private final Set<MonthDay> fixedHolidays;
    private final Set<LocalDate> holidays;

    public HolidayCalendar(Collection<MonthDay> fixedHolidays, Collection<LocalDate> holidays) {
        this.fixedHolidays = Set.copyOf(fixedHolidays);
        this.holidays = new TreeSet<>(holidays);
        log.debug("Holiday calendar with {} fixed and {} explicit holidays",
            this.fixedHolidays.size(), this.holidays.size());
    }

    @Override
    public boolean isBusinessDay(LocalDate date) {
        if (!super.isBusinessDay(date)) {
            return false;
        }
        return !isHoliday(date);
    }

    /**
     * Check if a weekday is a configured holiday
     */
    public boolean isHoliday(LocalDate date) {
        return fixedHolidays.contains(MonthDay.from(date)) || holidays.contains(date);
    }

    /**
     * Get holidays for a year, fixed ones included
     */
    public List<LocalDate> getHolidays(int year) {
        TreeSet<LocalDate> result = new TreeSet<>();
        for (MonthDay md : fixedHolidays) {
            if (md.isValidYear(year)) {
                result.add(md.atYear(year));
            }
        }
        for (LocalDate date : holidays) {
            if (date.getYear() == year) {
                result.add(date);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Count business days between two dates, both inclusive
     */
    public int countBusinessDays(LocalDate startDate, LocalDate endDate) {
        int count = 0;
        LocalDate current = startDate;
        while (!current.isAfter(endDate)) {
            if (isBusinessDay(current)) {
                count++;
            }
            current = current.plusDays(1);
        }
        return count;
    }
}
