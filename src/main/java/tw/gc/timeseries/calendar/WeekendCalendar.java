package tw.gc.timeseries.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Business days are Monday to Friday.
 */
public class WeekendCalendar implements BusinessDayCalendar {

    @Override
    public boolean isBusinessDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }
}
