package tw.gc.timeseries.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.timeseries.calendar.BusinessDayCalendar;
import tw.gc.timeseries.calendar.HolidayCalendar;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class CalendarConfig {

    @Bean
    public BusinessDayCalendar businessDayCalendar(TimeSeriesProperties properties) {
        TimeSeriesProperties.Calendar cfg = properties.getCalendar();
        if (cfg.isWeekendsOnly()) {
            log.info("Using weekend-only business day calendar");
            return BusinessDayCalendar.WEEKENDS;
        }
        List<MonthDay> fixed = cfg.getFixedHolidays().stream()
            .map(CalendarConfig::parseMonthDay)
            .collect(Collectors.toList());
        List<LocalDate> holidays = cfg.getHolidays().stream()
            .map(CalendarConfig::parseDate)
            .collect(Collectors.toList());
        log.info("Using holiday calendar: {} fixed holidays, {} dated holidays", fixed.size(), holidays.size());
        return new HolidayCalendar(fixed, holidays);
    }

    static MonthDay parseMonthDay(String text) {
        try {
            return MonthDay.parse("--" + text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid fixed holiday (expected MM-dd): " + text, e);
        }
    }

    static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid holiday date (expected yyyy-MM-dd): " + text, e);
        }
    }
}
