package tw.gc.timeseries.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.timeseries.calendar.BusinessDayCalendar;
import tw.gc.timeseries.calendar.HolidayCalendar;
import tw.gc.timeseries.calendar.WeekendCalendar;
import tw.gc.timeseries.config.TimeSeriesProperties;
import tw.gc.timeseries.model.TimeSeries;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@DisplayName("RandomTimeSeriesGenerator Tests")
class RandomTimeSeriesGeneratorTest {

    private static final LocalDate JAN_1 = LocalDate.of(2016, 1, 1);
    private static final LocalDate JAN_31 = LocalDate.of(2016, 1, 31);

    private TimeSeriesProperties properties;
    private RandomTimeSeriesGenerator generator;

    @BeforeEach
    void setUp() {
        properties = new TimeSeriesProperties();
        generator = new RandomTimeSeriesGenerator(BusinessDayCalendar.WEEKENDS, properties);
    }

    @Nested
    @DisplayName("Reproducibility Tests")
    class ReproducibilityTests {

        @Test
        @DisplayName("Same seed should reproduce identical values")
        void sameSeedReproduces() {
            TimeSeries a = generator.generate("a", JAN_1, LocalDate.of(2016, 12, 31), true, 0.07, 0.2, 0.1, 1234L);
            TimeSeries b = generator.generate("b", JAN_1, LocalDate.of(2016, 12, 31), true, 0.07, 0.2, 0.1, 1234L);

            assertThat(a.values()).containsExactly(b.values());
            assertThat(a.timestamps()).isEqualTo(b.timestamps());
        }

        @Test
        @DisplayName("Different seeds should give different paths")
        void differentSeedsDiffer() {
            TimeSeries a = generator.generate("a", JAN_1, JAN_31, true, 0.07, 0.2, 0.0, 1L);
            TimeSeries b = generator.generate("b", JAN_1, JAN_31, true, 0.07, 0.2, 0.0, 2L);

            assertThat(a.values()).isNotEqualTo(b.values());
            assertThat(a.startValue()).isEqualTo(100.0);
            assertThat(b.startValue()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Configured defaults should match an explicit call")
        void defaultsFromProperties() {
            TimeSeriesProperties.Random cfg = properties.getRandom();

            TimeSeries byDefault = generator.generate("d", JAN_1, JAN_31);
            TimeSeries explicit = generator.generate("d", JAN_1, JAN_31, cfg.isOnlyBusinessDays(),
                cfg.getYearlyReturn(), cfg.getYearlyVolatility(), cfg.getAutocorrelation(), cfg.getSeed());

            assertThat(byDefault.values()).containsExactly(explicit.values());
        }
    }

    @Nested
    @DisplayName("Calendar Tests")
    class CalendarTests {

        @Test
        @DisplayName("Business day series should only contain weekdays")
        void businessDaysOnly() {
            TimeSeries ts = generator.generate("bd", JAN_1, JAN_31, true, 0.07, 0.2, 0.0, 1L);

            assertThat(ts.count()).isEqualTo(21);
            assertThat(ts.timestamps()).allMatch(BusinessDayCalendar.WEEKENDS::isBusinessDay);
            assertThat(ts.getName()).isEqualTo("bd");
        }

        @Test
        @DisplayName("Start on a weekend should snap forward to Monday")
        void startSnapsForward() {
            TimeSeries ts = generator.generate("bd", LocalDate.of(2016, 1, 2), JAN_31, true, 0.07, 0.2, 0.0, 1L);

            assertThat(ts.start()).isEqualTo(LocalDate.of(2016, 1, 4));
        }

        @Test
        @DisplayName("Calendar day series should contain every day")
        void calendarDays() {
            TimeSeries ts = generator.generate("cd", JAN_1, JAN_31, false, 0.07, 0.2, 0.0, 1L);

            assertThat(ts.count()).isEqualTo(31);
            assertThat(ts.end()).isEqualTo(JAN_31);
        }

        @Test
        @DisplayName("Should walk the injected calendar")
        void usesInjectedCalendar() {
            HolidayCalendar holidays = spy(new HolidayCalendar(List.of(MonthDay.of(1, 1)), List.of()));
            RandomTimeSeriesGenerator g = new RandomTimeSeriesGenerator(holidays, properties);

            TimeSeries ts = g.generate("h", JAN_1, JAN_31, true, 0.07, 0.2, 0.0, 1L);

            assertThat(ts.start()).isEqualTo(LocalDate.of(2016, 1, 4));
            assertThat(ts.count()).isEqualTo(20);
            verify(holidays, atLeastOnce()).nextBusinessDay(any());
        }

        @Test
        @DisplayName("Calendar day series should not look for business days")
        void calendarDaysSkipBusinessDayLogic() {
            WeekendCalendar weekends = spy(new WeekendCalendar());
            RandomTimeSeriesGenerator g = new RandomTimeSeriesGenerator(weekends, properties);

            g.generate("c", JAN_1, JAN_31, false, 0.07, 0.2, 0.0, 1L);

            verify(weekends, never()).nextBusinessDay(any());
            verify(weekends, atLeastOnce()).addDays(any(), eq(1L));
        }

        @Test
        @DisplayName("End before start should give an empty series")
        void endBeforeStart() {
            assertThat(generator.generate("e", JAN_31, JAN_1, false, 0.07, 0.2, 0.0, 1L).isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Model Tests")
    class ModelTests {

        @Test
        @DisplayName("Zero volatility and return should stay flat at 100")
        void flatPath() {
            TimeSeries ts = generator.generate("f", JAN_1, JAN_31, false, 0.0, 0.0, 0.0, 1L);

            for (double v : ts.values()) {
                assertThat(v).isEqualTo(100.0);
            }
        }

        @Test
        @DisplayName("Zero volatility should compound the yearly return over 365 days")
        void deterministicDrift() {
            TimeSeries ts = generator.generate("f", JAN_1, LocalDate.of(2016, 12, 31), false, 0.10, 0.0, 0.0, 1L);

            assertThat(ts.count()).isEqualTo(366);
            assertThat(ts.values()[365]).isCloseTo(110.0, within(0.005));
        }

        @Test
        @DisplayName("Values should be rounded to cents")
        void roundedToCents() {
            TimeSeries ts = generator.generate("r", JAN_1, JAN_31, true, 0.07, 0.3, 0.2, 9L);

            for (double v : ts.values()) {
                assertThat(Math.abs(v * 100.0 - Math.round(v * 100.0))).isLessThan(1e-6);
            }
        }

        @Test
        @DisplayName("Invalid parameters should be rejected")
        void invalidParameters() {
            assertThatThrownBy(() -> generator.generate("x", JAN_1, JAN_31, true, 0.07, -0.1, 0.0, 1L))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> generator.generate("x", JAN_1, JAN_31, true, -1.0, 0.1, 0.0, 1L))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> generator.generate("x", null, JAN_31, true, 0.07, 0.1, 0.0, 1L))
                .isInstanceOf(NullPointerException.class);
        }
    }
}
