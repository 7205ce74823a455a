package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RahuKaalCalculatorTest {

    private static final GeoCoordinate MUMBAI = GeoCoordinate.of(19.076, 72.8777);
    private static final ZoneId ZONE = ZoneId.of("Asia/Kolkata");
    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);

    @Mock
    private RiseSetProvider riseSetProvider;
    private RahuKaalCalculator calculator;

    private static Daylight daylight(LocalDate date, LocalTime sunrise, LocalTime sunset) {
        return new Daylight(ZonedDateTime.of(date, sunrise, ZONE), ZonedDateTime.of(date, sunset, ZONE));
    }

    private void sixToSix() {
        when(riseSetProvider.sunTimes(eq(MUMBAI), any(), eq(ZONE)))
                .thenAnswer(invocation -> daylight(invocation.getArgument(1), LocalTime.of(6, 0), LocalTime.of(18, 0)));
    }

    private void assertSlot(RahuKaalSlot slot, LocalTime start, LocalTime end) {
        assertThat(slot.start().toLocalTime()).isEqualTo(start);
        assertThat(slot.end().toLocalTime()).isEqualTo(end);
    }

    @BeforeEach
    void setUp() {
        calculator = new RahuKaalCalculator(riseSetProvider);
    }

    @Test
    void segmentFor_weekdayTable() {
        assertThat(RahuKaalCalculator.segmentFor(DayOfWeek.MONDAY)).isEqualTo(2);
        assertThat(RahuKaalCalculator.segmentFor(DayOfWeek.TUESDAY)).isEqualTo(7);
        assertThat(RahuKaalCalculator.segmentFor(DayOfWeek.WEDNESDAY)).isEqualTo(5);
        assertThat(RahuKaalCalculator.segmentFor(DayOfWeek.THURSDAY)).isEqualTo(6);
        assertThat(RahuKaalCalculator.segmentFor(DayOfWeek.FRIDAY)).isEqualTo(4);
        assertThat(RahuKaalCalculator.segmentFor(DayOfWeek.SATURDAY)).isEqualTo(3);
        assertThat(RahuKaalCalculator.segmentFor(DayOfWeek.SUNDAY)).isEqualTo(8);
    }

    @Test
    void rahuKaalFor_twelveHourDay_everyWeekday() {
        sixToSix();

        assertSlot(calculator.rahuKaalFor(MUMBAI, MONDAY, ZONE), LocalTime.of(7, 30), LocalTime.of(9, 0));
        assertSlot(calculator.rahuKaalFor(MUMBAI, MONDAY.plusDays(1), ZONE), LocalTime.of(15, 0), LocalTime.of(16, 30));
        assertSlot(calculator.rahuKaalFor(MUMBAI, MONDAY.plusDays(2), ZONE), LocalTime.of(12, 0), LocalTime.of(13, 30));
        assertSlot(calculator.rahuKaalFor(MUMBAI, MONDAY.plusDays(3), ZONE), LocalTime.of(13, 30), LocalTime.of(15, 0));
        assertSlot(calculator.rahuKaalFor(MUMBAI, MONDAY.plusDays(4), ZONE), LocalTime.of(10, 30), LocalTime.of(12, 0));
        assertSlot(calculator.rahuKaalFor(MUMBAI, MONDAY.plusDays(5), ZONE), LocalTime.of(9, 0), LocalTime.of(10, 30));
        assertSlot(calculator.rahuKaalFor(MUMBAI, MONDAY.plusDays(6), ZONE), LocalTime.of(16, 30), LocalTime.of(18, 0));
    }

    @Test
    void rahuKaalFor_slotIsOneEighthOfDaylight_withinDaylight() {
        when(riseSetProvider.sunTimes(eq(MUMBAI), any(), eq(ZONE)))
                .thenAnswer(invocation -> daylight(invocation.getArgument(1), LocalTime.of(7, 12, 30), LocalTime.of(18, 3, 10)));

        for (int i = 0; i < 7; i++) {
            LocalDate date = MONDAY.plusDays(i);
            Daylight daylight = riseSetProvider.sunTimes(MUMBAI, date, ZONE);
            RahuKaalSlot slot = calculator.rahuKaalFor(MUMBAI, date, ZONE);

            assertThat(slot.length()).isEqualTo(daylight.length().dividedBy(8));
            assertThat(slot.start()).isAfterOrEqualTo(daylight.sunrise());
            assertThat(slot.end()).isBeforeOrEqualTo(daylight.sunset());
            assertThat(slot.daylightSubstituted()).isFalse();
        }
    }

    @Test
    void rahuKaalFor_sunsetNotAfterSunrise_assumesTwelveHours() {
        when(riseSetProvider.sunTimes(MUMBAI, MONDAY, ZONE))
                .thenReturn(daylight(MONDAY, LocalTime.of(6, 0), LocalTime.of(5, 0)));

        RahuKaalSlot slot = calculator.rahuKaalFor(MUMBAI, MONDAY, ZONE);

        assertThat(slot.daylightSubstituted()).isTrue();
        assertThat(slot.length()).isEqualTo(Duration.ofMinutes(90));
        assertSlot(slot, LocalTime.of(7, 30), LocalTime.of(9, 0));
    }

    @Test
    void rahuKaalFor_noSunrise_riseSetUndefined() {
        when(riseSetProvider.sunTimes(MUMBAI, MONDAY, ZONE)).thenThrow(new RiseSetUndefined("No sunrise"));

        assertThatThrownBy(() -> calculator.rahuKaalFor(MUMBAI, MONDAY, ZONE)).isInstanceOf(RiseSetUndefined.class);
    }

    @Test
    void forYear_oneSlotPerDate_skipsUndefinedDates() {
        LocalDate polarDay = LocalDate.of(2025, 6, 21);
        when(riseSetProvider.sunTimes(eq(MUMBAI), any(), eq(ZONE))).thenAnswer(invocation -> {
            LocalDate date = invocation.getArgument(1);
            if (date.equals(polarDay)) {
                throw new RiseSetUndefined("No sunset on " + date);
            }
            return daylight(date, LocalTime.of(6, 0), LocalTime.of(18, 0));
        });

        RahuKaalYear year = calculator.forYear(MUMBAI, 2025, ZONE);

        assertThat(year.slots()).hasSize(364);
        assertThat(year.slots()).extracting(RahuKaalSlot::date).doesNotHaveDuplicates().doesNotContain(polarDay);
        assertThat(year.skippedDates()).containsOnlyKeys(polarDay);
        assertThat(year.hasCollapsedDates()).isFalse();
    }

    @Test
    void collate_sameLocalDate_keepsLatestStart_reportsDate() {
        ZonedDateTime early = ZonedDateTime.of(MONDAY, LocalTime.of(7, 30), ZONE);
        ZonedDateTime late = ZonedDateTime.of(MONDAY, LocalTime.of(16, 30), ZONE);
        RahuKaalSlot first = new RahuKaalSlot(MONDAY, early, early.plusMinutes(90), 2, false);
        RahuKaalSlot second = new RahuKaalSlot(MONDAY.minusDays(1), late, late.plusMinutes(90), 8, false);
        RahuKaalSlot other = new RahuKaalSlot(MONDAY.plusDays(1), early.plusDays(1), early.plusDays(1).plusMinutes(90), 7, false);

        RahuKaalYear year = RahuKaalCalculator.collate(List.of(first, second, other), ZONE, Map.of());

        assertThat(year.slots()).containsExactly(second, other);
        assertThat(year.collapsedDates()).containsExactly(MONDAY);
        assertThat(year.hasCollapsedDates()).isTrue();
    }
}
