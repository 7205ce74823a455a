package at.sv.panchang.event;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSetTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kolkata");

    private static AllDayEvent allDay(String summary, LocalDate date) {
        return new AllDayEvent(summary, "", date, EventCategory.EKADASHI, "ekadashi");
    }

    private static TimedEvent rahuKaal(LocalDate date, int hour) {
        ZonedDateTime start = date.atTime(hour, 0).atZone(ZONE);
        return new TimedEvent("Rahu Kaal", "", start, start.plusMinutes(90), EventCategory.RAHU_KAAL, "rahu_kaal");
    }

    @Test
    void of_sortsByDateThenTimeOfDay_allDayFirst() {
        LocalDate date = LocalDate.of(2025, 4, 8);
        TimedEvent timed = rahuKaal(date, 15);
        AllDayEvent later = allDay("B", date.plusDays(1));
        AllDayEvent sameDay = allDay("A", date);

        EventSet set = EventSet.of(List.of(later, timed, sameDay));

        assertThat(set.asList()).containsExactly(sameDay, timed, later);
    }

    @Test
    void of_duplicateKey_firstWins() {
        LocalDate date = LocalDate.of(2025, 4, 8);
        AllDayEvent first = new AllDayEvent("Kamada Ekadashi (Shukla)", "first", date, EventCategory.EKADASHI, "ekadashi");
        AllDayEvent second = new AllDayEvent("Kamada Ekadashi (Shukla)", "second", date, EventCategory.FESTIVAL, "other");

        EventSet set = EventSet.of(List.of(first, second));

        assertThat(set.size()).isEqualTo(1);
        assertThat(set.asList().get(0).description()).isEqualTo("first");
    }

    @Test
    void of_sameSummaryOnDifferentDates_keepsBoth() {
        assertThat(EventSet.of(List.of(allDay("A", LocalDate.of(2025, 1, 1)), allDay("A", LocalDate.of(2025, 1, 2)))).size())
                .isEqualTo(2);
    }

    @Test
    void of_isDeterministic() {
        LocalDate date = LocalDate.of(2025, 4, 8);
        List<Event> events = List.of(allDay("A", date), rahuKaal(date, 9), allDay("B", date.plusDays(3)));

        assertThat(EventSet.of(events)).isEqualTo(EventSet.of(List.of(events.get(2), events.get(1), events.get(0))));
    }

    @Test
    void ofCategory_filters() {
        LocalDate date = LocalDate.of(2025, 4, 8);
        EventSet set = EventSet.of(List.of(allDay("A", date), rahuKaal(date, 9)));

        assertThat(set.ofCategory(EventCategory.RAHU_KAAL)).hasSize(1);
        assertThat(EventSet.empty().isEmpty()).isTrue();
    }

    @Test
    void timedEvent_endBeforeStart_exception() {
        ZonedDateTime start = ZonedDateTime.of(2025, 4, 8, 9, 0, 0, 0, ZONE);

        assertThatThrownBy(() -> new TimedEvent("Rahu Kaal", "", start, start, EventCategory.RAHU_KAAL, "rahu_kaal"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timedEvent_keyUsesLocalStartDate() {
        TimedEvent event = rahuKaal(LocalDate.of(2025, 4, 8), 9);

        assertThat(event.key()).isEqualTo(new EventKey("Rahu Kaal", LocalDate.of(2025, 4, 8)));
        assertThat(event.isAllDay()).isFalse();
    }
}
