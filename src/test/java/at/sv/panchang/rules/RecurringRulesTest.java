package at.sv.panchang.rules;

import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import at.sv.panchang.event.TimedEvent;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class RecurringRulesTest {

    private static RuleContext context;

    @BeforeAll
    static void setUp() {
        context = RuleContexts.mumbai(2025);
    }

    @Test
    void amavasyaPurnima_countAndNoOverlapWithEkadashi() {
        List<Event> events = new AmavasyaPurnimaRule().evaluate(context);
        Set<LocalDate> ekadashi = new EkadashiRule().evaluate(context).stream().map(Event::date).collect(Collectors.toSet());

        assertThat(events).hasSizeBetween(22, 27);
        assertThat(events).extracting(Event::summary).containsOnly("Amavasya", "Purnima");
        assertThat(events).extracting(Event::date).doesNotHaveDuplicates().noneMatch(ekadashi::contains);
        assertThat(events).filteredOn(event -> event.date().equals(LocalDate.of(2025, 4, 12)))
                          .extracting(Event::summary)
                          .containsExactly("Purnima");
    }

    @Test
    void sankashti_oncePerLunation_angarkiOnTuesday() {
        List<Event> events = new SankashtiRule().evaluate(context);

        assertThat(events).hasSizeBetween(11, 13);
        assertThat(events).extracting(Event::date).doesNotHaveDuplicates();
        for (Event event : events) {
            boolean tuesday = event.date().getDayOfWeek() == DayOfWeek.TUESDAY;
            assertThat(event.summary()).isEqualTo(tuesday ? "Angarki Sankashti Chaturthi (Krishna)" : "Sankashti Chaturthi (Krishna)");
            assertThat(event.category()).isEqualTo(EventCategory.SANKASHTI);
        }
    }

    @Test
    void sankashti_karwaChauthIsTheAshwinSankashti() {
        List<LocalDate> sankashti = new SankashtiRule().evaluate(context).stream().map(Event::date).toList();

        assertThat(sankashti).contains(LocalDate.of(2025, 10, 10));
    }

    @Test
    void rahuKaal_oneTimedSlotPerDate() {
        List<Event> events = new RahuKaalRule().evaluate(context);

        assertThat(events).hasSize(365);
        assertThat(events).allMatch(event -> event instanceof TimedEvent && !event.isAllDay());
        assertThat(events).extracting(Event::date).doesNotHaveDuplicates();
        TimedEvent monday = (TimedEvent) events.stream()
                                               .filter(event -> event.date().equals(LocalDate.of(2025, 1, 6)))
                                               .findFirst().orElseThrow();
        assertThat(monday.summary()).isEqualTo("Rahu Kaal");
        assertThat(monday.description()).contains("segment 2");
        assertThat(monday.start().getHour()).isBetween(8, 9);
    }
}
