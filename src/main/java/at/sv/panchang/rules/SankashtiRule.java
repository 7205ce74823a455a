package at.sv.panchang.rules;

import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.astro.Paksha;
import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sankashti Chaturthi: Krishna Chaturthi at moonrise, once per lunation. Falls back to sunrise and then to any full
 * hour if the lunation has no qualifying moonrise.
 */
@Slf4j
public final class SankashtiRule implements ObservanceRule {

    public static final String KEY = "sankashti";
    static final int TITHI = TithiCalculator.tithiAbs(Paksha.KRISHNA, 4);

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public EventCategory category() {
        return EventCategory.SANKASHTI;
    }

    @Override
    public List<Event> evaluate(RuleContext context) {
        Set<LocalDate> dates = new LinkedHashSet<>();
        InstantCondition chaturthi = InstantCondition.tithi(context, TITHI);
        for (LunationInterval interval : context.getIntervals()) {
            DateWindow window = DateWindow.of(interval, context.getZone());
            Optional<DayResult> result = DayScanner.firstMatch(context, window, chaturthi,
                    Probes.MOONRISE, Probes.SUNRISE, Probes.HOURLY);
            if (result.isEmpty()) {
                log.debug("No Krishna Chaturthi found in {}", interval);
                continue;
            }
            LocalDate date = result.get().date();
            if (context.isInYear(date)) {
                dates.add(date);
            }
        }
        List<Event> events = new ArrayList<>();
        for (LocalDate date : dates) {
            events.add(createEvent(context, date));
        }
        return events;
    }

    private static Event createEvent(RuleContext context, LocalDate date) {
        boolean angarki = date.getDayOfWeek() == DayOfWeek.TUESDAY;
        String summary = (angarki ? "Angarki " : "") + "Sankashti Chaturthi (Krishna)";
        String description = "Krishna Chaturthi at moonrise" +
                             context.monthOf(date).map(m -> " in " + m.getLabel()).orElse("") +
                             (angarki ? ", falls on a Tuesday" : "") +
                             " (" + context.zoneId() + ").";
        return new AllDayEvent(summary, description, date, EventCategory.SANKASHTI, KEY);
    }
}
