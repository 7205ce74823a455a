package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shardiya Navaratri in the bright half of Ashwin: its first day, Ashtami, Navami and Vijayadashami.
 */
@Slf4j
public final class NavaratriRule implements ObservanceRule {

    public static final String KEY = "navaratri";
    private static final Map<Integer, String> DAYS = new LinkedHashMap<>();

    static {
        DAYS.put(1, "Shardiya Navaratri begins");
        DAYS.put(8, "Durga Ashtami");
        DAYS.put(9, "Maha Navami");
        DAYS.put(10, "Vijayadashami / Dussehra");
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public EventCategory category() {
        return EventCategory.FESTIVAL;
    }

    @Override
    public List<Event> evaluate(RuleContext context) {
        List<Event> events = new ArrayList<>();
        for (LunationInterval ashwin : context.nijaIntervals(AmantaMonth.ASHWIN)) {
            DateWindow window = DateWindow.of(ashwin, context.getZone());
            DAYS.forEach((tithi, summary) ->
                    DayScanner.firstMatch(context, window, InstantCondition.tithi(context, tithi), Probes.SUNRISE, Probes.HOURLY)
                              .map(DayResult::date)
                              .filter(context::isInYear)
                              .ifPresentOrElse(date -> events.add(createEvent(context, summary, date)),
                                      () -> log.debug("{}: tithi {} not found in {}", summary, tithi, ashwin)));
        }
        return events;
    }

    private static Event createEvent(RuleContext context, String summary, LocalDate date) {
        return AllDayEvent.festival(KEY, summary, date, "Ashwin Shukla paksha (" + context.zoneId() + ").");
    }
}
