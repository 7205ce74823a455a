package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Holika Dahan on the evening of Phalguna Purnima, Holi the day after.
 */
public final class HoliRule implements ObservanceRule {

    public static final String KEY = "holi";
    private static final DayProbe NIGHT = Probes.hours(19, 23);

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
        for (LunationInterval phalguna : context.nijaIntervals(AmantaMonth.PHALGUNA)) {
            DayScanner.firstMatch(context, DateWindow.of(phalguna, context.getZone()),
                              InstantCondition.tithi(context, TithiCalculator.PURNIMA), Probes.SUNSET, NIGHT, Probes.HOURLY)
                      .map(DayResult::date)
                      .ifPresent(dahan -> addEvents(context, dahan, events));
        }
        return events;
    }

    private static void addEvents(RuleContext context, LocalDate dahan, List<Event> events) {
        String zone = " (" + context.zoneId() + ").";
        if (context.isInYear(dahan)) {
            events.add(AllDayEvent.festival(KEY, "Holika Dahan", dahan, "Phalguna Purnima after sunset" + zone));
        }
        if (context.isInYear(dahan.plusDays(1))) {
            events.add(AllDayEvent.festival(KEY, "Holi (Dhulandi)", dahan.plusDays(1), "Day after Holika Dahan" + zone));
        }
    }
}
