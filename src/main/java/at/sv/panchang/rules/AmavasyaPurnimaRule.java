package at.sv.panchang.rules;

import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * New and full moon days: Amavasya or Purnima prevailing at sunrise.
 */
public final class AmavasyaPurnimaRule implements ObservanceRule {

    public static final String KEY = "amavasya_purnima";

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public EventCategory category() {
        return EventCategory.AMAVASYA_PURNIMA;
    }

    @Override
    public List<Event> evaluate(RuleContext context) {
        List<Event> events = new ArrayList<>();
        InstantCondition newOrFullMoon = InstantCondition.tithi(context, TithiCalculator.AMAVASYA)
                                                         .or(InstantCondition.tithi(context, TithiCalculator.PURNIMA));
        for (DayResult result : DayScanner.scan(context, DateWindow.wholeYear(context.getYear()), newOrFullMoon, Probes.SUNRISE)) {
            if (!result.isMatch()) {
                continue;
            }
            int tithi = context.tithiAt(result.matchedAt());
            if (tithi == TithiCalculator.AMAVASYA) {
                events.add(createEvent(context, result, "Amavasya", "New moon"));
            } else {
                events.add(createEvent(context, result, "Purnima", "Full moon"));
            }
        }
        return events;
    }

    private static Event createEvent(RuleContext context, DayResult result, String summary, String phase) {
        String description = phase + " tithi at sunrise " + result.matchedAt().toLocalTime().withNano(0) +
                             " (" + context.zoneId() + ").";
        return new AllDayEvent(summary, description, result.date(), EventCategory.AMAVASYA_PURNIMA, KEY);
    }
}
