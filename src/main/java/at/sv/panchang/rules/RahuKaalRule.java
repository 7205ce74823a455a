package at.sv.panchang.rules;

import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import at.sv.panchang.event.TimedEvent;
import at.sv.panchang.time.RahuKaalSlot;
import at.sv.panchang.time.RahuKaalYear;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * One timed Rahu Kaal event per date with sunrise and sunset.
 */
@Slf4j
public final class RahuKaalRule implements ObservanceRule {

    public static final String KEY = "rahu_kaal";

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public EventCategory category() {
        return EventCategory.RAHU_KAAL;
    }

    @Override
    public List<Event> evaluate(RuleContext context) {
        RahuKaalYear year = context.getRahuKaalCalculator()
                                   .forYear(context.getCoordinate(), context.getYear(), context.getZone());
        if (year.hasCollapsedDates()) {
            log.warn("Rahu Kaal {}: collapsed candidate slots on {}", context.getYear(), year.collapsedDates());
        }
        List<Event> events = new ArrayList<>();
        for (RahuKaalSlot slot : year.slots()) {
            String description = "Day divided into eight parts; weekday segment " + slot.segment() +
                                 (slot.daylightSubstituted() ? ", 12h daylight assumed" : "") +
                                 " (" + context.zoneId() + ").";
            events.add(new TimedEvent("Rahu Kaal", description, slot.start(), slot.end(), EventCategory.RAHU_KAAL, KEY));
        }
        return events;
    }
}
