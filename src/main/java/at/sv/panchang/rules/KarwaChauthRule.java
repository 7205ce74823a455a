package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Karwa Chauth: Krishna Chaturthi of amanta Ashwin (purnimanta Kartika) at moonrise.
 */
public final class KarwaChauthRule implements ObservanceRule {

    public static final String KEY = "karwa_chauth";
    private static final DayProbe EVENING = Probes.hours(15, 23);

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
            DayScanner.firstMatch(context, DateWindow.of(ashwin, context.getZone()),
                              InstantCondition.tithi(context, SankashtiRule.TITHI), Probes.MOONRISE, Probes.SUNRISE, EVENING)
                      .filter(result -> context.isInYear(result.date()))
                      .ifPresent(result -> events.add(AllDayEvent.festival(KEY, "Karwa Chauth", result.date(),
                              "Krishna Chaturthi at " + result.probe().name() + " (" + context.zoneId() + ").")));
        }
        return events;
    }
}
