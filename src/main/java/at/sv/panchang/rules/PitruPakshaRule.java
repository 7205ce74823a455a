package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pitru Paksha, the dark half of Bhadrapada: from Krishna Pratipada to Sarva Pitru Amavasya. Emitted only if both
 * ends are found.
 */
@Slf4j
public final class PitruPakshaRule implements ObservanceRule {

    public static final String KEY = "pitru_paksha";
    static final int PRATIPADA = TithiCalculator.PURNIMA + 1;

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
        for (LunationInterval bhadrapada : context.nijaIntervals(AmantaMonth.BHADRAPADA)) {
            DateWindow window = DateWindow.of(bhadrapada, context.getZone());
            Optional<LocalDate> begin = find(context, window, PRATIPADA);
            // the interval may open on the previous Amavasya
            Optional<LocalDate> end = begin.flatMap(b -> find(context, new DateWindow(b, window.to()), TithiCalculator.AMAVASYA));
            if (begin.isEmpty() || end.isEmpty()) {
                log.debug("Pitru Paksha incomplete in {}: begin {}, end {}", bhadrapada, begin, end);
                continue;
            }
            String description = "Fortnight of ancestors, " + begin.get() + " to " + end.get() + " (" + context.zoneId() + ").";
            if (context.isInYear(begin.get())) {
                events.add(AllDayEvent.festival(KEY, "Pitru Paksha begins", begin.get(), description));
            }
            if (context.isInYear(end.get())) {
                events.add(AllDayEvent.festival(KEY, "Sarva Pitru Amavasya (Pitru Paksha ends)", end.get(), description));
            }
        }
        return events;
    }

    private static Optional<LocalDate> find(RuleContext context, DateWindow window, int tithi) {
        return DayScanner.firstMatch(context, window, InstantCondition.tithi(context, tithi), Probes.SUNRISE, Probes.HOURLY)
                         .map(DayResult::date);
    }
}
