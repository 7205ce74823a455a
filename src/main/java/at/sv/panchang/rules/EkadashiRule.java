package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.Paksha;
import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import at.sv.panchang.time.RiseSetUndefined;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ekadashi of both pakshas: every day with tithi 11 or 26 at sunrise.
 * <p>
 * Vaishnava observance additionally moves a day without Ekadashi at its sunrise to the next day, if Ekadashi holds at
 * the next sunrise.
 */
@Slf4j
public final class EkadashiRule implements ObservanceRule {

    public static final String KEY = "ekadashi";
    static final int SHUKLA_EKADASHI = TithiCalculator.tithiAbs(Paksha.SHUKLA, 11);
    static final int KRISHNA_EKADASHI = TithiCalculator.tithiAbs(Paksha.KRISHNA, 11);

    private enum Reason {
        AT_SUNRISE,
        NEXT_SUNRISE
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public EventCategory category() {
        return EventCategory.EKADASHI;
    }

    @Override
    public List<Event> evaluate(RuleContext context) {
        int year = context.getYear();
        LocalDate first = LocalDate.of(year, 1, 1);
        LocalDate last = LocalDate.of(year, 12, 31);
        Map<LocalDate, Integer> sunriseTithi = sunriseTithis(context, first, last.plusDays(1));
        boolean vaishnava = context.getTradition() == Tradition.VAISHNAVA;

        Map<LocalDate, Reason> observed = new LinkedHashMap<>();
        for (LocalDate date = first; !date.isAfter(last); date = date.plusDays(1)) {
            Integer today = sunriseTithi.get(date);
            if (today == null) {
                continue;
            }
            if (isEkadashi(today)) {
                observed.putIfAbsent(date, Reason.AT_SUNRISE);
            } else if (vaishnava) {
                Integer tomorrow = sunriseTithi.get(date.plusDays(1));
                if (tomorrow != null && isEkadashi(tomorrow) && context.isInYear(date.plusDays(1))) {
                    observed.putIfAbsent(date.plusDays(1), Reason.NEXT_SUNRISE);
                }
            }
        }

        List<Event> events = new ArrayList<>();
        observed.forEach((day, reason) -> events.add(
                createEvent(context, day, sunriseTithi.get(day), sunriseTithi.get(day.minusDays(1)), reason)));
        return events;
    }

    private static Map<LocalDate, Integer> sunriseTithis(RuleContext context, LocalDate from, LocalDate to) {
        Map<LocalDate, Integer> sunriseTithi = new HashMap<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            try {
                sunriseTithi.put(date, context.tithiAt(context.sunrise(date)));
            } catch (RiseSetUndefined e) {
                log.trace("Skip {}: {}", date, e.getMessage());
            }
        }
        return sunriseTithi;
    }

    static boolean isEkadashi(int tithi) {
        return tithi == SHUKLA_EKADASHI || tithi == KRISHNA_EKADASHI;
    }

    private static Event createEvent(RuleContext context, LocalDate day, int tithi, Integer previousTithi,
                                     Reason reason) {
        Paksha paksha = TithiCalculator.pakshaFor(tithi);
        boolean vaishnava = context.getTradition() == Tradition.VAISHNAVA;
        Optional<AmantaMonth> month = context.monthOf(day);
        String name = month.map(m -> EkadashiNames.nameOf(m, paksha) + " Ekadashi").orElse("Ekadashi");
        String summary = name + " (" + paksha.getLabel() + (vaishnava ? ", Vaishnava" : "") + ")";
        String timing = switch (reason) {
            case AT_SUNRISE -> "tithi " + tithi + " at sunrise";
            case NEXT_SUNRISE -> "tithi " + tithi + " at sunrise, moved from " + day.minusDays(1) +
                                 " with tithi " + previousTithi + " at sunrise";
        };
        String description = context.getTradition().getLabel() + ": " + paksha.getLabel() + " Ekadashi" +
                             month.map(m -> " of " + m.getLabel()).orElse("") +
                             ", " + timing + " (" + context.zoneId() + ").";
        return new AllDayEvent(summary, description, day, EventCategory.EKADASHI, KEY);
    }
}
