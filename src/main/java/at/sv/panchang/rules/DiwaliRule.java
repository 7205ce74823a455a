package at.sv.panchang.rules;

import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;
import java.util.Optional;

/**
 * Diwali on the Amavasya with the Sun in sidereal Tula, evaluated at sunset (pradosh), followed by Govardhan Puja
 * and Bhai Dooj.
 */
@Slf4j
public final class DiwaliRule implements ObservanceRule {

    public static final String KEY = "diwali";
    static final int TULA = 6;
    static final MonthDay SEASON_FROM = MonthDay.of(10, 10);
    static final MonthDay SEASON_TO = MonthDay.of(11, 20);

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
        InstantCondition amavasyaInTula = InstantCondition.tithi(context, TithiCalculator.AMAVASYA)
                                                          .and(instant -> context.getTithiCalculator().rashiAt(instant) == TULA);
        Optional<DayResult> result = DayScanner.firstMatch(context,
                DateWindow.seasonal(context.getYear(), SEASON_FROM, SEASON_TO), amavasyaInTula, Probes.SUNSET, Probes.HOURLY);
        if (result.isEmpty()) {
            log.warn("Diwali {}: no Amavasya with the Sun in Tula between {} and {}", context.getYear(), SEASON_FROM, SEASON_TO);
            return List.of();
        }
        LocalDate diwali = result.get().date();
        String zone = " (" + context.zoneId() + ").";
        return List.of(
                AllDayEvent.festival(KEY, "Diwali / Deepavali", diwali, "Kartika Amavasya at " + result.get().probe().name() + zone),
                AllDayEvent.festival(KEY, "Govardhan Puja / Annakut", diwali.plusDays(1), "Day after Diwali" + zone),
                AllDayEvent.festival(KEY, "Bhai Dooj", diwali.plusDays(2), "Second day after Diwali" + zone));
    }
}
