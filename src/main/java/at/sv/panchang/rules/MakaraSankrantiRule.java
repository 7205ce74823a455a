package at.sv.panchang.rules;

import at.sv.panchang.astro.SankrantiFinder;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import at.sv.panchang.time.RiseSetUndefined;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Makara Sankranti: the Sun's ingress into sidereal Capricorn. Observed on the local date of the ingress, or the next
 * day if it happens after sunset.
 */
@Slf4j
public final class MakaraSankrantiRule implements ObservanceRule {

    public static final String KEY = "makara_sankranti";

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
        ZonedDateTime guess = ZonedDateTime.of(context.getYear(), 1, 14, 12, 0, 0, 0, ZoneOffset.UTC);
        Optional<ZonedDateTime> ingress = new SankrantiFinder(context.getTithiCalculator())
                .findIngress(SankrantiFinder.MAKARA, guess);
        if (ingress.isEmpty()) {
            log.warn("Makara Sankranti {}: ingress not found near {}", context.getYear(), guess);
            return List.of();
        }
        ZonedDateTime local = ingress.get().withZoneSameInstant(context.getZone());
        LocalDate date = local.toLocalDate();
        if (isAfterSunset(context, local)) {
            date = date.plusDays(1);
        }
        if (!context.isInYear(date)) {
            return List.of();
        }
        String description = "Sun enters sidereal Makara at " + local.toLocalTime().withSecond(0).withNano(0) +
                             " (" + context.zoneId() + ").";
        return List.of(AllDayEvent.festival(KEY, "Makara Sankranti", date, description));
    }

    private static boolean isAfterSunset(RuleContext context, ZonedDateTime local) {
        try {
            return local.isAfter(context.daylight(local.toLocalDate()).sunset());
        } catch (RiseSetUndefined e) {
            return false;
        }
    }
}
