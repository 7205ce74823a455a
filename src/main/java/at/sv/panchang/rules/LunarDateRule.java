package at.sv.panchang.rules;

import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.astro.TithiNames;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A festival on a fixed tithi of a lunar month: the first date in the month on which the tithi prevails at one of
 * the probes. An optional seasonal window restricts the search and serves as fallback if no month matched.
 */
@Slf4j
public final class LunarDateRule implements ObservanceRule {

    private static final List<DayProbe> DEFAULT_PROBES = List.of(Probes.SUNRISE, Probes.HOURLY);

    private final String key;
    private final String summary;
    private final String description;
    private final IntervalSelector months;
    private final int tithi;
    private final List<DayProbe> probes;
    private final MonthDay seasonFrom;
    private final MonthDay seasonTo;

    @Builder
    private LunarDateRule(String key, String summary, String description, IntervalSelector months, int tithi,
                          List<DayProbe> probes, MonthDay seasonFrom, MonthDay seasonTo) {
        this.key = Objects.requireNonNull(key, "key");
        this.summary = Objects.requireNonNull(summary, "summary");
        this.description = description;
        this.months = Objects.requireNonNull(months, "months");
        this.tithi = tithi;
        this.probes = probes == null || probes.isEmpty() ? DEFAULT_PROBES : List.copyOf(probes);
        if ((seasonFrom == null) != (seasonTo == null)) {
            throw new IllegalArgumentException("Season of '" + key + "' needs both bounds");
        }
        this.seasonFrom = seasonFrom;
        this.seasonTo = seasonTo;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public EventCategory category() {
        return EventCategory.FESTIVAL;
    }

    @Override
    public List<Event> evaluate(RuleContext context) {
        Set<LocalDate> dates = new LinkedHashSet<>();
        for (LunationInterval interval : months.select(context)) {
            window(context, interval).flatMap(window -> search(context, window))
                                     .filter(context::isInYear)
                                     .ifPresent(dates::add);
        }
        if (dates.isEmpty() && seasonFrom != null) {
            log.debug("{}: no matching month in {}, searching season {}..{}", key, context.getYear(), seasonFrom, seasonTo);
            search(context, DateWindow.seasonal(context.getYear(), seasonFrom, seasonTo)).ifPresent(dates::add);
        }
        List<Event> events = new ArrayList<>();
        for (LocalDate date : dates) {
            events.add(AllDayEvent.festival(key, summary, date, describe(context, date)));
        }
        return events;
    }

    private Optional<DateWindow> window(RuleContext context, LunationInterval interval) {
        DateWindow window = DateWindow.of(interval, context.getZone());
        if (seasonFrom == null) {
            return Optional.of(window);
        }
        DateWindow season = DateWindow.seasonal(context.getYear(), seasonFrom, seasonTo);
        LocalDate from = max(window.from(), season.from());
        LocalDate to = min(window.to(), season.to());
        return to.isBefore(from) ? Optional.empty() : Optional.of(new DateWindow(from, to));
    }

    private Optional<LocalDate> search(RuleContext context, DateWindow window) {
        return DayScanner.firstMatch(context, window, InstantCondition.tithi(context, tithi), probes.toArray(DayProbe[]::new))
                         .map(DayResult::date);
    }

    private String describe(RuleContext context, LocalDate date) {
        String base = description != null ? description : TithiNames.nameOf(tithi);
        return base + context.monthOf(date).map(m -> " (" + m.getLabel() + ")").orElse("") + ", " + context.zoneId() + ".";
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    @Override
    public String toString() {
        return key + " (tithi " + tithi + ")";
    }
}
