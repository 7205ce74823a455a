package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rahu Kaal: daylight divided into eight equal parts, one of which is inauspicious depending on the weekday.
 */
public final class RahuKaalCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(RahuKaalCalculator.class);

    static final int SEGMENTS = 8;
    static final Duration SUBSTITUTE_DAYLIGHT = Duration.ofHours(12);
    private static final Map<DayOfWeek, Integer> SEGMENT_BY_WEEKDAY = new EnumMap<>(Map.of(
            DayOfWeek.MONDAY, 2,
            DayOfWeek.TUESDAY, 7,
            DayOfWeek.WEDNESDAY, 5,
            DayOfWeek.THURSDAY, 6,
            DayOfWeek.FRIDAY, 4,
            DayOfWeek.SATURDAY, 3,
            DayOfWeek.SUNDAY, 8));

    private final RiseSetProvider riseSetProvider;

    public RahuKaalCalculator(RiseSetProvider riseSetProvider) {
        this.riseSetProvider = riseSetProvider;
    }

    public static int segmentFor(DayOfWeek dayOfWeek) {
        return SEGMENT_BY_WEEKDAY.get(dayOfWeek);
    }

    /**
     * @throws RiseSetUndefined if there is no sunrise or sunset on that date
     */
    public RahuKaalSlot rahuKaalFor(GeoCoordinate coordinate, LocalDate date, ZoneId zone) {
        Daylight daylight = riseSetProvider.sunTimes(coordinate, date, zone);
        ZonedDateTime sunrise = daylight.sunrise();
        Duration span = daylight.length();
        boolean substituted = false;
        if (span.isNegative() || span.isZero()) {
            LOG.debug("Sunset {} not after sunrise {} on {}: assuming 12h daylight", daylight.sunset(), sunrise, date);
            span = SUBSTITUTE_DAYLIGHT;
            substituted = true;
        }
        Duration segmentLength = span.dividedBy(SEGMENTS);
        int segment = segmentFor(date.getDayOfWeek());
        ZonedDateTime start = sunrise.plus(segmentLength.multipliedBy(segment - 1));
        return new RahuKaalSlot(date, start, start.plus(segmentLength), segment, substituted);
    }

    /**
     * Computes the slots for every date of the year. Dates without sunrise or sunset are skipped.
     */
    public RahuKaalYear forYear(GeoCoordinate coordinate, int year, ZoneId zone) {
        List<RahuKaalSlot> candidates = new ArrayList<>();
        Map<LocalDate, String> skipped = new LinkedHashMap<>();
        LocalDate date = LocalDate.of(year, 1, 1);
        LocalDate end = LocalDate.of(year, 12, 31);
        while (!date.isAfter(end)) {
            try {
                candidates.add(rahuKaalFor(coordinate, date, zone));
            } catch (RiseSetUndefined e) {
                skipped.put(date, e.getMessage());
            }
            date = date.plusDays(1);
        }
        if (!skipped.isEmpty()) {
            LOG.info("Rahu Kaal: skipped {} dates of {} without sunrise or sunset", skipped.size(), year);
        }
        return collate(candidates, zone, skipped);
    }

    /**
     * Keeps one slot per local start date, the one with the latest start. Dates where this discarded a slot are
     * reported, as several candidates for one date usually hint at a problem upstream.
     */
    static RahuKaalYear collate(Collection<RahuKaalSlot> candidates, ZoneId zone, Map<LocalDate, String> skipped) {
        Map<LocalDate, List<RahuKaalSlot>> byDate = new TreeMap<>();
        for (RahuKaalSlot slot : candidates) {
            LocalDate localDate = slot.start().withZoneSameInstant(zone).toLocalDate();
            byDate.computeIfAbsent(localDate, k -> new ArrayList<>()).add(slot);
        }
        List<RahuKaalSlot> slots = new ArrayList<>();
        List<LocalDate> collapsed = new ArrayList<>();
        byDate.forEach((localDate, slotsOfDate) -> {
            RahuKaalSlot latest = slotsOfDate.stream()
                                             .max(Comparator.comparing(slot -> slot.start().toInstant()))
                                             .orElseThrow();
            if (slotsOfDate.size() > 1) {
                LOG.warn("Rahu Kaal: {} candidate slots for {}, keeping latest start {}", slotsOfDate.size(),
                        localDate, latest.start());
                collapsed.add(localDate);
            }
            slots.add(latest);
        });
        return new RahuKaalYear(List.copyOf(slots), List.copyOf(collapsed), Map.copyOf(skipped));
    }
}
