package at.sv.panchang.rules;

import at.sv.panchang.GeoCoordinate;
import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.AmantaMonthMap;
import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.time.Daylight;
import at.sv.panchang.time.RahuKaalCalculator;
import at.sv.panchang.time.RiseSetProvider;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Everything a rule needs to evaluate one year at one location.
 */
@Getter
@Builder
public final class RuleContext {

    private final GeoCoordinate coordinate;
    private final int year;
    private final ZoneId zone;
    private final List<LunationInterval> intervals;
    private final AmantaMonthMap monthMap;
    @Builder.Default
    private final Tradition tradition = Tradition.SMARTHA;
    private final TithiCalculator tithiCalculator;
    private final RiseSetProvider riseSetProvider;
    private final RahuKaalCalculator rahuKaalCalculator;

    public int tithiAt(ZonedDateTime instant) {
        return tithiCalculator.tithiAt(instant);
    }

    public Daylight daylight(LocalDate date) {
        return riseSetProvider.sunTimes(coordinate, date, zone);
    }

    public ZonedDateTime sunrise(LocalDate date) {
        return riseSetProvider.sunrise(coordinate, date, zone);
    }

    public Optional<ZonedDateTime> moonrise(LocalDate date) {
        return riseSetProvider.moonrise(coordinate, date, zone);
    }

    public Optional<AmantaMonth> monthOf(LocalDate date) {
        return monthMap == null ? Optional.empty() : monthMap.monthOf(date);
    }

    public boolean isInYear(LocalDate date) {
        return date.getYear() == year;
    }

    /**
     * @return the non-intercalary intervals matching the selector, in chronological order
     */
    public List<LunationInterval> nijaIntervals(Predicate<LunationInterval> selector) {
        return intervals.stream().filter(interval -> !interval.adhika()).filter(selector).toList();
    }

    public List<LunationInterval> nijaIntervals(AmantaMonth month) {
        return nijaIntervals(interval -> interval.month() == month);
    }

    /**
     * @return the interval whose local date range contains the date
     */
    public Optional<LunationInterval> intervalContaining(LocalDate date) {
        return intervals.stream()
                        .filter(interval -> !date.isBefore(interval.firstLocalDate(zone)) && !date.isAfter(interval.lastLocalDate(zone)))
                        .findFirst();
    }

    public Optional<LunationInterval> intervalBefore(LunationInterval interval) {
        int index = intervals.indexOf(interval);
        return index > 0 ? Optional.of(intervals.get(index - 1)) : Optional.empty();
    }

    public String zoneId() {
        return zone.getId();
    }
}
