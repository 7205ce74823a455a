package at.sv.panchang.astro;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Names lunation intervals after the sidereal Sun at their starting new moon and maps civil dates onto them.
 */
public final class AmantaMonthMapper {

    private static final Logger LOG = LoggerFactory.getLogger(AmantaMonthMapper.class);

    private final TithiCalculator tithiCalculator;

    public AmantaMonthMapper(TithiCalculator tithiCalculator) {
        this.tithiCalculator = tithiCalculator;
    }

    /**
     * @param newMoons ascending new moon instants
     * @return one interval per consecutive pair of new moons
     */
    public List<LunationInterval> intervalsFor(List<ZonedDateTime> newMoons) {
        List<AmantaMonth> names = new ArrayList<>();
        for (int i = 0; i < newMoons.size() - 1; i++) {
            names.add(AmantaMonth.fromSiderealLongitude(tithiCalculator.siderealSolarLongitude(newMoons.get(i))));
        }
        List<LunationInterval> intervals = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            boolean adhika = i + 1 < names.size() && names.get(i) == names.get(i + 1);
            LunationInterval interval = new LunationInterval(newMoons.get(i), newMoons.get(i + 1), names.get(i), adhika);
            if (adhika) {
                LOG.debug("Intercalary month: {}", interval);
            }
            intervals.add(interval);
        }
        return intervals;
    }

    /**
     * Probes every date of the year at 12:00 UTC against the intervals.
     *
     * @throws NoLunationData if {@code intervals} is empty
     */
    public AmantaMonthMap monthMapFor(int year, List<LunationInterval> intervals) {
        if (intervals.isEmpty()) {
            throw new NoLunationData("No lunation intervals available for " + year);
        }
        Map<LocalDate, AmantaMonth> months = new HashMap<>();
        LocalDate date = LocalDate.of(year, 1, 1);
        LocalDate end = LocalDate.of(year, 12, 31);
        int uncovered = 0;
        while (!date.isAfter(end)) {
            ZonedDateTime probe = ZonedDateTime.of(date, LocalTime.NOON, ZoneOffset.UTC);
            LunationInterval match = find(intervals, probe);
            if (match != null) {
                months.put(date, match.month());
            } else {
                uncovered++;
            }
            date = date.plusDays(1);
        }
        if (uncovered > 0) {
            LOG.warn("{} dates of {} are not covered by any lunation interval", uncovered, year);
        }
        return new AmantaMonthMap(year, months);
    }

    private static LunationInterval find(List<LunationInterval> intervals, ZonedDateTime instant) {
        for (LunationInterval interval : intervals) {
            if (interval.contains(instant)) {
                return interval;
            }
        }
        return null;
    }
}
