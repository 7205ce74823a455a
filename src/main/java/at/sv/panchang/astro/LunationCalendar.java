package at.sv.panchang.astro;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Per-year lunation intervals and month maps. Both are location independent and cached, as every rule of a year
 * works on the same intervals.
 */
public final class LunationCalendar {

    private static final Logger LOG = LoggerFactory.getLogger(LunationCalendar.class);

    private final LunationFinder lunationFinder;
    private final AmantaMonthMapper monthMapper;
    private final LoadingCache<Integer, List<LunationInterval>> intervalCache;
    private final LoadingCache<Integer, AmantaMonthMap> monthMapCache;

    public LunationCalendar(TithiCalculator tithiCalculator) {
        this(new LunationFinder(tithiCalculator.getPositionProvider()), new AmantaMonthMapper(tithiCalculator));
    }

    LunationCalendar(LunationFinder lunationFinder, AmantaMonthMapper monthMapper) {
        this.lunationFinder = lunationFinder;
        this.monthMapper = monthMapper;
        intervalCache = Caffeine.newBuilder()
                                .maximumSize(16)
                                .build(this::computeIntervals);
        monthMapCache = Caffeine.newBuilder()
                                .maximumSize(16)
                                .build(year -> monthMapper.monthMapFor(year, intervalsFor(year)));
    }

    public List<LunationInterval> intervalsFor(int year) {
        return intervalCache.get(year);
    }

    /**
     * @throws NoLunationData if no lunation could be found for the year
     */
    public AmantaMonthMap monthMapFor(int year) {
        return monthMapCache.get(year);
    }

    private List<LunationInterval> computeIntervals(int year) {
        List<ZonedDateTime> newMoons = lunationFinder.lunationsCoveringYear(year);
        List<LunationInterval> intervals = List.copyOf(monthMapper.intervalsFor(newMoons));
        LOG.debug("{}: {} new moons, {} lunation intervals", year, newMoons.size(), intervals.size());
        return intervals;
    }
}
