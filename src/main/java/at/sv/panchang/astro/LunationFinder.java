package at.sv.panchang.astro;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds exact new moons (Moon-Sun elongation crossing zero) and enumerates those covering a civil year.
 */
public final class LunationFinder {

    private static final Logger LOG = LoggerFactory.getLogger(LunationFinder.class);

    public static final double SYNODIC_MONTH_DAYS = 29.530588861;
    /**
     * Julian day of the mean new moon of 2000-01-06, the epoch of the mean lunation count.
     */
    static final double MEAN_NEW_MOON_EPOCH = 2451550.09766;
    static final Duration DUPLICATE_THRESHOLD = Duration.ofHours(18);
    private static final ZonedDateTime J2000_UTC = ZonedDateTime.of(2000, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final PositionProvider positionProvider;
    private final RootFinder rootFinder;

    public LunationFinder(PositionProvider positionProvider) {
        this.positionProvider = positionProvider;
        rootFinder = new RootFinder(Duration.ofHours(36), Duration.ofHours(24), 6);
    }

    /**
     * @param guess an instant near the expected new moon
     * @return the exact new moon in UTC, or empty if none could be bracketed around the guess
     */
    public Optional<ZonedDateTime> findNewMoon(ZonedDateTime guess) {
        return rootFinder.find(this::signedElongation, guess.withZoneSameInstant(ZoneOffset.UTC));
    }

    double signedElongation(ZonedDateTime instant) {
        EclipticLongitudes position = positionProvider.positionAt(instant);
        return Angles.wrap180(position.moonLon() - position.sunLon());
    }

    /**
     * @return the sorted new moons from about December 10 of the prior year until January 20 of the following year
     */
    public List<ZonedDateTime> lunationsCoveringYear(int year) {
        ZonedDateTime start = ZonedDateTime.of(year - 1, 12, 10, 0, 0, 0, 0, ZoneOffset.UTC);
        ZonedDateTime end = ZonedDateTime.of(year + 1, 1, 20, 0, 0, 0, 0, ZoneOffset.UTC);
        List<ZonedDateTime> found = new ArrayList<>();
        for (ZonedDateTime guess : guesses(start, end)) {
            Optional<ZonedDateTime> newMoon = findNewMoon(guess);
            if (newMoon.isEmpty()) {
                LOG.debug("No new moon bracketed around {}", guess);
                continue;
            }
            ZonedDateTime candidate = newMoon.get();
            if (isDuplicate(candidate, found)) {
                LOG.trace("Merged duplicate new moon {}", candidate);
                continue;
            }
            found.add(candidate);
        }
        found.sort(null);
        return found;
    }

    /**
     * Guesses one mean synodic month apart, aligned to the mean lunation so each lies within a day of a new moon. The
     * first and last guesses are the mean new moons nearest to the window bounds.
     */
    static List<ZonedDateTime> guesses(ZonedDateTime start, ZonedDateTime end) {
        long first = Math.round((JulianDay.of(start) - MEAN_NEW_MOON_EPOCH) / SYNODIC_MONTH_DAYS);
        long last = Math.round((JulianDay.of(end) - MEAN_NEW_MOON_EPOCH) / SYNODIC_MONTH_DAYS);
        List<ZonedDateTime> result = new ArrayList<>();
        for (long k = first; k <= last; k++) {
            result.add(fromJulianDay(MEAN_NEW_MOON_EPOCH + k * SYNODIC_MONTH_DAYS));
        }
        return result;
    }

    static ZonedDateTime fromJulianDay(double julianDay) {
        long seconds = Math.round((julianDay - JulianDay.J2000) * 86400.0);
        return ZonedDateTime.ofInstant(Instant.from(J2000_UTC).plusSeconds(seconds), ZoneOffset.UTC);
    }

    private static boolean isDuplicate(ZonedDateTime candidate, List<ZonedDateTime> found) {
        return found.stream()
                    .anyMatch(existing -> Duration.between(existing, candidate).abs().compareTo(DUPLICATE_THRESHOLD) < 0);
    }
}
