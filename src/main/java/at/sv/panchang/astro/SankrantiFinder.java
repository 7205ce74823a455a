package at.sv.panchang.astro;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Finds the instant the Sun enters a sidereal sign (a sankranti).
 */
public final class SankrantiFinder {

    public static final int MAKARA = 9;

    private final TithiCalculator tithiCalculator;
    private final RootFinder rootFinder;

    public SankrantiFinder(TithiCalculator tithiCalculator) {
        this.tithiCalculator = tithiCalculator;
        rootFinder = new RootFinder(Duration.ofHours(36), Duration.ofHours(24), 6);
    }

    /**
     * @param rashi 0 = Mesha .. 11 = Meena
     * @param guess an instant within about a week of the ingress
     * @return the ingress in UTC, or empty if it could not be bracketed or the Sun is not in the sign right after it
     */
    public Optional<ZonedDateTime> findIngress(int rashi, ZonedDateTime guess) {
        if (rashi < 0 || rashi > 11) {
            throw new IllegalArgumentException("Invalid rashi " + rashi + ". Expected a value in [0..11].");
        }
        double boundary = rashi * 30.0;
        return rootFinder.find(instant -> Angles.wrap180(tithiCalculator.siderealSolarLongitude(instant) - boundary),
                                 guess.withZoneSameInstant(ZoneOffset.UTC))
                         .filter(ingress -> tithiCalculator.rashiAt(ingress.plusMinutes(5)) == rashi);
    }
}
