package at.sv.panchang.astro;

import java.time.ZonedDateTime;

/**
 * Approximate Lahiri ayanamsha: {@code (85860" - 5028.796195" * T) / 3600} with {@code T} in Julian centuries since
 * J2000.0. A named approximation, good enough to name lunar months and zodiac signs, not an ephemeris-grade
 * precession model.
 */
public final class LahiriAyanamsha {

    static final double EPOCH_VALUE_ARC_SECONDS = 85860.0;
    static final double PRECESSION_ARC_SECONDS_PER_CENTURY = 5028.796195;

    private LahiriAyanamsha() {
    }

    public static double degreesAt(ZonedDateTime instant) {
        double t = JulianDay.centuriesSinceJ2000(JulianDay.of(instant));
        return (EPOCH_VALUE_ARC_SECONDS - PRECESSION_ARC_SECONDS_PER_CENTURY * t) / 3600.0;
    }
}
