package at.sv.panchang.astro;

import java.util.List;

import static at.sv.panchang.astro.Angles.sinDeg;

/**
 * Truncated analytical theories for the apparent longitudes of Sun and Moon. Solar longitude is good to about 0.01
 * degree, lunar longitude to about 10 arc seconds, which is well below the 12 degree width of a tithi.
 */
public final class Ephemeris {

    private final List<MoonTerm> moonTerms;

    Ephemeris(List<MoonTerm> moonTerms) {
        this.moonTerms = List.copyOf(moonTerms);
    }

    public int getMoonTermCount() {
        return moonTerms.size();
    }

    /**
     * @param t Julian centuries (TT) since J2000.0
     * @return apparent longitude of the Sun in degrees, including aberration and nutation
     */
    public double sunLongitude(double t) {
        double l0 = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double m = 357.52911 + 35999.05029 * t - 0.0001537 * t * t;
        double center = (1.914602 - 0.004817 * t - 0.000014 * t * t) * sinDeg(m)
                        + (0.019993 - 0.000101 * t) * sinDeg(2 * m)
                        + 0.000289 * sinDeg(3 * m);
        double omega = 125.04 - 1934.136 * t;
        return Angles.normalize(l0 + center - 0.00569 - 0.00478 * sinDeg(omega));
    }

    /**
     * @param t Julian centuries (TT) since J2000.0
     * @return apparent longitude of the Moon in degrees, including nutation
     */
    public double moonLongitude(double t) {
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t3 * t;
        double meanLongitude = 218.3164477 + 481267.88123421 * t - 0.0015786 * t2 + t3 / 538841.0 - t4 / 65194000.0;
        double elongation = 297.8501921 + 445267.1114034 * t - 0.0018819 * t2 + t3 / 545868.0 - t4 / 113065000.0;
        double sunAnomaly = 357.5291092 + 35999.0502909 * t - 0.0001536 * t2 + t3 / 24490000.0;
        double moonAnomaly = 134.9633964 + 477198.8675055 * t + 0.0087414 * t2 + t3 / 69699.0 - t4 / 14712000.0;
        double latitudeArgument = 93.2720950 + 483202.0175233 * t - 0.0036539 * t2 - t3 / 3526000.0 + t4 / 863310000.0;
        double eccentricity = 1.0 - 0.002516 * t - 0.0000074 * t2;

        double sum = 0.0;
        for (MoonTerm term : moonTerms) {
            double argument = term.d() * elongation + term.m() * sunAnomaly + term.mPrime() * moonAnomaly
                              + term.f() * latitudeArgument;
            double coefficient = term.coefficient();
            if (term.m() != 0) {
                coefficient *= Math.pow(eccentricity, Math.abs(term.m()));
            }
            sum += coefficient * sinDeg(argument);
        }
        double a1 = 119.75 + 131.849 * t;
        double a2 = 53.09 + 479264.290 * t;
        sum += 3958.0 * sinDeg(a1) + 1962.0 * sinDeg(meanLongitude - latitudeArgument) + 318.0 * sinDeg(a2);

        return Angles.normalize(meanLongitude + sum / 1_000_000.0 + nutationInLongitude(t));
    }

    /**
     * @return nutation in longitude in degrees, four largest terms
     */
    static double nutationInLongitude(double t) {
        double omega = 125.04452 - 1934.136261 * t;
        double sunMean = 280.4665 + 36000.7698 * t;
        double moonMean = 218.3165 + 481267.8813 * t;
        double arcSeconds = -17.20 * sinDeg(omega) - 1.32 * sinDeg(2 * sunMean) - 0.23 * sinDeg(2 * moonMean)
                            + 0.21 * sinDeg(2 * omega);
        return arcSeconds / 3600.0;
    }
}
