package at.sv.panchang.astro;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Gregorian calendar to Julian day conversion.
 */
public final class JulianDay {

    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;

    private JulianDay() {
    }

    /**
     * @return the Julian day of the given instant, on the UTC time scale
     */
    public static double of(ZonedDateTime instant) {
        ZonedDateTime utc = instant.withZoneSameInstant(ZoneOffset.UTC);
        int year = utc.getYear();
        int month = utc.getMonthValue();
        double day = utc.getDayOfMonth()
                     + (utc.getHour() + (utc.getMinute() + (utc.getSecond() + utc.getNano() / 1e9) / 60.0) / 60.0) / 24.0;
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        double a = Math.floor(year / 100.0);
        double b = 2 - a + Math.floor(a / 4.0);
        return Math.floor(365.25 * (year + 4716)) + Math.floor(30.6001 * (month + 1)) + day + b - 1524.5;
    }

    /**
     * @return Julian centuries since J2000.0 for the given Julian day
     */
    public static double centuriesSinceJ2000(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * Terrestrial time Julian day. Delta-T from the polynomial fitted to 2005..2050, which is close enough for the
     * neighbouring centuries at the precision needed here.
     */
    public static double terrestrial(ZonedDateTime instant) {
        double jd = of(instant);
        double t = (jd - J2000) / 365.25;
        double deltaTSeconds = 62.92 + 0.32217 * t + 0.005589 * t * t;
        return jd + deltaTSeconds / 86400.0;
    }
}
