package at.sv.panchang.astro;

import java.time.ZonedDateTime;

public interface PositionProvider {

    /**
     * @param instant the point in time, in any zone
     * @return the apparent geocentric ecliptic longitudes of Sun and Moon at the given instant
     * @throws EphemerisUnavailable if the backing ephemeris could not be loaded
     */
    EclipticLongitudes positionAt(ZonedDateTime instant);
}
