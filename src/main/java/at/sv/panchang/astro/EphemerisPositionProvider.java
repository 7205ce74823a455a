package at.sv.panchang.astro;

import java.time.ZonedDateTime;

public final class EphemerisPositionProvider implements PositionProvider {

    private final EphemerisHandle handle;

    public EphemerisPositionProvider(EphemerisHandle handle) {
        this.handle = handle;
    }

    @Override
    public EclipticLongitudes positionAt(ZonedDateTime instant) {
        Ephemeris ephemeris = handle.get();
        double t = JulianDay.centuriesSinceJ2000(JulianDay.terrestrial(instant));
        return new EclipticLongitudes(ephemeris.sunLongitude(t), ephemeris.moonLongitude(t));
    }
}
