package at.sv.panchang.astro;

/**
 * Apparent geocentric ecliptic longitudes of Sun and Moon, in degrees [0, 360).
 */
public record EclipticLongitudes(double sunLon, double moonLon) {

    public EclipticLongitudes(double sunLon, double moonLon) {
        this.sunLon = Angles.normalize(sunLon);
        this.moonLon = Angles.normalize(moonLon);
    }

    /**
     * @return the Moon-Sun separation in [0, 360)
     */
    public double elongation() {
        return Angles.normalize(moonLon - sunLon);
    }
}
