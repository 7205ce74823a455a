package at.sv.panchang;

/**
 * A location on earth in decimal degrees.
 */
public record GeoCoordinate(double latitude, double longitude) {

    public GeoCoordinate {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidCoordinate("Invalid latitude '" + latitude + "'. Expected a value in [-90..90].");
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidCoordinate("Invalid longitude '" + longitude + "'. Expected a value in [-180..180].");
        }
    }

    public static GeoCoordinate of(double latitude, double longitude) {
        return new GeoCoordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
