package at.sv.panchang.astro;

final class Angles {

    private Angles() {
    }

    /**
     * Floor modulo for degrees; the result has the sign of the divisor.
     */
    static double normalize(double degrees) {
        double result = degrees - 360.0 * Math.floor(degrees / 360.0);
        return result >= 360.0 ? 0.0 : result;
    }

    /**
     * Wraps into (-180, 180].
     */
    static double wrap180(double degrees) {
        double result = normalize(degrees);
        return result > 180.0 ? result - 360.0 : result;
    }

    static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }
}
