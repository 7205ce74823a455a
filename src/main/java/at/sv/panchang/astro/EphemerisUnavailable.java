package at.sv.panchang.astro;

/**
 * Signals that the ephemeris data could not be loaded. Aborts the whole computation, retrying does not help.
 */
public final class EphemerisUnavailable extends RuntimeException {

    public EphemerisUnavailable(String message) {
        super(message);
    }

    public EphemerisUnavailable(String message, Throwable cause) {
        super(message, cause);
    }
}
