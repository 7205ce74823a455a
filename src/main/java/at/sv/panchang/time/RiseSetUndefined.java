package at.sv.panchang.time;

/**
 * The sun does not rise or set on a date at a location (polar day or night). Affects only the single date.
 */
public final class RiseSetUndefined extends RuntimeException {
    public RiseSetUndefined(String message) {
        super(message);
    }
}
