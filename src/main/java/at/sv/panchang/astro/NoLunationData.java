package at.sv.panchang.astro;

/**
 * Thrown when lunar months are requested for a year without any lunation data.
 */
public final class NoLunationData extends RuntimeException {
    public NoLunationData(String message) {
        super(message);
    }
}
