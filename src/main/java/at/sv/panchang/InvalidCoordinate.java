package at.sv.panchang;

public final class InvalidCoordinate extends RuntimeException {
    public InvalidCoordinate(String message) {
        super(message);
    }
}
