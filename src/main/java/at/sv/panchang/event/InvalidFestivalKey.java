package at.sv.panchang.event;

public final class InvalidFestivalKey extends RuntimeException {
    public InvalidFestivalKey(String message) {
        super(message);
    }
}
