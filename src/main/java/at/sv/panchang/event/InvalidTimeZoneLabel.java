package at.sv.panchang.event;

public final class InvalidTimeZoneLabel extends RuntimeException {
    public InvalidTimeZoneLabel(String message, Throwable cause) {
        super(message, cause);
    }
}
