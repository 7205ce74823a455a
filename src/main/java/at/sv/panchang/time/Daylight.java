package at.sv.panchang.time;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Local sunrise and sunset of one date.
 */
public record Daylight(ZonedDateTime sunrise, ZonedDateTime sunset) {

    public Duration length() {
        return Duration.between(sunrise, sunset);
    }
}
