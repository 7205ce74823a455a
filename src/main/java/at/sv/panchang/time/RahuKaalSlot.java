package at.sv.panchang.time;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * The Rahu Kaal window [start, end) of one local date.
 *
 * @param segment              the 1-based eighth of daylight used for the weekday
 * @param daylightSubstituted  true if sunset was not after sunrise and a 12 hour daylight span was assumed instead
 */
public record RahuKaalSlot(LocalDate date, ZonedDateTime start, ZonedDateTime end, int segment,
                           boolean daylightSubstituted) {

    public Duration length() {
        return Duration.between(start, end);
    }
}
