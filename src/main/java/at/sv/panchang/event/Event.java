package at.sv.panchang.event;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * An immutable calendar entry, either all-day or with a start and end instant.
 */
public interface Event {

    String summary();

    String description();

    EventCategory category();

    /**
     * @return the key of the rule that produced this event, e.g. {@code diwali}
     */
    String ruleKey();

    /**
     * @return the intrinsic date: the date of an all-day event, the local start date of a timed event
     */
    LocalDate date();

    /**
     * @return the local start time, 00:00 for all-day events
     */
    LocalTime timeOfDay();

    boolean isAllDay();

    default EventKey key() {
        return new EventKey(summary(), date());
    }
}
