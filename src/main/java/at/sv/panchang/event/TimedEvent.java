package at.sv.panchang.event;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;

public record TimedEvent(String summary, String description, ZonedDateTime start, ZonedDateTime end,
                         EventCategory category, String ruleKey) implements Event {

    public TimedEvent {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Event '" + summary + "' ends at " + end + " before its start " + start);
        }
    }

    @Override
    public LocalDate date() {
        return start.toLocalDate();
    }

    @Override
    public LocalTime timeOfDay() {
        return start.toLocalTime();
    }

    @Override
    public boolean isAllDay() {
        return false;
    }

    @Override
    public String toString() {
        return start + " - " + end.toLocalTime() + " " + summary;
    }
}
