package at.sv.panchang.event;

import java.time.LocalDate;
import java.time.LocalTime;

public record AllDayEvent(String summary, String description, LocalDate date, EventCategory category,
                          String ruleKey) implements Event {

    public static AllDayEvent festival(String ruleKey, String summary, LocalDate date, String description) {
        return new AllDayEvent(summary, description, date, EventCategory.FESTIVAL, ruleKey);
    }

    @Override
    public LocalTime timeOfDay() {
        return LocalTime.MIDNIGHT;
    }

    @Override
    public boolean isAllDay() {
        return true;
    }

    @Override
    public String toString() {
        return date + " " + summary;
    }
}
