package at.sv.panchang.astro;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * One amanta lunar month: from the new moon {@code start} (inclusive) to the next new moon {@code end} (exclusive).
 *
 * @param adhika true if the next interval carries the same month name, i.e. this is an intercalary month
 */
public record LunationInterval(ZonedDateTime start, ZonedDateTime end, AmantaMonth month, boolean adhika) {

    public LunationInterval {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Interval end " + end + " must be after start " + start);
        }
    }

    public boolean contains(ZonedDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public LocalDate firstLocalDate(ZoneId zone) {
        return start.withZoneSameInstant(zone).toLocalDate();
    }

    public LocalDate lastLocalDate(ZoneId zone) {
        return end.minusSeconds(1).withZoneSameInstant(zone).toLocalDate();
    }

    public String getMonthName() {
        return month.getLabel();
    }

    @Override
    public String toString() {
        return month.getLabel() + (adhika ? " (adhika)" : "") + " [" + start + " .. " + end + ")";
    }
}
