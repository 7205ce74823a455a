package at.sv.panchang.rules;

import at.sv.panchang.astro.LunationInterval;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of local dates searched by a rule.
 */
public record DateWindow(LocalDate from, LocalDate to) {

    public DateWindow {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Window end " + to + " before start " + from);
        }
    }

    public static DateWindow of(LunationInterval interval, ZoneId zone) {
        return new DateWindow(interval.firstLocalDate(zone), interval.lastLocalDate(zone));
    }

    public static DateWindow seasonal(int year, MonthDay from, MonthDay to) {
        return new DateWindow(from.atYear(year), to.atYear(year));
    }

    public static DateWindow wholeYear(int year) {
        return new DateWindow(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    public static DateWindow days(LocalDate from, int count) {
        return new DateWindow(from, from.plusDays(count - 1L));
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            dates.add(date);
        }
        return dates;
    }

    @Override
    public String toString() {
        return from + ".." + to;
    }
}
