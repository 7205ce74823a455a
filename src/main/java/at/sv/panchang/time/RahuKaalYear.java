package at.sv.panchang.time;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Rahu Kaal slots of a year, together with the dates that had to be collapsed or skipped.
 *
 * @param slots          one slot per local date, ordered by start
 * @param collapsedDates dates that produced more than one candidate slot; only the latest start was kept
 * @param skippedDates   dates without sunrise or sunset, with the reason
 */
public record RahuKaalYear(List<RahuKaalSlot> slots, List<LocalDate> collapsedDates,
                           Map<LocalDate, String> skippedDates) {

    public boolean hasCollapsedDates() {
        return !collapsedDates.isEmpty();
    }
}
