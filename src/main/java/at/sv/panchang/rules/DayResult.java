package at.sv.panchang.rules;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * Outcome of probing one date.
 *
 * @param matchedAt  the instant that satisfied the condition, only set for {@link Status#MATCH}
 * @param skipReason why the date could not be probed, only set for {@link Status#SKIPPED}
 */
public record DayResult(LocalDate date, Status status, DayProbe probe, ZonedDateTime matchedAt, String skipReason) {

    public enum Status {
        MATCH,
        NO_MATCH,
        SKIPPED
    }

    public static DayResult match(LocalDate date, DayProbe probe, ZonedDateTime matchedAt) {
        return new DayResult(date, Status.MATCH, probe, matchedAt, null);
    }

    public static DayResult noMatch(LocalDate date, DayProbe probe) {
        return new DayResult(date, Status.NO_MATCH, probe, null, null);
    }

    public static DayResult skipped(LocalDate date, DayProbe probe, String reason) {
        return new DayResult(date, Status.SKIPPED, probe, null, reason);
    }

    public boolean isMatch() {
        return status == Status.MATCH;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
