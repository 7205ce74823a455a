package at.sv.panchang.rules;

import at.sv.panchang.time.RiseSetUndefined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Day-by-day search shared by the observance rules. Each probe is tried over the whole window before falling back to
 * the next one; within a probe the earliest matching date wins.
 */
public final class DayScanner {

    private static final Logger LOG = LoggerFactory.getLogger(DayScanner.class);

    private DayScanner() {
    }

    /**
     * @return the first matching date of the first probe that matches anywhere in the window
     */
    public static Optional<DayResult> firstMatch(RuleContext context, DateWindow window, InstantCondition condition,
                                                 DayProbe... probes) {
        for (DayProbe probe : probes) {
            int skipped = 0;
            for (LocalDate date : window.dates()) {
                DayResult result = probe(context, date, condition, probe);
                if (result.isMatch()) {
                    return Optional.of(result);
                }
                if (result.isSkipped()) {
                    skipped++;
                }
            }
            if (skipped > 0) {
                LOG.debug("{}: skipped {} dates in {}", probe.name(), skipped, window);
            }
        }
        return Optional.empty();
    }

    /**
     * @return one result per date of the window, in order
     */
    public static List<DayResult> scan(RuleContext context, DateWindow window, InstantCondition condition, DayProbe probe) {
        List<DayResult> results = new ArrayList<>();
        for (LocalDate date : window.dates()) {
            results.add(probe(context, date, condition, probe));
        }
        long skipped = results.stream().filter(DayResult::isSkipped).count();
        if (skipped > 0) {
            LOG.debug("{}: skipped {} dates in {}", probe.name(), skipped, window);
        }
        return results;
    }

    public static DayResult probe(RuleContext context, LocalDate date, InstantCondition condition, DayProbe probe) {
        List<ZonedDateTime> instants;
        try {
            instants = probe.instants(context, date);
        } catch (RiseSetUndefined e) {
            return DayResult.skipped(date, probe, e.getMessage());
        }
        if (instants.isEmpty()) {
            return DayResult.skipped(date, probe, "no " + probe.name() + " on " + date);
        }
        for (ZonedDateTime instant : instants) {
            if (condition.test(instant)) {
                return DayResult.match(date, probe, instant);
            }
        }
        return DayResult.noMatch(date, probe);
    }
}
