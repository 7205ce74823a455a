package at.sv.panchang.rules;

import java.time.ZonedDateTime;

/**
 * Condition a rule tests at a probed instant.
 */
@FunctionalInterface
public interface InstantCondition {

    boolean test(ZonedDateTime instant);

    static InstantCondition tithi(RuleContext context, int tithi) {
        return instant -> context.tithiAt(instant) == tithi;
    }

    default InstantCondition and(InstantCondition other) {
        return instant -> test(instant) && other.test(instant);
    }

    default InstantCondition or(InstantCondition other) {
        return instant -> test(instant) || other.test(instant);
    }
}
