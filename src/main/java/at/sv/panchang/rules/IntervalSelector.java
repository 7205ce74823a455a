package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.LunationInterval;

import java.util.List;

/**
 * Picks the lunation intervals in which a rule searches.
 */
@FunctionalInterface
public interface IntervalSelector {

    List<LunationInterval> select(RuleContext context);

    /**
     * The non-intercalary interval(s) named {@code month} in the amanta scheme.
     */
    static IntervalSelector amanta(AmantaMonth month) {
        return context -> context.nijaIntervals(month);
    }

    /**
     * The interval(s) whose Krishna paksha the purnimanta scheme calls {@code month}, i.e. the amanta month before it.
     */
    static IntervalSelector purnimantaKrishna(AmantaMonth month) {
        return context -> context.nijaIntervals(interval -> interval.month().purnimantaKrishnaName() == month);
    }
}
