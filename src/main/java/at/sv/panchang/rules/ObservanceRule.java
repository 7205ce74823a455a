package at.sv.panchang.rules;

import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;

import java.util.List;

/**
 * Derives the events of one observance for a year. Returns an empty list, not an error, if the observance does not
 * occur within its search window.
 */
public interface ObservanceRule {

    String key();

    EventCategory category();

    /**
     * @throws at.sv.panchang.astro.EphemerisUnavailable if positions can not be computed
     */
    List<Event> evaluate(RuleContext context);
}
