package at.sv.panchang.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Merges the output of the observance rules into one {@link EventSet}.
 */
@Slf4j
public final class EventAssembler {

    /**
     * Collects the included categories (all-day first, then timed), sorts them by date and time of day and keeps
     * the first event of every identity key.
     */
    public EventSet assemble(Map<EventCategory, List<Event>> candidates, AssemblyOptions options) {
        List<Event> collected = new ArrayList<>();
        for (EventCategory category : EventCategory.values()) {
            if (!options.includes(category)) {
                continue;
            }
            for (Event event : candidates.getOrDefault(category, List.of())) {
                if (options.includes(event)) {
                    collected.add(event);
                }
            }
        }
        EventSet result = EventSet.of(collected);
        if (result.size() < collected.size()) {
            log.debug("Dropped {} duplicate events", collected.size() - result.size());
        }
        return result;
    }

    /**
     * Combines already assembled sets, e.g. of consecutive years.
     */
    public EventSet merge(List<EventSet> sets) {
        List<Event> collected = new ArrayList<>();
        sets.forEach(set -> collected.addAll(set.asList()));
        return EventSet.of(collected);
    }
}
