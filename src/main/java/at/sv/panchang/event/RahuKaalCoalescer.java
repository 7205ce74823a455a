package at.sv.panchang.event;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces Rahu Kaal events to one per calendar date of a viewer's time zone. The slots are computed in the zone of
 * the location, so a viewer far away may otherwise see two slots on one of their days.
 */
@Slf4j
public final class RahuKaalCoalescer {

    /**
     * @return the coalesced set, or {@code events} unchanged if the label is not a valid zone id
     */
    public EventSet coalesce(EventSet events, String viewerZoneLabel) {
        ZoneId viewerZone;
        try {
            viewerZone = parseZone(viewerZoneLabel);
        } catch (InvalidTimeZoneLabel e) {
            log.warn("Skip Rahu Kaal coalescing: {}", e.getMessage());
            return events;
        }
        return coalesce(events, viewerZone);
    }

    public EventSet coalesce(EventSet events, ZoneId viewerZone) {
        List<Event> kept = new ArrayList<>();
        Map<LocalDate, TimedEvent> latestPerViewerDate = new LinkedHashMap<>();
        for (Event event : events) {
            if (event instanceof TimedEvent timed && event.category() == EventCategory.RAHU_KAAL) {
                LocalDate viewerDate = timed.start().withZoneSameInstant(viewerZone).toLocalDate();
                latestPerViewerDate.merge(viewerDate, timed, RahuKaalCoalescer::later);
            } else {
                kept.add(event);
            }
        }
        kept.addAll(latestPerViewerDate.values());
        return EventSet.of(kept);
    }

    static ZoneId parseZone(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidTimeZoneLabel("Empty time zone label", null);
        }
        try {
            return ZoneId.of(label.trim());
        } catch (DateTimeException e) {
            throw new InvalidTimeZoneLabel("Invalid time zone label '" + label + "'", e);
        }
    }

    private static TimedEvent later(TimedEvent a, TimedEvent b) {
        return Comparator.comparing((TimedEvent event) -> event.start().toInstant()).compare(a, b) >= 0 ? a : b;
    }
}
