package at.sv.panchang.event;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Ordered events without duplicate identity keys, sorted by (date, time of day).
 */
public final class EventSet implements Iterable<Event> {

    public static final Comparator<Event> ORDER = Comparator.comparing(Event::date).thenComparing(Event::timeOfDay);

    private final List<Event> events;

    private EventSet(List<Event> events) {
        this.events = List.copyOf(events);
    }

    public static EventSet empty() {
        return new EventSet(List.of());
    }

    /**
     * Sorts the events (stable) and drops every event whose key was already seen.
     */
    public static EventSet of(List<? extends Event> events) {
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort(ORDER);
        Set<EventKey> seen = new HashSet<>();
        List<Event> unique = new ArrayList<>(sorted.size());
        for (Event event : sorted) {
            if (seen.add(event.key())) {
                unique.add(event);
            }
        }
        return new EventSet(unique);
    }

    public List<Event> asList() {
        return events;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public Stream<Event> stream() {
        return events.stream();
    }

    public List<Event> filter(Predicate<Event> predicate) {
        return events.stream().filter(predicate).toList();
    }

    public List<Event> ofCategory(EventCategory category) {
        return filter(event -> event.category() == category);
    }

    @Override
    public Iterator<Event> iterator() {
        return events.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventSet other)) return false;
        return events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return events.hashCode();
    }

    @Override
    public String toString() {
        return "EventSet" + events;
    }
}
