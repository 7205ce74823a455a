package at.sv.panchang.output;

import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventSet;
import at.sv.panchang.event.TimedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * The ordered events as a JSON array.
 */
public final class JsonEventWriter implements CalendarWriter {

    private final ObjectMapper mapper;

    public JsonEventWriter() {
        this(new ObjectMapper());
    }

    public JsonEventWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String write(EventSet events) {
        ArrayNode array = toJson(events);
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + events.size() + " events", e);
        }
    }

    ArrayNode toJson(EventSet events) {
        ArrayNode array = mapper.createArrayNode();
        for (Event event : events) {
            ObjectNode node = array.addObject();
            node.put("uid", StableUid.of(event));
            node.put("summary", event.summary());
            node.put("description", event.description());
            node.put("category", event.category().name().toLowerCase(Locale.ENGLISH));
            node.put("rule", event.ruleKey());
            node.put("allDay", event.isAllDay());
            if (event instanceof TimedEvent timed) {
                node.put("start", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(timed.start()));
                node.put("end", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(timed.end()));
            } else {
                node.put("date", event.date().toString());
            }
        }
        return array;
    }
}
