package at.sv.panchang.output;

import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventSet;
import at.sv.panchang.event.TimedEvent;
import net.fortuna.ical4j.data.CalendarOutputter;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Date;
import net.fortuna.ical4j.model.DateTime;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.PropertyList;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.CalScale;
import net.fortuna.ical4j.model.property.Categories;
import net.fortuna.ical4j.model.property.Description;
import net.fortuna.ical4j.model.property.DtEnd;
import net.fortuna.ical4j.model.property.DtStamp;
import net.fortuna.ical4j.model.property.DtStart;
import net.fortuna.ical4j.model.property.Method;
import net.fortuna.ical4j.model.property.ProdId;
import net.fortuna.ical4j.model.property.Summary;
import net.fortuna.ical4j.model.property.Transp;
import net.fortuna.ical4j.model.property.Uid;
import net.fortuna.ical4j.model.property.Version;
import net.fortuna.ical4j.model.property.XProperty;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.text.ParseException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * RFC 5545 calendar: all-day events as DATE values with an exclusive end, timed events in UTC.
 */
public final class IcsWriter implements CalendarWriter {

    static final String PRODID = "-//panchang-calendar//Lunisolar Observances//EN";
    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Clock clock;
    private final String calendarName;
    private final ZoneId zone;

    /**
     * @param zone the location's zone, published as X-WR-TIMEZONE; may be null
     */
    public IcsWriter(Clock clock, String calendarName, ZoneId zone) {
        this.clock = clock;
        this.calendarName = calendarName;
        this.zone = zone;
    }

    @Override
    public String write(EventSet events) {
        Calendar calendar = new Calendar();
        calendar.getProperties().add(new ProdId(PRODID));
        calendar.getProperties().add(Version.VERSION_2_0);
        calendar.getProperties().add(CalScale.GREGORIAN);
        calendar.getProperties().add(Method.PUBLISH);
        calendar.getProperties().add(new XProperty("X-WR-CALNAME", calendarName));
        if (zone != null) {
            calendar.getProperties().add(new XProperty("X-WR-TIMEZONE", zone.getId()));
        }
        DateTime stamp = utc(ZonedDateTime.now(clock));
        for (Event event : events) {
            calendar.getComponents().add(createEvent(event, stamp));
        }
        StringWriter out = new StringWriter();
        try {
            new CalendarOutputter(false).output(calendar, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render calendar '" + calendarName + "'", e);
        }
        return out.toString();
    }

    private static VEvent createEvent(Event event, DateTime stamp) {
        PropertyList<Property> properties = new PropertyList<>();
        properties.add(new Uid(StableUid.of(event)));
        properties.add(new DtStamp(stamp));
        if (event instanceof TimedEvent timed) {
            DtStart start = new DtStart(utc(timed.start()));
            start.setUtc(true);
            DtEnd end = new DtEnd(utc(timed.end()));
            end.setUtc(true);
            properties.add(start);
            properties.add(end);
        } else {
            properties.add(new DtStart(date(event.date())));
            properties.add(new DtEnd(date(event.date().plusDays(1))));
            properties.add(Transp.TRANSPARENT);
        }
        properties.add(new Summary(event.summary()));
        if (event.description() != null && !event.description().isEmpty()) {
            properties.add(new Description(event.description()));
        }
        properties.add(new Categories(event.category().getLabel()));
        return new VEvent(properties);
    }

    private static DateTime utc(ZonedDateTime dateTime) {
        DateTime utc = new DateTime(dateTime.toInstant().toEpochMilli());
        utc.setUtc(true);
        return utc;
    }

    private static Date date(LocalDate date) {
        try {
            return new Date(DATE.format(date));
        } catch (ParseException e) {
            throw new IllegalStateException("Unparseable calendar date " + date, e);
        }
    }
}
