package at.sv.panchang.rules;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

public final class Probes {

    public static final DayProbe SUNRISE = DayProbe.of("sunrise", (context, date) -> List.of(context.sunrise(date)));
    public static final DayProbe SUNSET = DayProbe.of("sunset", (context, date) -> List.of(context.daylight(date).sunset()));
    public static final DayProbe MOONRISE = DayProbe.of("moonrise", (context, date) -> context.moonrise(date).stream().toList());
    /**
     * Local midnight at the end of the date, the middle of the night belonging to it.
     */
    public static final DayProbe MIDNIGHT = DayProbe.of("midnight",
            (context, date) -> List.of(date.plusDays(1).atStartOfDay(context.getZone())));
    public static final DayProbe HOURLY = hours(0, 23);

    private Probes() {
    }

    /**
     * Every full local hour from {@code fromHour} to {@code toHour}, both inclusive.
     */
    public static DayProbe hours(int fromHour, int toHour) {
        String name = fromHour == 0 && toHour == 23 ? "hourly" : "hours " + fromHour + "-" + toHour;
        return DayProbe.of(name, (context, date) -> {
            List<ZonedDateTime> instants = new ArrayList<>();
            for (int hour = fromHour; hour <= toHour; hour++) {
                instants.add(ZonedDateTime.of(date, LocalTime.of(hour, 0), context.getZone()));
            }
            return instants;
        });
    }

    public static DayProbe localTime(LocalTime time) {
        return DayProbe.of(time.toString(), (context, date) -> List.of(ZonedDateTime.of(date, time, context.getZone())));
    }
}
