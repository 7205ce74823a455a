package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

public interface RiseSetProvider {

    /**
     * @return sunrise and sunset of the given local date
     * @throws RiseSetUndefined if the sun does not rise or does not set on that date
     */
    Daylight sunTimes(GeoCoordinate coordinate, LocalDate date, ZoneId zone);

    /**
     * @return the moonrise on the given local date, or empty if the moon does not rise that day
     */
    Optional<ZonedDateTime> moonrise(GeoCoordinate coordinate, LocalDate date, ZoneId zone);

    default ZonedDateTime sunrise(GeoCoordinate coordinate, LocalDate date, ZoneId zone) {
        return sunTimes(coordinate, date, zone).sunrise();
    }

    default void clearCache() {
    }
}
