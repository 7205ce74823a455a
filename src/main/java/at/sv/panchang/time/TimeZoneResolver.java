package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;

import java.time.ZoneId;

public interface TimeZoneResolver {

    /**
     * @return the IANA zone of the coordinate, or UTC if it can not be resolved
     */
    ZoneId zoneFor(GeoCoordinate coordinate);
}
