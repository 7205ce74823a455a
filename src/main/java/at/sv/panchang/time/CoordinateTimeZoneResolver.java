package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;
import lombok.extern.slf4j.Slf4j;
import net.iakovlev.timeshape.TimeZoneEngine;

import java.time.ZoneId;
import java.util.Optional;

/**
 * Looks the IANA zone up from the coordinate with an offline zone boundary index. Coordinates outside every zone
 * are passed on to the fallback resolver.
 */
@Slf4j
public final class CoordinateTimeZoneResolver implements TimeZoneResolver {

    @FunctionalInterface
    interface ZoneLookup {
        Optional<ZoneId> query(double latitude, double longitude);
    }

    private final ZoneLookup lookup;
    private final TimeZoneResolver fallback;

    public CoordinateTimeZoneResolver(TimeZoneResolver fallback) {
        this((latitude, longitude) -> EngineHolder.ENGINE.query(latitude, longitude), fallback);
    }

    CoordinateTimeZoneResolver(ZoneLookup lookup, TimeZoneResolver fallback) {
        this.lookup = lookup;
        this.fallback = fallback;
    }

    @Override
    public ZoneId zoneFor(GeoCoordinate coordinate) {
        Optional<ZoneId> zone = lookup.query(coordinate.latitude(), coordinate.longitude());
        if (zone.isPresent()) {
            log.debug("Resolved {} to {}", coordinate, zone.get());
            return zone.get();
        }
        log.info("No time zone found at {}", coordinate);
        return fallback.zoneFor(coordinate);
    }

    private static final class EngineHolder {
        // loading the boundary index takes a few seconds
        private static final TimeZoneEngine ENGINE = TimeZoneEngine.initialize();
    }
}
