package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Resolves to an explicitly configured zone id. Without one, or with an unknown id, UTC is used.
 */
@Slf4j
@RequiredArgsConstructor
public final class ConfiguredTimeZoneResolver implements TimeZoneResolver {

    private final String zoneId;

    @Override
    public ZoneId zoneFor(GeoCoordinate coordinate) {
        if (zoneId == null || zoneId.isBlank()) {
            log.warn("No time zone configured for {}. Falling back to UTC.", coordinate);
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            log.warn("Unknown time zone '{}' for {}: {}. Falling back to UTC.", zoneId, coordinate, e.getMessage());
            return ZoneOffset.UTC;
        }
    }
}
