package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;
import org.shredzone.commons.suncalc.MoonTimes;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class RiseSetProviderImpl implements RiseSetProvider {

    private final Map<String, SunTimes> sunCache;
    private final Map<String, MoonTimes> moonCache;

    public RiseSetProviderImpl() {
        sunCache = new ConcurrentHashMap<>();
        moonCache = new ConcurrentHashMap<>();
    }

    @Override
    public Daylight sunTimes(GeoCoordinate coordinate, LocalDate date, ZoneId zone) {
        SunTimes times = sunCache.computeIfAbsent(generateKey(coordinate, date, zone),
                k -> SunTimes.compute()
                             .at(coordinate.latitude(), coordinate.longitude())
                             .on(date.atStartOfDay(zone))
                             .oneDay()
                             .execute());
        ZonedDateTime rise = times.getRise();
        ZonedDateTime set = times.getSet();
        if (rise == null || set == null) {
            throw new RiseSetUndefined("No " + (rise == null ? "sunrise" : "sunset") + " on " + date + " at " + coordinate +
                                       (times.isAlwaysUp() ? " (sun always up)" : times.isAlwaysDown() ? " (sun always down)" : ""));
        }
        return new Daylight(rise, set);
    }

    @Override
    public Optional<ZonedDateTime> moonrise(GeoCoordinate coordinate, LocalDate date, ZoneId zone) {
        MoonTimes times = moonCache.computeIfAbsent(generateKey(coordinate, date, zone),
                k -> MoonTimes.compute()
                              .at(coordinate.latitude(), coordinate.longitude())
                              .on(date.atStartOfDay(zone))
                              .oneDay()
                              .execute());
        return Optional.ofNullable(times.getRise());
    }

    private String generateKey(GeoCoordinate coordinate, LocalDate date, ZoneId zone) {
        return coordinate.latitude() + "," + coordinate.longitude() + "-" + date + "-" + zone.getId();
    }

    @Override
    public void clearCache() {
        sunCache.clear();
        moonCache.clear();
    }
}
