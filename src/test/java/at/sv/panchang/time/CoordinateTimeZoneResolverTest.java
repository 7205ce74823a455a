package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CoordinateTimeZoneResolverTest {

    private static final GeoCoordinate MUMBAI = GeoCoordinate.of(19.076, 72.8777);
    private static final GeoCoordinate NEW_YORK = GeoCoordinate.of(40.7128, -74.006);

    @Test
    void zoneFor_lookupHit_ignoresConfiguredZone() {
        CoordinateTimeZoneResolver resolver = new CoordinateTimeZoneResolver(
                (latitude, longitude) -> Optional.of(ZoneId.of("Asia/Kolkata")),
                new ConfiguredTimeZoneResolver("Europe/Vienna"));

        assertThat(resolver.zoneFor(MUMBAI)).isEqualTo(ZoneId.of("Asia/Kolkata"));
    }

    @Test
    void zoneFor_lookupMiss_usesConfiguredZone() {
        CoordinateTimeZoneResolver resolver = new CoordinateTimeZoneResolver(
                (latitude, longitude) -> Optional.empty(), new ConfiguredTimeZoneResolver("Europe/Vienna"));

        assertThat(resolver.zoneFor(MUMBAI)).isEqualTo(ZoneId.of("Europe/Vienna"));
    }

    @Test
    void zoneFor_lookupMissWithoutConfiguredZone_utc() {
        CoordinateTimeZoneResolver resolver = new CoordinateTimeZoneResolver(
                (latitude, longitude) -> Optional.empty(), new ConfiguredTimeZoneResolver(null));

        assertThat(resolver.zoneFor(MUMBAI)).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void zoneFor_boundaryIndex_resolvesCities() {
        CoordinateTimeZoneResolver resolver = new CoordinateTimeZoneResolver(new ConfiguredTimeZoneResolver(null));

        assertThat(resolver.zoneFor(MUMBAI)).isEqualTo(ZoneId.of("Asia/Kolkata"));
        assertThat(resolver.zoneFor(NEW_YORK)).isEqualTo(ZoneId.of("America/New_York"));
    }
}
