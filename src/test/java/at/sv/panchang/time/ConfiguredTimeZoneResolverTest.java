package at.sv.panchang.time;

import at.sv.panchang.GeoCoordinate;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ConfiguredTimeZoneResolverTest {

    private static final GeoCoordinate MUMBAI = GeoCoordinate.of(19.076, 72.8777);

    @Test
    void zoneFor_configuredZone() {
        assertThat(new ConfiguredTimeZoneResolver(" Asia/Kolkata ").zoneFor(MUMBAI)).isEqualTo(ZoneId.of("Asia/Kolkata"));
    }

    @Test
    void zoneFor_missingOrUnknown_utc() {
        assertThat(new ConfiguredTimeZoneResolver(null).zoneFor(MUMBAI)).isEqualTo(ZoneOffset.UTC);
        assertThat(new ConfiguredTimeZoneResolver("").zoneFor(MUMBAI)).isEqualTo(ZoneOffset.UTC);
        assertThat(new ConfiguredTimeZoneResolver("Mars/Olympus_Mons").zoneFor(MUMBAI)).isEqualTo(ZoneOffset.UTC);
    }
}
