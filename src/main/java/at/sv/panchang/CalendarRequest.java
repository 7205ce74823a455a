package at.sv.panchang;

import at.sv.panchang.event.AssemblyOptions;
import at.sv.panchang.rules.Tradition;
import lombok.Builder;
import lombok.Getter;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * What to compute: a location, an inclusive range of civil years and the assembly options.
 */
@Getter
@Builder(toBuilder = true)
public final class CalendarRequest {

    private final GeoCoordinate coordinate;
    private final int fromYear;
    /**
     * Inclusive; a value before {@link #fromYear} means a single year.
     */
    private final int toYear;
    @Builder.Default
    private final ZoneId zone = ZoneOffset.UTC;
    @Builder.Default
    private final Tradition tradition = Tradition.SMARTHA;
    @Builder.Default
    private final AssemblyOptions options = AssemblyOptions.defaults();
    /**
     * Optional IANA zone label of the viewer; Rahu Kaal events are coalesced per viewer date if set.
     */
    private final String viewerZone;

    public int getLastYear() {
        return Math.max(fromYear, toYear);
    }
}
