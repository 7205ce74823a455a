package at.sv.panchang.event;

import lombok.Builder;
import lombok.Getter;

/**
 * Which categories and festivals end up in an assembled {@link EventSet}.
 */
@Getter
@Builder(toBuilder = true)
public final class AssemblyOptions {

    @Builder.Default
    private final boolean includeEkadashi = true;
    @Builder.Default
    private final boolean includeSankashti = true;
    @Builder.Default
    private final boolean includeAmavasyaPurnima = true;
    @Builder.Default
    private final boolean includeFestivals = true;
    @Builder.Default
    private final boolean includeRahuKaal = true;
    @Builder.Default
    private final FestivalSelection festivals = FestivalSelection.all();

    public static AssemblyOptions defaults() {
        return builder().build();
    }

    public boolean includes(EventCategory category) {
        return switch (category) {
            case EKADASHI -> includeEkadashi;
            case SANKASHTI -> includeSankashti;
            case AMAVASYA_PURNIMA -> includeAmavasyaPurnima;
            case FESTIVAL -> includeFestivals;
            case RAHU_KAAL -> includeRahuKaal;
        };
    }

    public boolean includes(Event event) {
        if (!includes(event.category())) {
            return false;
        }
        return event.category() != EventCategory.FESTIVAL || festivals.includes(event.ruleKey());
    }
}
