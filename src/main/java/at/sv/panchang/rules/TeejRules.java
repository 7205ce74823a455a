package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.astro.Paksha;
import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The two Teej festivals on Shukla Tritiya, both located relative to Ganesh Chaturthi.
 */
final class TeejRules {

    static final int TRITIYA = TithiCalculator.tithiAbs(Paksha.SHUKLA, 3);

    private TeejRules() {
    }

    static Optional<LocalDate> ganeshDate(RuleContext context, ObservanceRule ganeshChaturthi) {
        return ganeshChaturthi.evaluate(context).stream().map(Event::date).findFirst();
    }

    static Optional<LocalDate> tritiyaIn(RuleContext context, DateWindow window) {
        return DayScanner.firstMatch(context, window, InstantCondition.tithi(context, TRITIYA), Probes.SUNRISE, Probes.HOURLY)
                         .map(DayResult::date);
    }

    static Optional<LocalDate> tritiyaIn(RuleContext context, AmantaMonth month) {
        for (LunationInterval interval : context.nijaIntervals(month)) {
            Optional<LocalDate> date = tritiyaIn(context, DateWindow.of(interval, context.getZone()));
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    static List<Event> festival(RuleContext context, String key, String summary, String description,
                                Optional<LocalDate> date) {
        return date.filter(context::isInYear)
                   .map(d -> List.<Event>of(AllDayEvent.festival(key, summary, d, description + " (" + context.zoneId() + ").")))
                   .orElse(List.of());
    }

    /**
     * Bhadrapada Shukla Tritiya, the day before Ganesh Chaturthi.
     */
    @RequiredArgsConstructor(access = AccessLevel.PACKAGE)
    static final class Hartalika implements ObservanceRule {

        static final String KEY = "hartalika_teej";
        private final ObservanceRule ganeshChaturthi;

        @Override
        public String key() {
            return KEY;
        }

        @Override
        public EventCategory category() {
            return EventCategory.FESTIVAL;
        }

        @Override
        public List<Event> evaluate(RuleContext context) {
            Optional<LocalDate> date = ganeshDate(context, ganeshChaturthi)
                    .map(ganesh -> ganesh.minusDays(1))
                    .filter(eve -> tritiyaIn(context, DateWindow.days(eve, 1)).isPresent())
                    .or(() -> tritiyaIn(context, AmantaMonth.BHADRAPADA));
            return festival(context, KEY, "Hartalika Teej", "Bhadrapada Shukla Tritiya", date);
        }
    }

    /**
     * Shravana Shukla Tritiya, in the lunar month before the one of Ganesh Chaturthi.
     */
    @RequiredArgsConstructor(access = AccessLevel.PACKAGE)
    static final class Hariyali implements ObservanceRule {

        static final String KEY = "hariyali_teej";
        private final ObservanceRule ganeshChaturthi;

        @Override
        public String key() {
            return KEY;
        }

        @Override
        public EventCategory category() {
            return EventCategory.FESTIVAL;
        }

        @Override
        public List<Event> evaluate(RuleContext context) {
            Optional<LocalDate> date = ganeshDate(context, ganeshChaturthi)
                    .flatMap(context::intervalContaining)
                    .flatMap(context::intervalBefore)
                    .flatMap(shravana -> tritiyaIn(context, DateWindow.of(shravana, context.getZone())))
                    .or(() -> tritiyaIn(context, AmantaMonth.SHRAVANA));
            return festival(context, KEY, "Hariyali Teej", "Shravana Shukla Tritiya", date);
        }
    }
}
