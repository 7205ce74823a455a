package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.Paksha;
import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.EventCategory;

import java.time.MonthDay;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * All observance rules in evaluation order: the recurring observances first, then the festivals.
 */
public final class ObservanceCatalog {

    private static final List<DayProbe> NIGHT = List.of(Probes.MIDNIGHT, Probes.HOURLY);

    public static final ObservanceRule GUDI_PADWA = LunarDateRule.builder()
            .key("gudi_padwa")
            .summary("Gudi Padwa (Maharashtra New Year)")
            .description("Chaitra Shukla Pratipada")
            .months(IntervalSelector.amanta(AmantaMonth.CHAITRA))
            .tithi(TithiCalculator.tithiAbs(Paksha.SHUKLA, 1))
            .seasonFrom(MonthDay.of(3, 15))
            .seasonTo(MonthDay.of(4, 20))
            .build();
    public static final ObservanceRule GANESH_CHATURTHI = LunarDateRule.builder()
            .key("ganesh_chaturthi")
            .summary("Ganesh Chaturthi / Vinayaka Chaturthi")
            .description("Bhadrapada Shukla Chaturthi")
            .months(IntervalSelector.amanta(AmantaMonth.BHADRAPADA))
            .tithi(TithiCalculator.tithiAbs(Paksha.SHUKLA, 4))
            .build();

    private static final List<ObservanceRule> RULES = List.of(
            new EkadashiRule(),
            new SankashtiRule(),
            new AmavasyaPurnimaRule(),
            new RahuKaalRule(),
            new MakaraSankrantiRule(),
            GUDI_PADWA,
            GANESH_CHATURTHI,
            new TeejRules.Hartalika(GANESH_CHATURTHI),
            new TeejRules.Hariyali(GANESH_CHATURTHI),
            LunarDateRule.builder()
                         .key("nag_panchami")
                         .summary("Nag Panchami")
                         .description("Shravana Shukla Panchami")
                         .months(IntervalSelector.amanta(AmantaMonth.SHRAVANA))
                         .tithi(TithiCalculator.tithiAbs(Paksha.SHUKLA, 5))
                         .build(),
            new NavaratriRule(),
            new PitruPakshaRule(),
            new KarwaChauthRule(),
            new DiwaliRule(),
            new RamNavamiRule(),
            LunarDateRule.builder()
                         .key("akshaya_tritiya")
                         .summary("Akshaya Tritiya")
                         .description("Vaisakha Shukla Tritiya")
                         .months(IntervalSelector.amanta(AmantaMonth.VAISAKHA))
                         .tithi(TithiCalculator.tithiAbs(Paksha.SHUKLA, 3))
                         .build(),
            LunarDateRule.builder()
                         .key("guru_nanak")
                         .summary("Guru Nanak Jayanti")
                         .description("Kartika Purnima")
                         .months(IntervalSelector.amanta(AmantaMonth.KARTIKA))
                         .tithi(TithiCalculator.PURNIMA)
                         .build(),
            LunarDateRule.builder()
                         .key("mahashivratri")
                         .summary("Mahashivratri")
                         .description("Krishna Chaturdashi at night")
                         .months(IntervalSelector.amanta(AmantaMonth.PHALGUNA))
                         .tithi(TithiCalculator.tithiAbs(Paksha.KRISHNA, 14))
                         .probes(NIGHT)
                         .build(),
            new HoliRule(),
            LunarDateRule.builder()
                         .key("raksha_bandhan")
                         .summary("Raksha Bandhan")
                         .description("Shravana Purnima")
                         .months(IntervalSelector.amanta(AmantaMonth.SHRAVANA))
                         .tithi(TithiCalculator.PURNIMA)
                         .build(),
            LunarDateRule.builder()
                         .key("janmashtami")
                         .summary("Krishna Janmashtami")
                         .description("Krishna Ashtami at midnight, Bhadrapada (purnimanta)")
                         .months(IntervalSelector.purnimantaKrishna(AmantaMonth.BHADRAPADA))
                         .tithi(TithiCalculator.tithiAbs(Paksha.KRISHNA, 8))
                         .probes(NIGHT)
                         .build(),
            LunarDateRule.builder()
                         .key("hanuman_jayanti")
                         .summary("Hanuman Jayanti")
                         .description("Chaitra Purnima")
                         .months(IntervalSelector.amanta(AmantaMonth.CHAITRA))
                         .tithi(TithiCalculator.PURNIMA)
                         .build());

    private ObservanceCatalog() {
    }

    public static List<ObservanceRule> all() {
        return RULES;
    }

    public static List<ObservanceRule> festivals() {
        return RULES.stream().filter(rule -> rule.category() == EventCategory.FESTIVAL).toList();
    }

    public static Set<String> festivalKeys() {
        Set<String> keys = new LinkedHashSet<>();
        festivals().forEach(rule -> keys.add(rule.key()));
        return keys;
    }

    public static Optional<ObservanceRule> byKey(String key) {
        return RULES.stream().filter(rule -> rule.key().equals(key)).findFirst();
    }
}
