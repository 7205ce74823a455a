package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.Paksha;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EkadashiRuleTest {

    private final EkadashiRule rule = new EkadashiRule();

    private static List<LocalDate> dates(List<Event> events) {
        return events.stream().map(Event::date).toList();
    }

    private static Event on(List<Event> events, LocalDate date) {
        return events.stream().filter(event -> event.date().equals(date)).findFirst().orElseThrow();
    }

    @Test
    void evaluate_tithiAtSunrise_bothPakshas() {
        // elongation grows 12 degrees a day: tithi 11 at sunrise on Jan 11, tithi 26 on Jan 26
        List<Event> events = rule.evaluate(RuleContexts.synthetic(12.0, 0.2, Tradition.SMARTHA));

        assertThat(dates(events)).contains(LocalDate.of(2025, 1, 11), LocalDate.of(2025, 1, 26))
                                 .doesNotContain(LocalDate.of(2025, 1, 10), LocalDate.of(2025, 1, 12));
        Event shukla = on(events, LocalDate.of(2025, 1, 11));
        assertThat(shukla.summary()).isEqualTo("Ekadashi (Shukla)");
        assertThat(shukla.description()).isEqualTo("Smartha: Shukla Ekadashi, tithi 11 at sunrise (Z).");
        Event krishna = on(events, LocalDate.of(2025, 1, 26));
        assertThat(krishna.summary()).isEqualTo("Ekadashi (Krishna)");
        assertThat(krishna.description()).contains("tithi 26 at sunrise");
    }

    @Test
    void evaluate_ekadashiAtTwoSunrises_bothDays() {
        // tithi 11 at sunrise on Jan 13 and Jan 14
        List<Event> smartha = rule.evaluate(RuleContexts.synthetic(10.0, 0.5, Tradition.SMARTHA));
        List<Event> vaishnava = rule.evaluate(RuleContexts.synthetic(10.0, 0.5, Tradition.VAISHNAVA));

        assertThat(dates(smartha)).contains(LocalDate.of(2025, 1, 13), LocalDate.of(2025, 1, 14));
        assertThat(dates(vaishnava)).contains(LocalDate.of(2025, 1, 13), LocalDate.of(2025, 1, 14));
        assertThat(on(vaishnava, LocalDate.of(2025, 1, 14)).description())
                .isEqualTo("Vaishnava: Shukla Ekadashi, tithi 11 at sunrise (Z).");
    }

    @Test
    void evaluate_vaishnava_keepsDayWithEkadashiAtSunrise() {
        List<Event> smartha = rule.evaluate(RuleContexts.synthetic(12.0, 0.2, Tradition.SMARTHA));
        List<Event> vaishnava = rule.evaluate(RuleContexts.synthetic(12.0, 0.2, Tradition.VAISHNAVA));

        assertThat(dates(vaishnava)).isEqualTo(dates(smartha))
                                    .contains(LocalDate.of(2025, 1, 11))
                                    .doesNotContain(LocalDate.of(2025, 1, 12));
        Event jan11 = on(vaishnava, LocalDate.of(2025, 1, 11));
        assertThat(jan11.summary()).isEqualTo("Ekadashi (Shukla, Vaishnava)");
        assertThat(jan11.description()).contains("moved from 2025-01-10 with tithi 10 at sunrise");
    }

    @Test
    void evaluate_ekadashiBetweenTwoSunrises_noEvent() {
        // Dashami at sunrise on Jan 10, Dwadashi at sunrise on Jan 11
        List<Event> smartha = rule.evaluate(RuleContexts.synthetic(13.0, 2.5, Tradition.SMARTHA));
        List<Event> vaishnava = rule.evaluate(RuleContexts.synthetic(13.0, 2.5, Tradition.VAISHNAVA));

        assertThat(dates(smartha)).doesNotContain(LocalDate.of(2025, 1, 10), LocalDate.of(2025, 1, 11));
        assertThat(dates(vaishnava)).doesNotContain(LocalDate.of(2025, 1, 10), LocalDate.of(2025, 1, 11));
    }

    @Test
    void evaluate_noSunrise_daySkipped() {
        FixedRiseSetProvider riseSet = new FixedRiseSetProvider(LocalTime.of(6, 0), LocalTime.of(18, 0), LocalTime.of(20, 0))
                .undefinedOn(LocalDate.of(2025, 1, 11));

        List<Event> events = rule.evaluate(RuleContexts.synthetic(12.0, 0.2, Tradition.VAISHNAVA, riseSet));

        assertThat(dates(events)).doesNotContain(LocalDate.of(2025, 1, 11), LocalDate.of(2025, 1, 12))
                                 .contains(LocalDate.of(2025, 1, 26));
    }

    @Test
    void mumbai2025_namesByMonthAndPaksha() {
        List<Event> events = rule.evaluate(RuleContexts.mumbai(2025));

        assertThat(events).hasSizeBetween(22, 28);
        assertThat(events).allMatch(event -> event.category() == EventCategory.EKADASHI)
                          .allMatch(event -> event.date().getYear() == 2025);
        Event kamada = on(events, LocalDate.of(2025, 4, 8));
        assertThat(kamada.summary()).isEqualTo("Kamada Ekadashi (Shukla)");
        assertThat(kamada.description()).isEqualTo("Smartha: Shukla Ekadashi of Chaitra, tithi 11 at sunrise (Asia/Kolkata).");
        assertThat(dates(events)).doesNotHaveDuplicates();
    }

    @Test
    void mumbai2025_vaishnavaOnSameDays() {
        List<LocalDate> smartha = dates(rule.evaluate(RuleContexts.mumbai(2025)));
        List<LocalDate> vaishnava = dates(rule.evaluate(RuleContexts.mumbai(2025, Tradition.VAISHNAVA)));

        assertThat(vaishnava).isEqualTo(smartha);
    }

    @Test
    void names_krishnaByPurnimantaMonth() {
        assertThat(EkadashiNames.nameOf(AmantaMonth.PHALGUNA, Paksha.KRISHNA))
                .isEqualTo("Papmochani");
        assertThat(EkadashiNames.nameOf(AmantaMonth.CHAITRA, Paksha.SHUKLA))
                .isEqualTo("Kamada");
    }
}
