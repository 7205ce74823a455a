package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Festival dates for Mumbai in 2025.
 */
class FestivalRulesTest {

    private static RuleContext context;

    private static List<Event> evaluate(String key) {
        return ObservanceCatalog.byKey(key).orElseThrow().evaluate(context);
    }

    private static void assertSingle(String key, String summary, LocalDate date) {
        List<Event> events = evaluate(key);

        assertThat(events).as(key).hasSize(1);
        assertThat(events.get(0).summary()).isEqualTo(summary);
        assertThat(events.get(0).date()).as(key).isEqualTo(date);
        assertThat(events.get(0).category()).isEqualTo(EventCategory.FESTIVAL);
        assertThat(events.get(0).ruleKey()).isEqualTo(key);
    }

    @BeforeAll
    static void setUp() {
        context = RuleContexts.mumbai(2025);
    }

    @Test
    void makaraSankranti() {
        // ingress on the afternoon of Jan 13, before sunset
        assertSingle("makara_sankranti", "Makara Sankranti", LocalDate.of(2025, 1, 13));
    }

    @Test
    void gudiPadwa_withinSeason() {
        assertSingle("gudi_padwa", "Gudi Padwa (Maharashtra New Year)", LocalDate.of(2025, 3, 30));
    }

    @Test
    void ganeshChaturthi_andHartalikaTeejTheDayBefore() {
        assertSingle("ganesh_chaturthi", "Ganesh Chaturthi / Vinayaka Chaturthi", LocalDate.of(2025, 8, 27));
        assertSingle("hartalika_teej", "Hartalika Teej", LocalDate.of(2025, 8, 26));
    }

    @Test
    void hariyaliTeej_inMonthBeforeGanesh() {
        assertSingle("hariyali_teej", "Hariyali Teej", LocalDate.of(2025, 7, 27));
    }

    @Test
    void navaratri() {
        List<Event> events = evaluate("navaratri");

        assertThat(events).extracting(Event::summary)
                          .containsExactly("Shardiya Navaratri begins", "Durga Ashtami", "Maha Navami", "Vijayadashami / Dussehra");
        assertThat(events.get(0).date()).isEqualTo(LocalDate.of(2025, 9, 22));
        assertThat(events.get(3).date()).isEqualTo(LocalDate.of(2025, 10, 2));
    }

    @Test
    void pitruPaksha_bothEnds() {
        List<Event> events = evaluate("pitru_paksha");

        assertThat(events).extracting(Event::summary)
                          .containsExactly("Pitru Paksha begins", "Sarva Pitru Amavasya (Pitru Paksha ends)");
        assertThat(events).extracting(Event::date).containsExactly(LocalDate.of(2025, 9, 8), LocalDate.of(2025, 9, 21));
    }

    @Test
    void karwaChauth() {
        assertSingle("karwa_chauth", "Karwa Chauth", LocalDate.of(2025, 10, 10));
    }

    @Test
    void diwali_withGovardhanPujaAndBhaiDooj() {
        List<Event> events = evaluate("diwali");

        assertThat(events).extracting(Event::summary)
                          .containsExactly("Diwali / Deepavali", "Govardhan Puja / Annakut", "Bhai Dooj");
        assertThat(events).extracting(Event::date)
                          .containsExactly(LocalDate.of(2025, 10, 20), LocalDate.of(2025, 10, 21), LocalDate.of(2025, 10, 22));
    }

    @Test
    void ramNavami_madhyahna() {
        assertSingle("ram_navami", "Ram Navami", LocalDate.of(2025, 4, 6));
    }

    @Test
    void hanumanJayanti_akshayaTritiya() {
        assertSingle("hanuman_jayanti", "Hanuman Jayanti", LocalDate.of(2025, 4, 12));
        assertSingle("akshaya_tritiya", "Akshaya Tritiya", LocalDate.of(2025, 4, 30));
    }

    @Test
    void mahashivratri_inPhalgunaInterval() {
        List<Event> events = evaluate("mahashivratri");

        assertThat(events).hasSize(1);
        Event mahashivratri = events.get(0);
        assertThat(mahashivratri.date()).isBetween(LocalDate.of(2025, 3, 27), LocalDate.of(2025, 3, 28));
        assertThat(context.monthOf(mahashivratri.date())).contains(AmantaMonth.PHALGUNA);
        assertThat(mahashivratri.description()).startsWith("Krishna Chaturdashi at night (Phalguna)");
    }

    @Test
    void holi_dahanAndDhulandi() {
        List<Event> events = evaluate("holi");

        assertThat(events).extracting(Event::summary).containsExactly("Holika Dahan", "Holi (Dhulandi)");
        assertThat(events).extracting(Event::date).containsExactly(LocalDate.of(2025, 3, 13), LocalDate.of(2025, 3, 14));
    }

    @Test
    void rakshaBandhan_nagPanchami() {
        assertSingle("raksha_bandhan", "Raksha Bandhan", LocalDate.of(2025, 8, 9));
        assertSingle("nag_panchami", "Nag Panchami", LocalDate.of(2025, 7, 29));
    }

    @Test
    void janmashtami_midAugust() {
        List<Event> events = evaluate("janmashtami");

        assertThat(events).hasSize(1);
        assertThat(events.get(0).date()).isBetween(LocalDate.of(2025, 8, 14), LocalDate.of(2025, 8, 16));
    }

    @Test
    void guruNanakJayanti() {
        assertSingle("guru_nanak", "Guru Nanak Jayanti", LocalDate.of(2025, 11, 5));
    }

    @Test
    void catalog_festivalKeys() {
        assertThat(ObservanceCatalog.festivalKeys()).hasSize(18)
                                                    .contains("diwali", "gudi_padwa", "makara_sankranti", "hanuman_jayanti");
        assertThat(ObservanceCatalog.all()).extracting(ObservanceRule::key).doesNotHaveDuplicates().hasSize(22);
        assertThat(ObservanceCatalog.byKey("christmas")).isEmpty();
    }
}
