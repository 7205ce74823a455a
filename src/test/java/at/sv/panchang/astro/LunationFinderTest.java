package at.sv.panchang.astro;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LunationFinderTest {

    private LunationFinder finder;

    private static void assertCloseTo(ZonedDateTime actual, ZonedDateTime expected) {
        assertThat(Math.abs(Duration.between(expected, actual).toMinutes()))
                .as("new moon %s expected near %s", actual, expected)
                .isLessThanOrEqualTo(30);
    }

    @BeforeEach
    void setUp() {
        finder = new LunationFinder(new EphemerisPositionProvider(EphemerisHandle.shared()));
    }

    @Test
    void findNewMoon_knownNewMoons() {
        assertCloseTo(finder.findNewMoon(ZonedDateTime.of(2025, 1, 27, 0, 0, 0, 0, ZoneOffset.UTC)).orElseThrow(),
                ZonedDateTime.of(2025, 1, 29, 12, 36, 0, 0, ZoneOffset.UTC));
        assertCloseTo(finder.findNewMoon(ZonedDateTime.of(2025, 3, 30, 0, 0, 0, 0, ZoneOffset.UTC)).orElseThrow(),
                ZonedDateTime.of(2025, 3, 29, 10, 58, 0, 0, ZoneOffset.UTC));
        assertCloseTo(finder.findNewMoon(ZonedDateTime.of(2025, 10, 20, 0, 0, 0, 0, ZoneOffset.UTC)).orElseThrow(),
                ZonedDateTime.of(2025, 10, 21, 12, 25, 0, 0, ZoneOffset.UTC));
    }

    @Test
    void findNewMoon_resultIsInUtc() {
        Optional<ZonedDateTime> newMoon = finder.findNewMoon(
                ZonedDateTime.of(2025, 1, 29, 18, 0, 0, 0, ZoneId.of("Asia/Kolkata")));

        assertThat(newMoon).isPresent();
        assertThat(newMoon.get().getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void findNewMoon_nearFullMoon_noBogusRoot() {
        // full moon 2025-02-12 13:53 UTC; a new moon is two weeks away from any window around it
        Optional<ZonedDateTime> result = finder.findNewMoon(ZonedDateTime.of(2025, 2, 12, 14, 0, 0, 0, ZoneOffset.UTC));

        result.ifPresent(newMoon -> assertThat(finder.signedElongation(newMoon)).isCloseTo(0.0,
                within(0.01)));
    }

    @Test
    void lunationsCoveringYear_spacingAndCoverage() {
        List<ZonedDateTime> newMoons = finder.lunationsCoveringYear(2025);

        assertThat(newMoons).hasSizeBetween(13, 15);
        assertThat(newMoons.get(0)).isBefore(ZonedDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        assertThat(newMoons.get(newMoons.size() - 1)).isAfter(ZonedDateTime.of(2025, 12, 31, 0, 0, 0, 0, ZoneOffset.UTC));
        for (int i = 1; i < newMoons.size(); i++) {
            double days = Duration.between(newMoons.get(i - 1), newMoons.get(i)).toMinutes() / 1440.0;
            assertThat(days).as("lunation %d", i).isBetween(29.0, 30.6);
        }
    }

    @Test
    void guesses_coverWindowWithMeanLunations() {
        ZonedDateTime start = ZonedDateTime.of(2024, 12, 10, 0, 0, 0, 0, ZoneOffset.UTC);
        ZonedDateTime end = ZonedDateTime.of(2026, 1, 20, 0, 0, 0, 0, ZoneOffset.UTC);

        List<ZonedDateTime> guesses = LunationFinder.guesses(start, end);

        assertThat(guesses).hasSizeBetween(14, 15);
        for (int i = 1; i < guesses.size(); i++) {
            assertThat(Duration.between(guesses.get(i - 1), guesses.get(i)).toHours()).isBetween(708L, 709L);
        }
    }
}
