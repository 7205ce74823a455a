package at.sv.panchang.astro;

import java.time.ZonedDateTime;

/**
 * Tithi, paksha and sidereal solar longitude on top of a {@link PositionProvider}.
 */
public final class TithiCalculator {

    public static final int TITHI_COUNT = 30;
    public static final double TITHI_WIDTH_DEGREES = 12.0;
    public static final int PURNIMA = 15;
    public static final int AMAVASYA = 30;

    private final PositionProvider positionProvider;

    public TithiCalculator(PositionProvider positionProvider) {
        this.positionProvider = positionProvider;
    }

    public PositionProvider getPositionProvider() {
        return positionProvider;
    }

    /**
     * @return the tithi in [1, 30] prevailing at the given instant
     */
    public int tithiAt(ZonedDateTime instant) {
        return tithiForElongation(positionProvider.positionAt(instant).elongation());
    }

    static int tithiForElongation(double elongation) {
        int tithi = (int) Math.floor(Angles.normalize(elongation) / TITHI_WIDTH_DEGREES) + 1;
        return Math.min(tithi, TITHI_COUNT);
    }

    public static Paksha pakshaFor(int tithi) {
        assertTithi(tithi);
        return tithi <= PURNIMA ? Paksha.SHUKLA : Paksha.KRISHNA;
    }

    /**
     * @return the position of the tithi within its paksha, in [1, 15]
     */
    public static int ordinalFor(int tithi) {
        assertTithi(tithi);
        return tithi <= PURNIMA ? tithi : tithi - PURNIMA;
    }

    /**
     * Converts (paksha, ordinal) into the absolute tithi. Example: Krishna Chaturthi (4) is tithi 19.
     */
    public static int tithiAbs(Paksha paksha, int ordinal) {
        if (ordinal < 1 || ordinal > PURNIMA) {
            throw new IllegalArgumentException("Invalid tithi ordinal " + ordinal + ". Expected a value in [1..15].");
        }
        return paksha == Paksha.SHUKLA ? ordinal : PURNIMA + ordinal;
    }

    public double siderealSolarLongitude(ZonedDateTime instant) {
        double sunLon = positionProvider.positionAt(instant).sunLon();
        return Angles.normalize(sunLon - LahiriAyanamsha.degreesAt(instant));
    }

    /**
     * @return the sidereal zodiac sign of the Sun, 0 = Mesha (Aries) .. 11 = Meena (Pisces)
     */
    public int rashiAt(ZonedDateTime instant) {
        return (int) Math.floor(siderealSolarLongitude(instant) / 30.0) % 12;
    }

    private static void assertTithi(int tithi) {
        if (tithi < 1 || tithi > TITHI_COUNT) {
            throw new IllegalArgumentException("Invalid tithi " + tithi + ". Expected a value in [1..30].");
        }
    }
}
