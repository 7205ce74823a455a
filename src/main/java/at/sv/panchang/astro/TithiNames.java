package at.sv.panchang.astro;

public final class TithiNames {

    private static final String[] ORDINAL_NAMES = {
            "Pratipada", "Dwitiya", "Tritiya", "Chaturthi", "Panchami", "Shashthi", "Saptami", "Ashtami",
            "Navami", "Dashami", "Ekadashi", "Dwadashi", "Trayodashi", "Chaturdashi"
    };

    private TithiNames() {
    }

    /**
     * @return e.g. "Krishna Chaturthi", "Purnima" or "Amavasya"
     */
    public static String nameOf(int tithi) {
        if (tithi == TithiCalculator.PURNIMA) {
            return "Purnima";
        }
        if (tithi == TithiCalculator.AMAVASYA) {
            return "Amavasya";
        }
        return TithiCalculator.pakshaFor(tithi).getLabel() + " " + ORDINAL_NAMES[TithiCalculator.ordinalFor(tithi) - 1];
    }
}
