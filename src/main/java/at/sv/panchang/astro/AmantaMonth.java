package at.sv.panchang.astro;

/**
 * Lunar months in amanta order; a month runs from new moon to new moon.
 */
public enum AmantaMonth {
    CHAITRA("Chaitra"),
    VAISAKHA("Vaisakha"),
    JYESHTHA("Jyeshtha"),
    ASHADHA("Ashadha"),
    SHRAVANA("Shravana"),
    BHADRAPADA("Bhadrapada"),
    ASHWIN("Ashwin"),
    KARTIKA("Kartika"),
    MARGASHIRSHA("Margashirsha"),
    PAUSHA("Pausha"),
    MAGHA("Magha"),
    PHALGUNA("Phalguna");

    private final String label;

    AmantaMonth(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Month name from the sidereal solar longitude at the new moon that starts the month. The Sun is in Meena
     * (Pisces) when Chaitra begins.
     */
    public static AmantaMonth fromSiderealLongitude(double siderealLongitude) {
        int index = (int) Math.floor(Angles.normalize(siderealLongitude + 30.0) / 30.0);
        return values()[index % 12];
    }

    /**
     * The purnimanta scheme names a Krishna fortnight after the following amanta month.
     */
    public AmantaMonth purnimantaKrishnaName() {
        return values()[(ordinal() + 1) % 12];
    }

    @Override
    public String toString() {
        return label;
    }
}
