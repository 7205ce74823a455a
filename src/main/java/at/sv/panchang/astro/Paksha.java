package at.sv.panchang.astro;

import java.util.Locale;

/**
 * Lunar fortnight: waxing (tithi 1-15) or waning (tithi 16-30).
 */
public enum Paksha {
    SHUKLA("Shukla"),
    KRISHNA("Krishna");

    private final String label;

    Paksha(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Paksha parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ENGLISH)) {
            case "shukla" -> SHUKLA;
            case "krishna" -> KRISHNA;
            default -> throw new IllegalArgumentException("Unknown paksha '" + value + "'");
        };
    }
}
