package at.sv.panchang.rules;

import java.util.Locale;

/**
 * Rule set for fasting days. Vaishnava observance avoids an Ekadashi touched by Dashami.
 */
public enum Tradition {
    SMARTHA,
    VAISHNAVA;

    public static Tradition parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ENGLISH)) {
            case "smartha", "smarta" -> SMARTHA;
            case "vaishnava" -> VAISHNAVA;
            default -> throw new IllegalArgumentException("Unknown tradition '" + value + "'. Supported values: smartha, vaishnava");
        };
    }

    public String getLabel() {
        return this == SMARTHA ? "Smartha" : "Vaishnava";
    }
}
