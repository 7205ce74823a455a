package at.sv.panchang.output;

import java.util.Locale;

public enum OutputFormat {
    ICS("ics"),
    JSON("json");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static OutputFormat parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ENGLISH)) {
            case "ics", "ical" -> ICS;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unknown format '" + value + "'. Supported values: ics, json");
        };
    }
}
