package at.sv.panchang.event;

/**
 * Event categories in assembly order: all-day categories first, timed Rahu Kaal last.
 */
public enum EventCategory {
    EKADASHI("Ekadashi", true),
    SANKASHTI("Sankashti", true),
    AMAVASYA_PURNIMA("Amavasya/Purnima", true),
    FESTIVAL("Festival", true),
    RAHU_KAAL("Rahu Kaal", false);

    private final String label;
    private final boolean allDay;

    EventCategory(String label, boolean allDay) {
        this.label = label;
        this.allDay = allDay;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAllDay() {
        return allDay;
    }
}
