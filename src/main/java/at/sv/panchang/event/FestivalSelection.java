package at.sv.panchang.event;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * The festivals to include: either all of them, or an explicit set of keys.
 */
public final class FestivalSelection {

    private static final FestivalSelection ALL = new FestivalSelection(null);

    private final Set<String> keys;

    private FestivalSelection(Set<String> keys) {
        this.keys = keys;
    }

    public static FestivalSelection all() {
        return ALL;
    }

    /**
     * @param value     {@code all}, or a comma separated list of festival keys
     * @param knownKeys the keys that may be selected
     * @throws InvalidFestivalKey if the value contains an unknown key
     */
    public static FestivalSelection parse(String value, Collection<String> knownKeys) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
            return ALL;
        }
        Set<String> selected = new LinkedHashSet<>();
        for (String part : value.split(",")) {
            String key = part.trim().toLowerCase(Locale.ENGLISH);
            if (key.isEmpty()) {
                continue;
            }
            if (!knownKeys.contains(key)) {
                throw new InvalidFestivalKey("Unknown festival '" + part.trim() + "'. Supported values: all, " +
                                             String.join(", ", knownKeys));
            }
            selected.add(key);
        }
        return new FestivalSelection(Collections.unmodifiableSet(selected));
    }

    public boolean isAll() {
        return keys == null;
    }

    public boolean includes(String key) {
        return keys == null || keys.contains(key);
    }

    @Override
    public String toString() {
        return isAll() ? "all" : String.join(",", keys);
    }
}
