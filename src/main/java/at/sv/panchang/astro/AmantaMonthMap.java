package at.sv.panchang.astro;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Civil date to amanta month lookup for one year. Dates not covered by any lunation interval have no month.
 */
public final class AmantaMonthMap {

    private final int year;
    private final Map<LocalDate, AmantaMonth> months;

    AmantaMonthMap(int year, Map<LocalDate, AmantaMonth> months) {
        this.year = year;
        this.months = Collections.unmodifiableMap(new TreeMap<>(months));
    }

    public int getYear() {
        return year;
    }

    public Optional<AmantaMonth> monthOf(LocalDate date) {
        return Optional.ofNullable(months.get(date));
    }

    public int size() {
        return months.size();
    }
}
