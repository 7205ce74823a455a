package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.Paksha;

import java.util.EnumMap;
import java.util.Map;

import static at.sv.panchang.astro.AmantaMonth.*;

/**
 * Traditional Ekadashi names. The Krishna names are listed by purnimanta month, as they are usually given.
 */
final class EkadashiNames {

    private static final Map<AmantaMonth, String> SHUKLA = new EnumMap<>(AmantaMonth.class);
    private static final Map<AmantaMonth, String> KRISHNA = new EnumMap<>(AmantaMonth.class);

    static {
        put(CHAITRA, "Kamada", "Papmochani");
        put(VAISAKHA, "Mohini", "Varuthini");
        put(JYESHTHA, "Nirjala", "Apara");
        put(ASHADHA, "Devshayani", "Yogini");
        put(SHRAVANA, "Shravana Putrada", "Kamika");
        put(BHADRAPADA, "Parivartini", "Aja");
        put(ASHWIN, "Papankusha", "Indira");
        put(KARTIKA, "Prabodhini", "Rama");
        put(MARGASHIRSHA, "Mokshada", "Utpanna");
        put(PAUSHA, "Pausha Putrada", "Saphala");
        put(MAGHA, "Jaya", "Shattila");
        put(PHALGUNA, "Amalaki", "Vijaya");
    }

    private EkadashiNames() {
    }

    private static void put(AmantaMonth month, String shukla, String krishna) {
        SHUKLA.put(month, shukla);
        KRISHNA.put(month, krishna);
    }

    /**
     * @param month the amanta month of the Ekadashi
     */
    static String nameOf(AmantaMonth month, Paksha paksha) {
        return paksha == Paksha.SHUKLA ? SHUKLA.get(month) : KRISHNA.get(month.purnimantaKrishnaName());
    }
}
