package at.sv.panchang.output;

import at.sv.panchang.event.Event;
import at.sv.panchang.event.TimedEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic event UIDs, so that calendar clients update instead of duplicating events on re-import.
 */
public final class StableUid {

    public static final String DOMAIN = "@panchang-calendar";

    private StableUid() {
    }

    public static String of(Event event) {
        return md5Hex(seed(event)) + DOMAIN;
    }

    static String seed(Event event) {
        if (event instanceof TimedEvent timed) {
            return timed.summary() + "|" + timed.start().toInstant() + "|" + timed.end().toInstant();
        }
        return event.summary() + "|" + event.date() + "|ALLDAY";
    }

    static String md5Hex(String value) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not supported", e);
        }
    }
}
