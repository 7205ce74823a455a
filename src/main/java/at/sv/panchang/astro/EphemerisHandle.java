package at.sv.panchang.astro;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Lazily loads the ephemeris tables on first use. The loaded {@link Ephemeris} is immutable and shared by all callers.
 */
public final class EphemerisHandle {

    private static final Logger LOG = LoggerFactory.getLogger(EphemerisHandle.class);
    public static final String DEFAULT_RESOURCE = "/ephemeris/moon_longitude_terms.tsv";

    private static final EphemerisHandle SHARED = new EphemerisHandle(DEFAULT_RESOURCE);

    private final String resource;
    private volatile Ephemeris ephemeris;

    public EphemerisHandle(String resource) {
        this.resource = resource;
    }

    /**
     * @return the process-wide handle backed by the bundled tables
     */
    public static EphemerisHandle shared() {
        return SHARED;
    }

    /**
     * @throws EphemerisUnavailable if the tables can not be read
     */
    public Ephemeris get() {
        if (ephemeris == null) {
            synchronized (this) {
                if (ephemeris == null) {
                    ephemeris = load();
                }
            }
        }
        return ephemeris;
    }

    public boolean isLoaded() {
        return ephemeris != null;
    }

    private Ephemeris load() {
        InputStream stream = EphemerisHandle.class.getResourceAsStream(resource);
        if (stream == null) {
            throw new EphemerisUnavailable("Ephemeris table '" + resource + "' not found on classpath");
        }
        List<MoonTerm> terms = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                terms.add(parseTerm(trimmed, lineNumber));
            }
        } catch (IOException e) {
            throw new EphemerisUnavailable("Failed to read ephemeris table '" + resource + "'", e);
        }
        if (terms.isEmpty()) {
            throw new EphemerisUnavailable("Ephemeris table '" + resource + "' contains no terms");
        }
        LOG.debug("Loaded {} lunar longitude terms from {}", terms.size(), resource);
        return new Ephemeris(terms);
    }

    private MoonTerm parseTerm(String line, int lineNumber) {
        String[] parts = line.split("\\s+");
        if (parts.length != 5) {
            throw new EphemerisUnavailable("Malformed ephemeris line " + lineNumber + " in '" + resource + "': " + line);
        }
        try {
            return new MoonTerm(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]),
                    Integer.parseInt(parts[3]), Double.parseDouble(parts[4]));
        } catch (NumberFormatException e) {
            throw new EphemerisUnavailable("Malformed ephemeris line " + lineNumber + " in '" + resource + "': " + line, e);
        }
    }
}
