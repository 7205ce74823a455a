package at.sv.panchang;

import at.sv.panchang.event.AssemblyOptions;
import at.sv.panchang.event.EventSet;
import at.sv.panchang.event.FestivalSelection;
import at.sv.panchang.event.InvalidFestivalKey;
import at.sv.panchang.output.CalendarWriter;
import at.sv.panchang.output.IcsWriter;
import at.sv.panchang.output.JsonEventWriter;
import at.sv.panchang.output.OutputFormat;
import at.sv.panchang.rules.ObservanceCatalog;
import at.sv.panchang.rules.Tradition;
import at.sv.panchang.time.ConfiguredTimeZoneResolver;
import at.sv.panchang.time.CoordinateTimeZoneResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Locale;
import java.util.function.Supplier;

@Command(name = "panchang-calendar", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Computes Hindu lunisolar observances (Ekadashi, Sankashti, Amavasya/Purnima, festivals, " +
                      "Rahu Kaal) for a location and writes them as an iCalendar or JSON file.")
public final class PanchangCalendar implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(PanchangCalendar.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of the location in degrees [-90..90].")
    double latitude;
    @Option(names = "--lon", required = true,
            defaultValue = "${env:LON}",
            description = "The longitude of the location in degrees [-180..180].")
    double longitude;
    @Option(names = "--year", required = true,
            defaultValue = "${env:YEAR}",
            description = "The civil year to compute.")
    int year;
    @Option(names = "--year-to", paramLabel = "<year>",
            defaultValue = "${env:YEAR_TO}",
            description = "Optional last year (inclusive) to compute a range of years.")
    Integer yearTo;
    @Option(names = "--zone", paramLabel = "<zone-id>",
            defaultValue = "${env:ZONE}",
            description = "The IANA time zone to use where the coordinates lie outside every time zone, e.g. at sea. " +
                          "Falls back to UTC if missing.")
    String zone;
    @Option(names = "--tradition",
            defaultValue = "${env:TRADITION:-smartha}",
            description = "The Ekadashi tradition: smartha or vaishnava. Default: ${DEFAULT-VALUE}")
    String tradition;
    @Option(names = "--no-ekadashi",
            defaultValue = "${env:NO_EKADASHI:-false}",
            description = "Omit Ekadashi events. Default: ${DEFAULT-VALUE}")
    boolean noEkadashi;
    @Option(names = "--no-sankashti",
            defaultValue = "${env:NO_SANKASHTI:-false}",
            description = "Omit Sankashti Chaturthi events. Default: ${DEFAULT-VALUE}")
    boolean noSankashti;
    @Option(names = "--no-ap",
            defaultValue = "${env:NO_AP:-false}",
            description = "Omit Amavasya and Purnima events. Default: ${DEFAULT-VALUE}")
    boolean noAmavasyaPurnima;
    @Option(names = "--no-rahukaal",
            defaultValue = "${env:NO_RAHUKAAL:-false}",
            description = "Omit the timed Rahu Kaal events. Default: ${DEFAULT-VALUE}")
    boolean noRahuKaal;
    @Option(names = "--no-festivals",
            defaultValue = "${env:NO_FESTIVALS:-false}",
            description = "Omit all festivals. Default: ${DEFAULT-VALUE}")
    boolean noFestivals;
    @Option(names = "--festivals", paramLabel = "<keys>",
            defaultValue = "${env:FESTIVALS:-all}",
            description = "'all' or a comma separated list of festival keys, e.g. diwali,holi. Default: ${DEFAULT-VALUE}")
    String festivals;
    @Option(names = "--viewer-tz", paramLabel = "<zone-id>",
            defaultValue = "${env:VIEWER_TZ}",
            description = "Optional time zone of the viewer. Keeps at most one Rahu Kaal event per viewer date.")
    String viewerZone;
    @Option(names = "--format",
            defaultValue = "${env:FORMAT:-ics}",
            description = "The output format: ics or json. Default: ${DEFAULT-VALUE}")
    String format;
    @Option(names = "--outfile", paramLabel = "<file>",
            defaultValue = "${env:OUTFILE}",
            description = "The output file. Default: site/<year>-fullcalendar-<tradition>.<format>")
    Path outfile;

    private final Clock clock;

    public PanchangCalendar() {
        this(Clock.systemUTC());
    }

    PanchangCalendar(Clock clock) {
        this.clock = clock;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new PanchangCalendar()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        CalendarRequest request;
        OutputFormat outputFormat;
        try {
            request = createRequest();
            outputFormat = parse(() -> OutputFormat.parse(format));
        } finally {
            MDC.remove("context");
        }
        Path target = outfile != null ? outfile : defaultOutfile(request, outputFormat);

        EventSet events = new PanchangEngine().calculate(request);
        writerFor(outputFormat, request).write(events, target);
        LOG.info("Wrote {} events to {}", events.size(), target.toAbsolutePath());
    }

    CalendarRequest createRequest() {
        GeoCoordinate coordinate = parse(() -> GeoCoordinate.of(latitude, longitude));
        ZoneId zoneId = new CoordinateTimeZoneResolver(new ConfiguredTimeZoneResolver(zone)).zoneFor(coordinate);
        FestivalSelection selection = parse(() -> FestivalSelection.parse(festivals, ObservanceCatalog.festivalKeys()));
        AssemblyOptions options = AssemblyOptions.builder()
                                                 .includeEkadashi(!noEkadashi)
                                                 .includeSankashti(!noSankashti)
                                                 .includeAmavasyaPurnima(!noAmavasyaPurnima)
                                                 .includeRahuKaal(!noRahuKaal)
                                                 .includeFestivals(!noFestivals)
                                                 .festivals(selection)
                                                 .build();
        if (yearTo != null && yearTo < year) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--year-to " + yearTo + " must not be before --year " + year);
        }
        return CalendarRequest.builder()
                              .coordinate(coordinate)
                              .fromYear(year)
                              .toYear(yearTo != null ? yearTo : year)
                              .zone(zoneId)
                              .tradition(parse(() -> Tradition.parse(tradition)))
                              .options(options)
                              .viewerZone(viewerZone)
                              .build();
    }

    static Path defaultOutfile(CalendarRequest request, OutputFormat format) {
        String years = request.getLastYear() == request.getFromYear()
                ? String.valueOf(request.getFromYear())
                : request.getFromYear() + "-" + request.getLastYear();
        String traditionName = request.getTradition().name().toLowerCase(Locale.ENGLISH);
        return Path.of("site", years + "-fullcalendar-" + traditionName + "." + format.getExtension());
    }

    private CalendarWriter writerFor(OutputFormat outputFormat, CalendarRequest request) {
        return switch (outputFormat) {
            case ICS -> new IcsWriter(clock, calendarName(request), request.getZone());
            case JSON -> new JsonEventWriter();
        };
    }

    private static String calendarName(CalendarRequest request) {
        return "Panchang " + request.getFromYear() +
               (request.getLastYear() != request.getFromYear() ? "-" + request.getLastYear() : "") +
               " (" + request.getTradition().getLabel() + ", " + request.getZone().getId() + ")";
    }

    private <T> T parse(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (InvalidCoordinate | InvalidFestivalKey | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }
}
