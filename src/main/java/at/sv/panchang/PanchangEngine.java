package at.sv.panchang;

import at.sv.panchang.astro.EphemerisHandle;
import at.sv.panchang.astro.EphemerisPositionProvider;
import at.sv.panchang.astro.LunationCalendar;
import at.sv.panchang.astro.TithiCalculator;
import at.sv.panchang.event.AssemblyOptions;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventAssembler;
import at.sv.panchang.event.EventCategory;
import at.sv.panchang.event.EventSet;
import at.sv.panchang.event.RahuKaalCoalescer;
import at.sv.panchang.rules.ObservanceCatalog;
import at.sv.panchang.rules.ObservanceRule;
import at.sv.panchang.rules.RuleContext;
import at.sv.panchang.time.RahuKaalCalculator;
import at.sv.panchang.time.RiseSetProvider;
import at.sv.panchang.time.RiseSetProviderImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the observance calendar of a location: evaluates the selected rules year by year and assembles their
 * events.
 */
public final class PanchangEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PanchangEngine.class);

    private final TithiCalculator tithiCalculator;
    private final RiseSetProvider riseSetProvider;
    private final LunationCalendar lunationCalendar;
    private final RahuKaalCalculator rahuKaalCalculator;
    private final List<ObservanceRule> rules;
    private final EventAssembler assembler = new EventAssembler();
    private final RahuKaalCoalescer coalescer = new RahuKaalCoalescer();

    public PanchangEngine() {
        this(new TithiCalculator(new EphemerisPositionProvider(EphemerisHandle.shared())), new RiseSetProviderImpl());
    }

    public PanchangEngine(TithiCalculator tithiCalculator, RiseSetProvider riseSetProvider) {
        this(tithiCalculator, riseSetProvider, ObservanceCatalog.all());
    }

    PanchangEngine(TithiCalculator tithiCalculator, RiseSetProvider riseSetProvider, List<ObservanceRule> rules) {
        this.tithiCalculator = tithiCalculator;
        this.riseSetProvider = riseSetProvider;
        this.rules = List.copyOf(rules);
        lunationCalendar = new LunationCalendar(tithiCalculator);
        rahuKaalCalculator = new RahuKaalCalculator(riseSetProvider);
    }

    /**
     * @throws at.sv.panchang.astro.EphemerisUnavailable if the ephemeris can not be loaded
     * @throws at.sv.panchang.astro.NoLunationData       if no lunation could be found for a requested year
     */
    public EventSet calculate(CalendarRequest request) {
        List<EventSet> years = new ArrayList<>();
        for (int year = request.getFromYear(); year <= request.getLastYear(); year++) {
            years.add(calculateYear(request, year));
        }
        EventSet events = assembler.merge(years);
        if (request.getViewerZone() != null && !request.getViewerZone().isBlank()) {
            events = coalescer.coalesce(events, request.getViewerZone());
        }
        LOG.info("Computed {} events for {} ({}..{})", events.size(), request.getCoordinate(), request.getFromYear(),
                request.getLastYear());
        return events;
    }

    EventSet calculateYear(CalendarRequest request, int year) {
        RuleContext context = contextFor(request, year);
        AssemblyOptions options = request.getOptions();
        Map<EventCategory, List<Event>> candidates = new EnumMap<>(EventCategory.class);
        try {
            for (ObservanceRule rule : rules) {
                if (!isSelected(rule, options)) {
                    continue;
                }
                MDC.put("context", year + "/" + rule.key());
                List<Event> events = rule.evaluate(context);
                LOG.debug("{} events", events.size());
                candidates.computeIfAbsent(rule.category(), category -> new ArrayList<>()).addAll(events);
            }
        } finally {
            MDC.remove("context");
        }
        return assembler.assemble(candidates, options);
    }

    RuleContext contextFor(CalendarRequest request, int year) {
        MDC.put("context", String.valueOf(year));
        try {
            return RuleContext.builder()
                              .coordinate(request.getCoordinate())
                              .year(year)
                              .zone(request.getZone())
                              .tradition(request.getTradition())
                              .intervals(lunationCalendar.intervalsFor(year))
                              .monthMap(lunationCalendar.monthMapFor(year))
                              .tithiCalculator(tithiCalculator)
                              .riseSetProvider(riseSetProvider)
                              .rahuKaalCalculator(rahuKaalCalculator)
                              .build();
        } finally {
            MDC.remove("context");
        }
    }

    static boolean isSelected(ObservanceRule rule, AssemblyOptions options) {
        if (!options.includes(rule.category())) {
            return false;
        }
        return rule.category() != EventCategory.FESTIVAL || options.getFestivals().includes(rule.key());
    }
}
