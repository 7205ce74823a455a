package at.sv.panchang.rules;

import at.sv.panchang.astro.AmantaMonth;
import at.sv.panchang.astro.LunationInterval;
import at.sv.panchang.event.AllDayEvent;
import at.sv.panchang.event.Event;
import at.sv.panchang.event.EventCategory;
import at.sv.panchang.time.Daylight;
import at.sv.panchang.time.RiseSetUndefined;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ram Navami: Chaitra Shukla Navami prevailing during madhyahna, the middle fifth of daylight. The date whose
 * madhyahna is covered best wins; ties go to the later date.
 */
@Slf4j
public final class RamNavamiRule implements ObservanceRule {

    public static final String KEY = "ram_navami";
    static final int NAVAMI = 9;
    static final int SAMPLES = 25;

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public EventCategory category() {
        return EventCategory.FESTIVAL;
    }

    @Override
    public List<Event> evaluate(RuleContext context) {
        List<Event> events = new ArrayList<>();
        for (LunationInterval chaitra : context.nijaIntervals(AmantaMonth.CHAITRA)) {
            LocalDate best = null;
            int bestScore = 0;
            for (LocalDate date : DateWindow.of(chaitra, context.getZone()).dates()) {
                int score = madhyahnaScore(context, date);
                if (score > 0 && score >= bestScore) {
                    best = date;
                    bestScore = score;
                }
            }
            if (best == null) {
                log.debug("No Navami during madhyahna in {}", chaitra);
            } else if (context.isInYear(best)) {
                events.add(AllDayEvent.festival(KEY, "Ram Navami", best,
                        "Chaitra Shukla Navami at madhyahna, " + bestScore + "/" + SAMPLES + " (" + context.zoneId() + ")."));
            }
        }
        return events;
    }

    /**
     * @return how many of the samples spread over madhyahna fall into Navami
     */
    static int madhyahnaScore(RuleContext context, LocalDate date) {
        Daylight daylight;
        try {
            daylight = context.daylight(date);
        } catch (RiseSetUndefined e) {
            return 0;
        }
        Duration fifth = daylight.length().dividedBy(5);
        ZonedDateTime start = daylight.sunrise().plus(fifth.multipliedBy(2));
        Duration step = fifth.dividedBy(SAMPLES - 1);
        int score = 0;
        for (int i = 0; i < SAMPLES; i++) {
            if (context.tithiAt(start.plus(step.multipliedBy(i))) == NAVAMI) {
                score++;
            }
        }
        return score;
    }
}
