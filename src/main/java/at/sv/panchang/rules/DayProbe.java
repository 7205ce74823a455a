package at.sv.panchang.rules;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.function.BiFunction;

/**
 * The instants of a date at which a rule tests its condition, e.g. sunrise or every full hour.
 */
public interface DayProbe {

    String name();

    /**
     * @return the instants to test, in chronological order; empty if the probe does not exist on that date
     * @throws at.sv.panchang.time.RiseSetUndefined if the probe depends on a sunrise or sunset that does not exist
     */
    List<ZonedDateTime> instants(RuleContext context, LocalDate date);

    static DayProbe of(String name, BiFunction<RuleContext, LocalDate, List<ZonedDateTime>> instants) {
        return new DayProbe() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<ZonedDateTime> instants(RuleContext context, LocalDate date) {
                return instants.apply(context, date);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
