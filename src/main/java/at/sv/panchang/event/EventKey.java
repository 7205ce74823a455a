package at.sv.panchang.event;

import java.time.LocalDate;

/**
 * Identity of an event within an {@link EventSet}.
 */
public record EventKey(String summary, LocalDate date) {
}
