package at.sv.sun.time;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Turns minutes after 00:00 UTC into a local timestamp on a given date.
 */
public final class LocalEventTimeComposer {

    private static final double MINUTES_PER_HOUR = 60.0;
    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private LocalEventTimeComposer() {
    }

    /**
     * @param utcMinutes     minutes after 00:00 UTC on {@code date}, or {@link Double#NaN} if there is no event
     * @param utcOffsetHours offset of the local time from UTC in hours
     * @param daylightSaving if one hour of daylight saving should be added on top of the offset
     * @param date           the date the minutes are relative to
     * @return the local timestamp, possibly on the previous or next day; empty if {@code utcMinutes} is NaN
     */
    public static Optional<LocalDateTime> compose(double utcMinutes, double utcOffsetHours, boolean daylightSaving,
                                                  LocalDate date) {
        if (Double.isNaN(utcMinutes)) {
            return Optional.empty();
        }
        double localMinutes = utcMinutes + utcOffsetHours * MINUTES_PER_HOUR;
        if (daylightSaving) {
            localMinutes += MINUTES_PER_HOUR;
        }
        return Optional.of(date.atStartOfDay().plus(toDuration(localMinutes)));
    }

    private static Duration toDuration(double minutes) {
        return Duration.ofMillis(Math.round(minutes * MILLIS_PER_MINUTE));
    }
}
