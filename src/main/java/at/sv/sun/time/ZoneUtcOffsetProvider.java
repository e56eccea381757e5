package at.sv.sun.time;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

public final class ZoneUtcOffsetProvider implements UtcOffsetProvider {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final ZoneId zone;

    public ZoneUtcOffsetProvider(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static ZoneUtcOffsetProvider systemDefault() {
        return new ZoneUtcOffsetProvider(ZoneId.systemDefault());
    }

    /**
     * Uses the offset at the start of the given day, so a daylight saving switch later on that day is not
     * reflected. Fractional offsets like +09:30 are kept.
     */
    @Override
    public double getUtcOffsetHours(LocalDate date) {
        ZoneOffset offset = zone.getRules().getOffset(date.atStartOfDay(zone).toInstant());
        return offset.getTotalSeconds() / SECONDS_PER_HOUR;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public String toString() {
        return "ZoneUtcOffsetProvider{" + zone + '}';
    }
}
