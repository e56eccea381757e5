package at.sv.sun;

import at.sv.sun.solar.EventTimeCalculator;
import at.sv.sun.solar.JulianDate;
import at.sv.sun.solar.SolarEvent;
import at.sv.sun.time.LocalEventTimeComposer;
import at.sv.sun.time.UtcOffsetProvider;
import at.sv.sun.time.ZoneUtcOffsetProvider;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Calculates the local time of sunrise and sunset for a location on earth.
 * <p>
 * Latitude and longitude are given in decimal degrees, south and west being negative. They are not validated.
 * The returned timestamps carry no zone; they are already shifted by the UTC offset. An empty result means that
 * the sun does not rise or set on that day, e.g. during polar day or polar night.
 */
@Slf4j
public final class SunriseSunsetCalculator {

    private final UtcOffsetProvider utcOffsetProvider;
    private final Supplier<LocalDate> today;

    /**
     * Uses the system default time zone for offsets and the current date of that zone for "today".
     */
    public SunriseSunsetCalculator() {
        this(ZoneUtcOffsetProvider.systemDefault(), LocalDate::now);
    }

    public SunriseSunsetCalculator(UtcOffsetProvider utcOffsetProvider, Supplier<LocalDate> today) {
        this.utcOffsetProvider = Objects.requireNonNull(utcOffsetProvider, "utcOffsetProvider");
        this.today = Objects.requireNonNull(today, "today");
    }

    public Optional<LocalDateTime> sunriseToday(double latitude, double longitude) {
        return sunriseAt(latitude, longitude, today.get());
    }

    /**
     * Uses the UTC offset of the configured {@link UtcOffsetProvider} for the given date.
     */
    public Optional<LocalDateTime> sunriseAt(double latitude, double longitude, @NotNull LocalDate date) {
        return sunriseAt(latitude, longitude, date, utcOffsetProvider.getUtcOffsetHours(date));
    }

    public Optional<LocalDateTime> sunriseAt(double latitude, double longitude, @NotNull LocalDate date,
                                             double utcOffset) {
        return sunriseAt(latitude, longitude, date, utcOffset, false);
    }

    public Optional<LocalDateTime> sunriseAt(double latitude, double longitude, @NotNull LocalDate date,
                                             double utcOffset, boolean daylightSaving) {
        return eventAt(SolarEvent.SUNRISE, latitude, longitude, date, utcOffset, daylightSaving);
    }

    public Optional<LocalDateTime> sunsetToday(double latitude, double longitude) {
        return sunsetAt(latitude, longitude, today.get());
    }

    /**
     * Uses the UTC offset of the configured {@link UtcOffsetProvider} for the given date.
     */
    public Optional<LocalDateTime> sunsetAt(double latitude, double longitude, @NotNull LocalDate date) {
        return sunsetAt(latitude, longitude, date, utcOffsetProvider.getUtcOffsetHours(date));
    }

    public Optional<LocalDateTime> sunsetAt(double latitude, double longitude, @NotNull LocalDate date,
                                            double utcOffset) {
        return sunsetAt(latitude, longitude, date, utcOffset, false);
    }

    public Optional<LocalDateTime> sunsetAt(double latitude, double longitude, @NotNull LocalDate date,
                                            double utcOffset, boolean daylightSaving) {
        return eventAt(SolarEvent.SUNSET, latitude, longitude, date, utcOffset, daylightSaving);
    }

    /**
     * @param utcOffset      hours from UTC the location is in, fractional offsets like 9.5 are supported
     * @param daylightSaving if one additional hour should be added to {@code utcOffset}
     */
    public Optional<LocalDateTime> eventAt(@NotNull SolarEvent event, double latitude, double longitude,
                                           @NotNull LocalDate date, double utcOffset, boolean daylightSaving) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(date, "date");
        double julianDay = JulianDate.fromCalendar(date);
        double utcMinutes = EventTimeCalculator.utcMinutes(event, julianDay, latitude, longitude);
        Optional<LocalDateTime> result = LocalEventTimeComposer.compose(utcMinutes, utcOffset, daylightSaving, date);
        if (result.isEmpty()) {
            log.debug("No {} on {} at {}, {}", event, date, latitude, longitude);
        }
        return result;
    }

    public double getUtcOffsetHours(@NotNull LocalDate date) {
        return utcOffsetProvider.getUtcOffsetHours(date);
    }

    public LocalDate today() {
        return today.get();
    }
}
