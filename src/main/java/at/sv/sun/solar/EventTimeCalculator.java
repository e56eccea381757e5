package at.sv.sun.solar;

import lombok.extern.slf4j.Slf4j;

/**
 * Calculates the time of sunrise and sunset in minutes after 00:00 UTC.
 */
@Slf4j
public final class EventTimeCalculator {

    private static final double MINUTES_PER_DAY = 1440.0;
    private static final double SOLAR_NOON_AT_GREENWICH = 720.0;

    private EventTimeCalculator() {
    }

    /**
     * Calculates the event time with the sun's position at the start of the given Julian Day, and then again
     * with the position at the estimated event time.
     *
     * @param julianDay Julian Day at 00:00 UTC of the date
     * @return minutes from 00:00 UTC, may be negative or exceed a day; {@link Double#NaN} if the event does not
     * happen on that day
     */
    public static double utcMinutes(SolarEvent event, double julianDay, double latitude, double longitude) {
        double estimate = singlePass(event, julianDay, latitude, longitude);
        double refined = singlePass(event, julianDay + estimate / MINUTES_PER_DAY, latitude, longitude);
        log.trace("{} at {}: estimate={} min, refined={} min", event, julianDay, estimate, refined);
        return refined;
    }

    static double singlePass(SolarEvent event, double julianDay, double latitude, double longitude) {
        double t = JulianDate.toCentury(julianDay);
        double eqTime = EquationOfTime.minutes(t);
        double declination = SolarOrbit.declination(t);
        double hourAngle = event.signed(HourAngle.sunrise(latitude, declination));
        double delta = longitude + Math.toDegrees(hourAngle);
        return SOLAR_NOON_AT_GREENWICH - 4.0 * delta - eqTime;
    }

    /**
     * @return the time of the sun's transit in minutes after 00:00 UTC, evaluated at the given Julian Day
     */
    public static double solarNoonUtcMinutes(double julianDay, double longitude) {
        return SOLAR_NOON_AT_GREENWICH - 4.0 * longitude - EquationOfTime.minutes(JulianDate.toCentury(julianDay));
    }
}
