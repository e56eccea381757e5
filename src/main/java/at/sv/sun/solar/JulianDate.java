package at.sv.sun.solar;

import java.time.LocalDate;

/**
 * Conversions between calendar dates, Julian Days and Julian centuries relative to J2000.0.
 */
public final class JulianDate {

    /**
     * Julian Day of 2000-01-01 12:00 TT.
     */
    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;

    private JulianDate() {
    }

    /**
     * Returns the Julian Day for 00:00 of the given proleptic Gregorian date. Fractional days have to be added
     * by the caller. The date is not validated.
     *
     * @param year  four digit year
     * @param month January = 1
     * @param day   1 - 31
     */
    public static double fromCalendar(int year, int month, int day) {
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        double a = Math.floor(year / 100.0);
        double b = 2 - a + Math.floor(a / 4);
        return Math.floor(365.25 * (year + 4716)) + Math.floor(30.6001 * (month + 1)) + day + b - 1524.5;
    }

    public static double fromCalendar(LocalDate date) {
        return fromCalendar(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * @return the number of Julian centuries since J2000.0
     */
    public static double toCentury(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_CENTURY;
    }
}
