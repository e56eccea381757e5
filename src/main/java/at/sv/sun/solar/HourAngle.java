package at.sv.sun.solar;

/**
 * Hour angle of the sun when its upper limb touches the horizon.
 */
public final class HourAngle {

    /**
     * Zenith distance of the sun's center at sunrise and sunset: 90° plus refraction and the solar disk radius.
     */
    public static final double SUNRISE_ZENITH = 90.833;

    private static final double COS_SUNRISE_ZENITH = Math.cos(Math.toRadians(SUNRISE_ZENITH));

    private HourAngle() {
    }

    /**
     * @param latitude    latitude of the observer in degrees
     * @param declination declination of the sun in degrees
     * @return the hour angle in radians, or {@link Double#NaN} if the sun stays above or below the horizon
     * for the whole day
     */
    public static double sunrise(double latitude, double declination) {
        double latitudeRad = Math.toRadians(latitude);
        double declinationRad = Math.toRadians(declination);
        double cosHourAngle = COS_SUNRISE_ZENITH / (Math.cos(latitudeRad) * Math.cos(declinationRad))
                              - Math.tan(latitudeRad) * Math.tan(declinationRad);
        // Math.acos already yields NaN for |x| > 1
        return Math.acos(cosHourAngle);
    }
}
