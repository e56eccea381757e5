package at.sv.sun.solar;

/**
 * The difference between apparent (sundial) and mean (clock) solar time.
 */
public final class EquationOfTime {

    private static final double MINUTES_PER_DEGREE = 4.0;

    private EquationOfTime() {
    }

    /**
     * @param t Julian centuries since J2000.0
     * @return the equation of time in minutes; positive if the sundial is ahead of the clock
     */
    public static double minutes(double t) {
        double obliquity = SolarOrbit.correctedObliquity(t);
        double meanLongitude = Math.toRadians(SolarOrbit.geometricMeanLongitude(t));
        double eccentricity = SolarOrbit.eccentricity(t);
        double meanAnomaly = Math.toRadians(SolarOrbit.geometricMeanAnomaly(t));

        double y = Math.tan(Math.toRadians(obliquity) / 2.0);
        y *= y;

        double sin2L0 = Math.sin(2.0 * meanLongitude);
        double cos2L0 = Math.cos(2.0 * meanLongitude);
        double sin4L0 = Math.sin(4.0 * meanLongitude);
        double sinM = Math.sin(meanAnomaly);
        double sin2M = Math.sin(2.0 * meanAnomaly);

        double radians = y * sin2L0
                         - 2.0 * eccentricity * sinM
                         + 4.0 * eccentricity * y * sinM * cos2L0
                         - 0.5 * y * y * sin4L0
                         - 1.25 * eccentricity * eccentricity * sin2M;
        return Math.toDegrees(radians) * MINUTES_PER_DEGREE;
    }
}
