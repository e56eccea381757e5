package at.sv.sun.solar;

/**
 * Position of the sun on its apparent orbit, as a function of Julian centuries since J2000.0.
 * <p>
 * Every angle taken or returned here is in degrees. The polynomials are the ones of the NOAA solar calculator
 * and lose precision a few centuries away from J2000.0; no range check is done.
 */
public final class SolarOrbit {

    private SolarOrbit() {
    }

    /**
     * @return the geometric mean longitude of the sun, normalized to [0, 360]
     */
    public static double geometricMeanLongitude(double t) {
        double longitude = 280.46646 + t * (36000.76983 + 0.0003032 * t);
        while (longitude > 360.0) {
            longitude -= 360.0;
        }
        while (longitude < 0.0) {
            longitude += 360.0;
        }
        return longitude;
    }

    public static double geometricMeanAnomaly(double t) {
        return 357.52911 + t * (35999.05029 - 0.0001537 * t);
    }

    /**
     * @return the unitless eccentricity of earth's orbit
     */
    public static double eccentricity(double t) {
        return 0.016708634 - t * (0.000042037 + 0.0000001267 * t);
    }

    public static double equationOfCenter(double t) {
        double m = Math.toRadians(geometricMeanAnomaly(t));
        double sinM = Math.sin(m);
        double sin2M = Math.sin(m + m);
        double sin3M = Math.sin(m + m + m);
        return sinM * (1.914602 - t * (0.004817 + 0.000014 * t))
               + sin2M * (0.019993 - 0.000101 * t)
               + sin3M * 0.000289;
    }

    public static double trueLongitude(double t) {
        return geometricMeanLongitude(t) + equationOfCenter(t);
    }

    /**
     * @return the true longitude corrected for nutation and aberration
     */
    public static double apparentLongitude(double t) {
        return trueLongitude(t) - 0.00569 - 0.00478 * Math.sin(Math.toRadians(ascendingNodeLongitude(t)));
    }

    public static double meanObliquityOfEcliptic(double t) {
        double seconds = 21.448 - t * (46.8150 + t * (0.00059 - t * 0.001813));
        return 23.0 + (26.0 + seconds / 60.0) / 60.0;
    }

    public static double correctedObliquity(double t) {
        return meanObliquityOfEcliptic(t) + 0.00256 * Math.cos(Math.toRadians(ascendingNodeLongitude(t)));
    }

    public static double declination(double t) {
        double obliquity = Math.toRadians(correctedObliquity(t));
        double apparentLongitude = Math.toRadians(apparentLongitude(t));
        return Math.toDegrees(Math.asin(Math.sin(obliquity) * Math.sin(apparentLongitude)));
    }

    // longitude of the moon's ascending node, drives the nutation terms
    private static double ascendingNodeLongitude(double t) {
        return 125.04 - 1934.136 * t;
    }
}
