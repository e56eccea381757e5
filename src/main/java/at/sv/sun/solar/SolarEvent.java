package at.sv.sun.solar;

public enum SolarEvent {
    SUNRISE(1),
    SUNSET(-1);

    private final int hourAngleSign;

    SolarEvent(int hourAngleSign) {
        this.hourAngleSign = hourAngleSign;
    }

    /**
     * Sunrise lies before solar noon and therefore uses the positive hour angle in
     * {@code 720 - 4 * (longitude + H) - eqTime}; sunset the negated one.
     */
    public double signed(double hourAngle) {
        return hourAngleSign * hourAngle;
    }
}
