package at.sv.sun.solar;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HourAngleTest {

    @Test
    void sunrise_atEquator_slightlyMoreThanQuarterDay() {
        double hourAngle = HourAngle.sunrise(0, 0);

        assertThat(hourAngle).isCloseTo(1.5853349194640094, within(1e-12));
        assertThat(Math.toDegrees(hourAngle)).isCloseTo(HourAngle.SUNRISE_ZENITH, within(1e-9));
    }

    @Test
    void sunrise_midLatitudeSummer_longDay() {
        assertThat(HourAngle.sunrise(40.72, 23.44)).isCloseTo(1.97588222, within(1e-8));
    }

    @Test
    void sunrise_midnightSun_notANumber() {
        assertThat(HourAngle.sunrise(80, 23.4)).isNaN();
        assertThat(HourAngle.sunrise(-80, -23.4)).isNaN();
    }

    @Test
    void sunrise_polarNight_notANumber() {
        assertThat(HourAngle.sunrise(80, -23.4)).isNaN();
        assertThat(HourAngle.sunrise(-80, 23.4)).isNaN();
    }

    @Test
    void sunrise_symmetricForOppositeHemispheresAndSeasons() {
        assertThat(HourAngle.sunrise(-40.72, -23.44)).isEqualTo(HourAngle.sunrise(40.72, 23.44));
    }
}
