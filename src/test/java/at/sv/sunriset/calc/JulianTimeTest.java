package at.sv.sunriset.calc;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class JulianTimeTest {

    @Test
    void julianDay_appliesUtcOffset() {
        assertThat(JulianTime.julianDay(LocalDate.of(2021, 5, 31), -2)).isCloseTo(2459366.0833333335, within(1e-9));
    }

    @Test
    void julianDay_j2000() {
        assertThat(JulianTime.julianDay(LocalDate.of(2000, 1, 1), 0)).isEqualTo(2451545.0);
        assertThat(JulianTime.julianDay(LocalDate.of(1900, 1, 1), 0)).isEqualTo(2415021.0);
    }

    @Test
    void julianDay_increasesByExactlyOnePerDay() {
        LocalDate date = LocalDate.of(1899, 12, 25);
        for (int i = 0; i < 800; i++) {
            LocalDate next = date.plusDays(1);
            assertThat(JulianTime.julianDay(next, -8) - JulianTime.julianDay(date, -8)).isEqualTo(1.0);
            date = next.plusDays(97);
        }
    }

    @Test
    void julianCentury_afterJ2000_isRelativeToJ2000() {
        assertThat(JulianTime.julianCentury(2459366)).isCloseTo(0.21412731006160166, within(1e-15));
        assertThat(JulianTime.julianCentury(2451545)).isEqualTo(0.0);
        assertThat(JulianTime.julianCentury(2488070)).isEqualTo(1.0);
    }

    @Test
    void julianCentury_beforeJ2000_usesEnclosingCenturyBand() {
        assertThat(JulianTime.julianCentury(2451544.5)).isCloseTo(0.9999863107460644, within(1e-15));
        assertThat(JulianTime.julianCentury(2415020)).isEqualTo(0.0);
        assertThat(JulianTime.julianCentury(2415020 + 36525 / 2.0)).isCloseTo(0.5, within(1e-15));
    }

    @Test
    void julianCentury_atBandBoundary_isContinuousModuloOneCentury() {
        double boundary = JulianTime.J2000 - JulianTime.DAYS_PER_CENTURY;

        double before = JulianTime.julianCentury(boundary - 0.001);
        double at = JulianTime.julianCentury(boundary);

        assertThat(before).isCloseTo(0.9999999726214877, within(1e-12));
        assertThat(at).isEqualTo(0.0);
        assertThat((before - at) - 1.0).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void toDuration_roundsToMicroseconds() {
        Duration duration = JulianTime.toDuration(0.2907045549588338, LocalDate.of(2019, 1, 1), 0);

        assertThat(duration).isEqualTo(Duration.ofSeconds(25116, 873_548_000));
    }

    @Test
    void toDuration_addsAdjustment() {
        Duration duration = JulianTime.toDuration(0.5, LocalDate.of(2019, 1, 1), 1 / 24.0);

        assertThat(duration).isEqualTo(Duration.ofHours(13));
    }

    @Test
    void toDuration_negativeFraction_isNegativeDuration() {
        Duration duration = JulianTime.toDuration(-0.25, LocalDate.of(2019, 1, 1), 0);

        assertThat(duration).isEqualTo(Duration.ofHours(-6));
        assertThat(JulianTime.toDuration(-0.0000001, null, 0)).isEqualTo(Duration.ofNanos(-9_000));
    }
}
