package at.sv.sunriset.table;

import at.sv.sunriset.calc.Location;
import at.sv.sunriset.calc.SolarDay;
import at.sv.sunriset.calc.SolarPipelineImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SolarColumnTest {

    private SolarDay day;

    @BeforeEach
    void setUp() {
        day = new SolarPipelineImpl().computeSolarDay(LocalDate.of(2019, 1, 1), Location.of(34.0522, -118.2437), -8);
    }

    @Test
    void columns_keepPipelineOrder_andPublishedHeaders() {
        assertThat(SolarColumn.values()).hasSize(31);
        assertThat(Arrays.stream(SolarColumn.values()).map(SolarColumn::getHeader))
                .startsWith("Julian Day", "Julian Century", "Solar Geometric Mean Longitude")
                .contains("Solar Accent Return", "Sunlight Durration (minutes)", "Ture Solar Time")
                .endsWith("Solar Elevation Corrected ATM Refraction (degrees)", "Solar Azimuth Angle (degrees cw from North)")
                .doesNotHaveDuplicates();
    }

    @Test
    void valueOf_angle_isPlainDouble() {
        assertThat(SolarColumn.HOUR_ANGLE_SUNRISE.valueOf(day)).isInstanceOfSatisfying(Double.class,
                value -> assertThat(value).isCloseTo(74.48940961474803, within(1e-9)));
        assertThat(SolarColumn.JULIAN_DAY.valueOf(day)).isEqualTo(2458485.3333333335);
    }

    @Test
    void valueOf_clockTime_isFormattedWithMicroseconds() {
        assertThat(SolarColumn.SUNRISE.valueOf(day)).isEqualTo("6:58:36.873548");
        assertThat(SolarColumn.SUNSET.valueOf(day)).isEqualTo("16:54:31.790164");
    }

    @Test
    void toRow_startsWithDate_followedByAllColumns() {
        Map<String, Object> row = SolarColumn.toRow(day);

        assertThat(row).hasSize(32);
        assertThat(row.keySet()).first().isEqualTo(SolarColumn.DATE_HEADER);
        assertThat(row).containsEntry("Date", "2019-01-01");
        assertThat(row.keySet()).containsSubsequence("Sunrise (float)", "Sunset (float)", "Solar Noon", "Sunrise", "Sunset");
    }
}
