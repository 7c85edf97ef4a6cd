package at.sv.sunriset.table;

import at.sv.sunriset.calc.Degrees;
import at.sv.sunriset.calc.Location;
import at.sv.sunriset.calc.NoSunriseSunsetException;
import at.sv.sunriset.calc.PolarCondition;
import at.sv.sunriset.calc.SolarDay;
import at.sv.sunriset.calc.SolarPipeline;
import at.sv.sunriset.calc.SolarPipelineImpl;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolarTableBuilderTest {

    private static final Location LOS_ANGELES = Location.of(34.0522, -118.2437);
    private static final Location SVALBARD = Location.of(78.614803, 15.895517);

    @Mock
    private SolarPipeline pipeline;

    private SolarTableBuilder create(SolarPipeline pipeline, Location location, boolean skipUndefinedDays) {
        return new SolarTableBuilder(pipeline, location, -8, 0, skipUndefinedDays);
    }

    @Test
    void build_oneYear_oneRowPerDay() {
        SolarTable table = create(new SolarPipelineImpl(), LOS_ANGELES, false).build(LocalDate.of(2019, 1, 1), 1);

        assertThat(table.size()).isEqualTo(365);
        assertThat(table.getSkippedDates()).isEmpty();
        assertThat(table.getRows().get(0).getDate()).isEqualTo(LocalDate.of(2019, 1, 1));
        assertThat(table.getRows().get(364).getDate()).isEqualTo(LocalDate.of(2019, 12, 31));
    }

    @Test
    void build_leapYear_has366Rows() {
        SolarTable table = create(new SolarPipelineImpl(), LOS_ANGELES, false).build(LocalDate.of(2020, 1, 1), 1);

        assertThat(table.size()).isEqualTo(366);
    }

    @Test
    void build_multipleYears_countsEachYearSeparately() {
        SolarTable table = create(new SolarPipelineImpl(), LOS_ANGELES, false).build(LocalDate.of(2019, 3, 1), 2);

        assertThat(table.size()).isEqualTo(366 + 365);
    }

    @Test
    void build_explicitSpan_endIsExclusive_callsPipelineOncePerDay() {
        when(pipeline.computeSolarDay(any(), eq(LOS_ANGELES), eq(-8.0), eq(0.0)))
                .thenAnswer(invocation -> SolarDay.builder().date(invocation.getArgument(0)).build());

        SolarTable table = create(pipeline, LOS_ANGELES, false).build(LocalDate.of(2019, 1, 30), LocalDate.of(2019, 2, 2));

        assertThat(table.getRows()).extracting(SolarDay::getDate)
                                   .containsExactly(LocalDate.of(2019, 1, 30), LocalDate.of(2019, 1, 31),
                                           LocalDate.of(2019, 2, 1));
        verify(pipeline, times(3)).computeSolarDay(any(), any(), anyDouble(), anyDouble());
    }

    @Test
    void build_undefinedDay_failsWholeTable_withDate() {
        LocalDate polarNight = LocalDate.of(2021, 12, 1);
        when(pipeline.computeSolarDay(any(), any(), anyDouble(), anyDouble()))
                .thenAnswer(invocation -> SolarDay.builder().date(invocation.getArgument(0)).build())
                .thenThrow(new NoSunriseSunsetException(PolarCondition.POLAR_NIGHT, Degrees.of(80), Degrees.of(-22), 2.5));

        assertThatThrownBy(() -> create(pipeline, SVALBARD, false).build(polarNight.minusDays(1), polarNight.plusDays(5)))
                .isInstanceOfSatisfying(SolarTableException.class, e -> {
                    assertThat(e.getDate()).isEqualTo(polarNight);
                    assertThat(e.getCause()).isInstanceOf(NoSunriseSunsetException.class);
                });
    }

    @Test
    void build_skipUndefinedDays_leavesOutPolarNight() {
        SolarTable table = create(new SolarPipelineImpl(), SVALBARD, true).build(LocalDate.of(2021, 1, 1), 1);

        assertThat(table.getSkippedDates()).isNotEmpty()
                                           .contains(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 6, 21), LocalDate.of(2021, 12, 21));
        assertThat(table.size() + table.getSkippedDates().size()).isEqualTo(365);
        assertThat(table.getRows()).extracting(SolarDay::getDate)
                                   .contains(LocalDate.of(2021, 3, 20), LocalDate.of(2021, 9, 23))
                                   .doesNotContainAnyElementsOf(table.getSkippedDates());
    }

    @Test
    void build_invalidSpan_throws() {
        SolarTableBuilder builder = create(pipeline, LOS_ANGELES, false);

        assertThatThrownBy(() -> builder.build(LocalDate.of(2019, 1, 1), 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(LocalDate.of(2019, 1, 1), LocalDate.of(2019, 1, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
