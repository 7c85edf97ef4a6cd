package at.sv.sunriset.table;

import at.sv.sunriset.calc.Location;
import at.sv.sunriset.calc.SolarDay;
import at.sv.sunriset.calc.SolarDomainException;
import at.sv.sunriset.calc.SolarPipeline;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the solar pipeline once per calendar day and collects the results into a {@link SolarTable}.
 */
@Slf4j
public final class SolarTableBuilder {

    private final SolarPipeline pipeline;
    private final Location location;
    private final double utcOffsetHours;
    private final double dstAdjustment;
    private final boolean skipUndefinedDays;

    /**
     * @param skipUndefinedDays if {@code true}, dates without a complete result (e.g. polar day or night)
     *                          are left out; otherwise the first such date fails the whole build
     */
    public SolarTableBuilder(SolarPipeline pipeline, Location location, double utcOffsetHours, double dstAdjustment,
                             boolean skipUndefinedDays) {
        this.pipeline = pipeline;
        this.location = location;
        this.utcOffsetHours = utcOffsetHours;
        this.dstAdjustment = dstAdjustment;
        this.skipUndefinedDays = skipUndefinedDays;
    }

    /**
     * Builds a table for every day from {@code startDate} until the same day {@code numberOfYears} later
     * (exclusive).
     */
    public SolarTable build(LocalDate startDate, int numberOfYears) {
        if (numberOfYears < 1) {
            throw new IllegalArgumentException("Number of years must be >= 1, but was " + numberOfYears);
        }
        return build(startDate, startDate.plusYears(numberOfYears));
    }

    /**
     * Builds a table for every day from {@code startDate} (inclusive) to {@code endDate} (exclusive).
     *
     * @throws SolarTableException if a date has no complete result and undefined days are not skipped
     */
    public SolarTable build(LocalDate startDate, LocalDate endDate) {
        if (!endDate.isAfter(startDate)) {
            throw new IllegalArgumentException("End date " + endDate + " must be after start date " + startDate);
        }
        log.debug("Build solar table for {} from {} to {} (exclusive)", location, startDate, endDate);
        List<SolarDay> rows = new ArrayList<>();
        List<LocalDate> skipped = new ArrayList<>();
        for (LocalDate date = startDate; date.isBefore(endDate); date = date.plusDays(1)) {
            try {
                rows.add(pipeline.computeSolarDay(date, location, utcOffsetHours, dstAdjustment));
            } catch (SolarDomainException e) {
                if (!skipUndefinedDays) {
                    throw new SolarTableException(date, e);
                }
                log.warn("Skip {}: {}", date, e.getLocalizedMessage());
                skipped.add(date);
            }
        }
        log.debug("Computed {} rows, skipped {} dates", rows.size(), skipped.size());
        return new SolarTable(List.copyOf(rows), List.copyOf(skipped));
    }
}
