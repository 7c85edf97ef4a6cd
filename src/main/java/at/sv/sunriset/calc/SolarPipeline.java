package at.sv.sunriset.calc;

import java.time.LocalDate;

public interface SolarPipeline {

    /**
     * @param date           the civil date
     * @param location       the observer position
     * @param utcOffsetHours the fixed offset of the local clock to UTC in hours
     * @param dstAdjustment  an additional fraction of a day added to the clock times, usually {@code 0}
     * @return sunrise, sunset and solar noon since local midnight
     * @throws NoSunriseSunsetException   if the sun does not rise or set on that date
     * @throws InvalidCoordinateException if the offset or adjustment is not a finite number
     */
    SolarEvents computeSolarEvents(LocalDate date, Location location, double utcOffsetHours, double dstAdjustment);

    default SolarEvents computeSolarEvents(LocalDate date, Location location, double utcOffsetHours) {
        return computeSolarEvents(date, location, utcOffsetHours, 0);
    }

    /**
     * Computes every intermediate quantity for the given date. Either all values are available, or a
     * {@link SolarDomainException} is thrown.
     */
    SolarDay computeSolarDay(LocalDate date, Location location, double utcOffsetHours, double dstAdjustment);

    default SolarDay computeSolarDay(LocalDate date, Location location, double utcOffsetHours) {
        return computeSolarDay(date, location, utcOffsetHours, 0);
    }
}
