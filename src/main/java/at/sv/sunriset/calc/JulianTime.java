package at.sv.sunriset.calc;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Conversion between civil dates and the astronomical time scale used by the stage formulas.
 */
public final class JulianTime {

    /**
     * Aligns the proleptic Gregorian ordinal (0001-01-01 = 1) with the Julian Day count.
     */
    public static final double ORDINAL_TO_JULIAN_DAY = 1721424.5;
    /**
     * Julian Day of 2000-01-01 12:00, the J2000.0 epoch.
     */
    public static final long J2000 = 2451545;
    public static final long DAYS_PER_CENTURY = 36525;
    public static final double MINUTES_PER_DAY = 1440;

    private static final long EPOCH_DAY_TO_ORDINAL = 719163;
    private static final long MICROS_PER_DAY = 86_400_000_000L;

    private JulianTime() {
    }

    /**
     * @param date           the civil date, taken at local midnight
     * @param utcOffsetHours the fixed offset of the local clock to UTC, e.g. {@code -8} for PST
     * @return the local Julian Day
     */
    public static double julianDay(LocalDate date, double utcOffsetHours) {
        double ordinal = ordinal(date) + ORDINAL_TO_JULIAN_DAY;
        return ordinal + 0.5 - utcOffsetHours / 24;
    }

    /**
     * Returns the fraction of the century band containing the given Julian Day. Bands are 36525 days
     * long and aligned on J2000; every day on or after J2000 is measured from J2000 itself.
     */
    public static double julianCentury(double julianDay) {
        long anchor = J2000;
        for (long candidate = J2000; candidate > 0; candidate -= DAYS_PER_CENTURY) {
            if (julianDay < candidate) {
                anchor = candidate - DAYS_PER_CENTURY;
            } else {
                break;
            }
        }
        return (julianDay - anchor) / DAYS_PER_CENTURY;
    }

    /**
     * Interprets a fraction of a day as a signed duration since local midnight, rounded to microseconds.
     *
     * @param fractionalDay the time of day as a fraction, may be negative or exceed 1
     * @param date          the day the fraction belongs to; not used for the conversion
     * @param adjustment    additional fraction of a day to add, e.g. a daylight-saving correction
     */
    public static Duration toDuration(double fractionalDay, LocalDate date, double adjustment) {
        long micros = Math.round((fractionalDay + adjustment) * MICROS_PER_DAY);
        return Duration.ofSeconds(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
    }

    private static long ordinal(LocalDate date) {
        return date.toEpochDay() + EPOCH_DAY_TO_ORDINAL;
    }
}
