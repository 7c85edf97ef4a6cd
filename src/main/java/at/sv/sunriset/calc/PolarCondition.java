package at.sv.sunriset.calc;

public enum PolarCondition {
    /**
     * The sun stays above the horizon for the whole day.
     */
    POLAR_DAY,
    /**
     * The sun stays below the horizon for the whole day.
     */
    POLAR_NIGHT,
    /**
     * The hour angle could not be evaluated at all, e.g. because an input was not a finite number.
     */
    UNDETERMINED
}
