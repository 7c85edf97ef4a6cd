package at.sv.sunriset.calc;

/**
 * Thrown if the sun does not cross the horizon on the given date at the given latitude.
 */
public final class NoSunriseSunsetException extends SolarDomainException {

    private final PolarCondition condition;

    public NoSunriseSunsetException(PolarCondition condition, Degrees latitude, Degrees declination, double argument) {
        super("No sunrise or sunset at latitude " + latitude + " with solar declination " + declination + ": " +
              describe(condition), argument);
        this.condition = condition;
    }

    public PolarCondition getCondition() {
        return condition;
    }

    private static String describe(PolarCondition condition) {
        return switch (condition) {
            case POLAR_DAY -> "the sun never sets (polar day)";
            case POLAR_NIGHT -> "the sun never rises (polar night)";
            case UNDETERMINED -> "hour angle is undefined";
        };
    }
}
