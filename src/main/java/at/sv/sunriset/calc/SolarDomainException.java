package at.sv.sunriset.calc;

/**
 * Signals that a stage formula was asked for the inverse cosine or sine of a value outside [-1, 1].
 * This is a physical condition of the date and location, not a transient failure; retrying never helps.
 */
public class SolarDomainException extends RuntimeException {

    private final double argument;

    public SolarDomainException(String message, double argument) {
        super(message);
        this.argument = argument;
    }

    /**
     * @return the offending argument of the inverse trigonometric function, may be {@code NaN}
     */
    public double getArgument() {
        return argument;
    }
}
