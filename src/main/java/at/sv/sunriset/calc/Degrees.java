package at.sv.sunriset.calc;

/**
 * An angle in degrees. Trigonometric helpers convert to radians internally, so stage formulas never
 * handle raw radian values.
 */
public record Degrees(double value) {

    public static final Degrees ZERO = new Degrees(0);

    public static Degrees of(double value) {
        return new Degrees(value);
    }

    public Radians toRadians() {
        return new Radians(Math.toRadians(value));
    }

    public Degrees plus(Degrees other) {
        return new Degrees(value + other.value);
    }

    public Degrees times(double factor) {
        return new Degrees(value * factor);
    }

    public double sin() {
        return Math.sin(toRadians().value());
    }

    public double cos() {
        return Math.cos(toRadians().value());
    }

    public double tan() {
        return Math.tan(toRadians().value());
    }

    @Override
    public String toString() {
        return value + "°";
    }
}
