package at.sv.sunriset.calc;

/**
 * An angle in radians, as returned by the inverse trigonometric functions.
 */
public record Radians(double value) {

    public static Radians acos(double x) {
        return new Radians(Math.acos(x));
    }

    public static Radians asin(double x) {
        return new Radians(Math.asin(x));
    }

    public static Radians atan2(double y, double x) {
        return new Radians(Math.atan2(y, x));
    }

    public Degrees toDegrees() {
        return new Degrees(Math.toDegrees(value));
    }

    @Override
    public String toString() {
        return value + " rad";
    }
}
