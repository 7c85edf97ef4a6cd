package at.sv.sunriset.calc;

/**
 * Signals an input that is rejected before any computation, e.g. a latitude of exactly ±90°.
 */
public final class InvalidCoordinateException extends IllegalArgumentException {

    public InvalidCoordinateException(String message) {
        super(message);
    }
}
