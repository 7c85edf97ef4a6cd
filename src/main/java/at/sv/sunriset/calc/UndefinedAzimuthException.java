package at.sv.sunriset.calc;

/**
 * Thrown if the sun is exactly at the zenith or nadir, where the azimuth has no defined direction.
 */
public final class UndefinedAzimuthException extends SolarDomainException {

    public UndefinedAzimuthException(Degrees zenith, double argument) {
        super("Solar azimuth is undefined for zenith angle " + zenith, argument);
    }
}
