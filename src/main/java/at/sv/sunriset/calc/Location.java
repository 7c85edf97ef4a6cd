package at.sv.sunriset.calc;

/**
 * A geographic position. Longitude is positive east of Greenwich.
 */
public record Location(Degrees latitude, Degrees longitude) {

    public Location {
        assertLatitude(latitude.value());
        assertLongitude(longitude.value());
    }

    public static Location of(double latitude, double longitude) {
        return new Location(Degrees.of(latitude), Degrees.of(longitude));
    }

    // the sunrise hour angle divides by cos(latitude), so the poles themselves are excluded
    private static void assertLatitude(double latitude) {
        if (!Double.isFinite(latitude) || latitude <= -90 || latitude >= 90) {
            throw new InvalidCoordinateException("Latitude must be between -90 and 90 degrees (exclusive), but was " + latitude);
        }
    }

    private static void assertLongitude(double longitude) {
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidCoordinateException("Longitude must be between -180 and 180 degrees, but was " + longitude);
        }
    }
}
