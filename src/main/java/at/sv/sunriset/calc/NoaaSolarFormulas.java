package at.sv.sunriset.calc;

import static at.sv.sunriset.calc.JulianTime.MINUTES_PER_DAY;

/**
 * The stage formulas of the NOAA solar position algorithm.
 * See: <a href="https://gml.noaa.gov/grad/solcalc/calcdetails.html">NOAA Solar Calculation Details</a>
 * <p>
 * Every method is a pure function of its arguments. {@code century} always refers to the value of
 * {@link JulianTime#julianCentury(double)}.
 */
public final class NoaaSolarFormulas {

    /**
     * Zenith of the sun at the apparent sunrise and sunset: 90° plus refraction and the solar disk radius.
     */
    static final Degrees SUNRISE_ZENITH = Degrees.of(90.833);

    /**
     * How far a cosine computed from rounded terms may overshoot [-1, 1] and still count as ±1.
     */
    private static final double ROUNDING_TOLERANCE = 1e-9;

    private NoaaSolarFormulas() {
    }

    public static Degrees geometricMeanLongitude(double century) {
        return Degrees.of(floorMod(280.46646 + century * (36000.76983 + century * 0.0003032), 360));
    }

    public static Degrees geometricMeanAnomaly(double century) {
        return Degrees.of(357.52911 + century * (35999.05029 - 0.0001537 * century));
    }

    public static double eccentricityOfEarthOrbit(double century) {
        return 0.016708634 - century * (0.000042037 + 0.0000001267 * century);
    }

    public static Degrees equationOfCenter(double century, Degrees meanAnomaly) {
        return Degrees.of(meanAnomaly.sin() * (1.914602 - century * (0.004817 + 0.000014 * century))
                          + meanAnomaly.times(2).sin() * (0.019993 - 0.000101 * century)
                          + meanAnomaly.times(3).sin() * 0.000289);
    }

    public static Degrees trueLongitude(Degrees meanLongitude, Degrees equationOfCenter) {
        return meanLongitude.plus(equationOfCenter);
    }

    public static Degrees trueAnomaly(Degrees meanAnomaly, Degrees equationOfCenter) {
        return meanAnomaly.plus(equationOfCenter);
    }

    /**
     * @return the distance between earth and sun in astronomical units
     */
    public static double radiusVector(double eccentricity, Degrees trueAnomaly) {
        return (1.000001018 * (1 - eccentricity * eccentricity)) / (1 + eccentricity * trueAnomaly.cos());
    }

    public static Degrees apparentLongitude(Degrees trueLongitude, double century) {
        return Degrees.of(trueLongitude.value() - 0.00569 - 0.00478 * nutationNode(century).sin());
    }

    public static Degrees meanObliquityOfEcliptic(double century) {
        double seconds = 21.448 - century * (46.815 + century * (0.00059 - century * 0.001813));
        return Degrees.of(23 + (26 + seconds / 60) / 60);
    }

    public static Degrees obliquityCorrection(Degrees meanObliquity, double century) {
        return Degrees.of(meanObliquity.value() + 0.00256 * nutationNode(century).cos());
    }

    /**
     * Keeps the argument order of the published reference tables (x and y of {@code atan2} are
     * swapped compared to the textbook right ascension), so the values match those tables.
     */
    public static Degrees rightAscension(Degrees apparentLongitude, Degrees obliquity) {
        return Radians.atan2(apparentLongitude.cos(), obliquity.cos() * apparentLongitude.sin()).toDegrees();
    }

    public static Degrees declination(Degrees obliquity, Degrees apparentLongitude) {
        return Radians.asin(obliquity.sin() * apparentLongitude.sin()).toDegrees();
    }

    public static double varY(Degrees obliquity) {
        double tan = Degrees.of(obliquity.value() / 2).tan();
        return tan * tan;
    }

    /**
     * @return the equation of time in minutes
     */
    public static double equationOfTime(double varY, Degrees meanLongitude, double eccentricity, Degrees meanAnomaly) {
        double l0 = meanLongitude.toRadians().value();
        double m = meanAnomaly.toRadians().value();
        double result = varY * Math.sin(2 * l0)
                        - 2 * eccentricity * Math.sin(m)
                        + 4 * eccentricity * varY * Math.sin(m) * Math.cos(2 * l0)
                        - 0.5 * varY * varY * Math.sin(4 * l0)
                        - 1.25 * eccentricity * eccentricity * Math.sin(2 * m);
        return 4 * new Radians(result).toDegrees().value();
    }

    /**
     * @throws NoSunriseSunsetException if the sun stays above or below the horizon for the whole day
     */
    public static Degrees hourAngleSunrise(Degrees latitude, Degrees declination) {
        double argument = SUNRISE_ZENITH.cos() / (latitude.cos() * declination.cos())
                          - latitude.tan() * declination.tan();
        if (!Double.isFinite(argument)) {
            throw new NoSunriseSunsetException(PolarCondition.UNDETERMINED, latitude, declination, argument);
        }
        if (argument > 1) {
            throw new NoSunriseSunsetException(PolarCondition.POLAR_NIGHT, latitude, declination, argument);
        }
        if (argument < -1) {
            throw new NoSunriseSunsetException(PolarCondition.POLAR_DAY, latitude, declination, argument);
        }
        return Radians.acos(argument).toDegrees();
    }

    /**
     * @return solar noon as a fraction of the local day
     */
    public static double solarNoonFraction(double equationOfTime, Degrees longitude, double utcOffsetHours) {
        return (720 - 4 * longitude.value() - equationOfTime + utcOffsetHours * 60) / MINUTES_PER_DAY;
    }

    public static double sunriseFraction(double solarNoonFraction, Degrees hourAngleSunrise) {
        return (solarNoonFraction * MINUTES_PER_DAY - hourAngleSunrise.value() * 4) / MINUTES_PER_DAY;
    }

    public static double sunsetFraction(double solarNoonFraction, Degrees hourAngleSunrise) {
        return (solarNoonFraction * MINUTES_PER_DAY + hourAngleSunrise.value() * 4) / MINUTES_PER_DAY;
    }

    /**
     * Four minutes per degree of hour angle, for both halves of the day. Equals the distance between
     * {@link #sunriseFraction} and {@link #sunsetFraction} expressed in minutes.
     */
    public static double sunlightDurationMinutes(Degrees hourAngleSunrise) {
        return 8 * hourAngleSunrise.value();
    }

    /**
     * @return the true solar time at 12:00 local clock time in minutes, within [0, 1440)
     */
    public static double trueSolarTimeMinutes(double equationOfTime, Degrees longitude, double utcOffsetHours) {
        return floorMod(0.5 * MINUTES_PER_DAY + equationOfTime + 4 * longitude.value() - 60 * utcOffsetHours,
                MINUTES_PER_DAY);
    }

    public static Degrees hourAngle(double trueSolarTimeMinutes) {
        if (trueSolarTimeMinutes < 0) {
            return Degrees.of(trueSolarTimeMinutes / 4 + 180);
        }
        return Degrees.of(trueSolarTimeMinutes / 4 - 180);
    }

    /**
     * @throws SolarDomainException if an input is not a finite number
     */
    public static Degrees solarZenithAngle(Degrees latitude, Degrees declination, Degrees hourAngle) {
        double argument = latitude.sin() * declination.sin()
                          + latitude.cos() * declination.cos() * hourAngle.cos();
        if (!Double.isFinite(argument)) {
            throw new SolarDomainException("Solar zenith angle is undefined at latitude " + latitude +
                                           " with declination " + declination + " and hour angle " + hourAngle, argument);
        }
        return Radians.acos(clampToUnit(argument)).toDegrees();
    }

    public static Degrees solarElevationAngle(Degrees zenith) {
        return Degrees.of(90 - zenith.value());
    }

    /**
     * Approximates the atmospheric refraction for the given (geometric) elevation. Coefficients are in
     * arc seconds.
     */
    public static Degrees approxAtmosphericRefraction(Degrees elevation) {
        double e = elevation.value();
        double arcSeconds;
        if (e > 85) {
            arcSeconds = 0;
        } else if (e > 5) {
            double tan = elevation.tan();
            arcSeconds = 58.1 / tan - 0.07 / Math.pow(tan, 3) + 0.000086 / Math.pow(tan, 5);
        } else if (e > -0.575) {
            arcSeconds = 1735 + e * (-518.2 + e * (103.4 + e * (-12.79 + e * 0.711)));
        } else {
            arcSeconds = -20.772 / elevation.tan();
        }
        return Degrees.of(arcSeconds / 3600);
    }

    public static Degrees correctedElevation(Degrees refraction, Degrees elevation) {
        return refraction.plus(elevation);
    }

    /**
     * @return the azimuth in degrees clockwise from north, within [0, 360)
     * @throws UndefinedAzimuthException if the sun is exactly at the zenith or nadir
     */
    public static Degrees solarAzimuth(Degrees hourAngle, Degrees latitude, Degrees zenith, Degrees declination) {
        double argument = ((latitude.sin() * zenith.cos()) - declination.sin()) / (latitude.cos() * zenith.sin());
        if (Math.abs(zenith.sin()) < ROUNDING_TOLERANCE || !Double.isFinite(argument)
            || Math.abs(argument) > 1 + ROUNDING_TOLERANCE) {
            throw new UndefinedAzimuthException(zenith, argument);
        }
        double angle = Radians.acos(clampToUnit(argument)).toDegrees().value();
        if (hourAngle.value() > 0) {
            return Degrees.of(floorMod(angle + 180, 360));
        }
        return Degrees.of(floorMod(540 - angle, 360));
    }

    // the sun on the meridian or straight overhead yields 1.0000000000000002 and the like
    private static double clampToUnit(double cosine) {
        return Math.max(-1, Math.min(1, cosine));
    }

    private static Degrees nutationNode(double century) {
        return Degrees.of(125.04 - 1934.136 * century);
    }

    /**
     * Remainder with the sign of the divisor.
     */
    static double floorMod(double value, double divisor) {
        double mod = value % divisor;
        if (mod != 0 && (mod < 0) != (divisor < 0)) {
            mod += divisor;
        }
        return mod;
    }
}
