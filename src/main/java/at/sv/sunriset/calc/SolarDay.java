package at.sv.sunriset.calc;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Every intermediate quantity of the solar position pipeline for one date, in pipeline order. The position
 * angles (hour angle, zenith, elevation, refraction, azimuth) describe the sun at 12:00 local clock time.
 */
@Data
@Builder
public final class SolarDay {

    private final LocalDate date;
    private final double julianDay;
    private final double julianCentury;
    private final Degrees geometricMeanLongitude;
    private final Degrees geometricMeanAnomaly;
    private final double eccentricityOfEarthOrbit;
    private final Degrees equationOfCenter;
    private final Degrees trueLongitude;
    private final Degrees trueAnomaly;
    /**
     * Astronomical units.
     */
    private final double radiusVector;
    private final Degrees apparentLongitude;
    private final Degrees meanObliquityOfEcliptic;
    private final Degrees obliquityCorrection;
    private final Degrees rightAscension;
    private final Degrees declination;
    private final double varY;
    /**
     * Minutes.
     */
    private final double equationOfTime;
    private final Degrees hourAngleSunrise;
    private final double solarNoonFraction;
    private final double sunriseFraction;
    private final double sunsetFraction;
    private final Duration solarNoon;
    private final Duration sunrise;
    private final Duration sunset;
    private final double sunlightDurationMinutes;
    /**
     * Minutes, at local clock noon.
     */
    private final double trueSolarTime;
    private final Degrees hourAngle;
    private final Degrees solarZenithAngle;
    private final Degrees solarElevationAngle;
    private final Degrees approxAtmosphericRefraction;
    private final Degrees correctedElevation;
    private final Degrees solarAzimuth;

    public SolarEvents toSolarEvents() {
        return new SolarEvents(sunrise, sunset, solarNoon);
    }
}
