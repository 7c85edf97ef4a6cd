package at.sv.sunriset.table;

import at.sv.sunriset.FormatUtil;
import at.sv.sunriset.calc.Degrees;
import at.sv.sunriset.calc.SolarDay;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * The fixed columns of a solar table, in pipeline order. Headers are kept identical to the published
 * reference tables, spelling included, so existing consumers keep working.
 */
public enum SolarColumn {
    JULIAN_DAY("Julian Day", SolarDay::getJulianDay),
    JULIAN_CENTURY("Julian Century", SolarDay::getJulianCentury),
    GEOMETRIC_MEAN_LONGITUDE("Solar Geometric Mean Longitude", SolarDay::getGeometricMeanLongitude),
    GEOMETRIC_MEAN_ANOMALY("Solar Geometric Mean Anomaly", SolarDay::getGeometricMeanAnomaly),
    ECCENTRICITY_EARTH_ORBIT("Eccentricity Earth Orbit", SolarDay::getEccentricityOfEarthOrbit),
    EQUATION_OF_CENTER("Solar Equation of Center", SolarDay::getEquationOfCenter),
    TRUE_LONGITUDE("Solar True Longitude", SolarDay::getTrueLongitude),
    TRUE_ANOMALY("Solar True Anomaly", SolarDay::getTrueAnomaly),
    RADIUS_VECTOR("Solar Radius Vector AUs", SolarDay::getRadiusVector),
    APPARENT_LONGITUDE("Solar Apparent Longitude", SolarDay::getApparentLongitude),
    MEAN_OBLIQUITY_OF_ECLIPTIC("Mean Obliquity of Ecliptic", SolarDay::getMeanObliquityOfEcliptic),
    OBLIQUITY_CORRECTION("Obliquity Correction Degrees", SolarDay::getObliquityCorrection),
    RIGHT_ASCENSION("Solar Accent Return", SolarDay::getRightAscension),
    DECLINATION("Solar Decline", SolarDay::getDeclination),
    VAR_Y("Var Y", SolarDay::getVarY),
    EQUATION_OF_TIME("Equation Of Time Min", SolarDay::getEquationOfTime),
    HOUR_ANGLE_SUNRISE("Hour Angle Sunrise", SolarDay::getHourAngleSunrise),
    SOLAR_NOON_FRACTION("Solar Noon (float)", SolarDay::getSolarNoonFraction),
    SUNRISE_FRACTION("Sunrise (float)", SolarDay::getSunriseFraction),
    SUNSET_FRACTION("Sunset (float)", SolarDay::getSunsetFraction),
    SOLAR_NOON("Solar Noon", SolarDay::getSolarNoon),
    SUNRISE("Sunrise", SolarDay::getSunrise),
    SUNSET("Sunset", SolarDay::getSunset),
    SUNLIGHT_DURATION("Sunlight Durration (minutes)", SolarDay::getSunlightDurationMinutes),
    TRUE_SOLAR_TIME("Ture Solar Time", SolarDay::getTrueSolarTime),
    HOUR_ANGLE("Hour Angle Deg", SolarDay::getHourAngle),
    SOLAR_ZENITH_ANGLE("Solar Zenith Angle (degrees)", SolarDay::getSolarZenithAngle),
    SOLAR_ELEVATION_ANGLE("Solar Elevation Angle (degrees)", SolarDay::getSolarElevationAngle),
    APPROX_ATMOSPHERIC_REFRACTION("Approximate Atmospheric Refraction (degrees)", SolarDay::getApproxAtmosphericRefraction),
    CORRECTED_ELEVATION("Solar Elevation Corrected ATM Refraction (degrees)", SolarDay::getCorrectedElevation),
    SOLAR_AZIMUTH("Solar Azimuth Angle (degrees cw from North)", SolarDay::getSolarAzimuth);

    /**
     * Header of the leading key column, not part of the computed values.
     */
    public static final String DATE_HEADER = "Date";

    private final String header;
    private final Function<SolarDay, Object> accessor;

    SolarColumn(String header, Function<SolarDay, Object> accessor) {
        this.header = header;
        this.accessor = accessor;
    }

    public String getHeader() {
        return header;
    }

    /**
     * @return the cell value: a {@link Double} for numbers and angles, a formatted string for clock times
     */
    public Object valueOf(SolarDay day) {
        Object value = accessor.apply(day);
        if (value instanceof Degrees degrees) {
            return degrees.value();
        }
        if (value instanceof Duration duration) {
            return FormatUtil.formatDuration(duration);
        }
        return value;
    }

    /**
     * @return the cells of one table row keyed by header, starting with the date
     */
    public static Map<String, Object> toRow(SolarDay day) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(DATE_HEADER, day.getDate().toString());
        for (SolarColumn column : values()) {
            row.put(column.header, column.valueOf(day));
        }
        return row;
    }
}
