package at.sv.sunriset.calc;

import java.time.Duration;
import java.time.LocalDate;

import static at.sv.sunriset.calc.NoaaSolarFormulas.*;

public final class SolarPipelineImpl implements SolarPipeline {

    @Override
    public SolarEvents computeSolarEvents(LocalDate date, Location location, double utcOffsetHours, double dstAdjustment) {
        assertFinite(utcOffsetHours, dstAdjustment);
        double julianDay = JulianTime.julianDay(date, utcOffsetHours);
        double century = JulianTime.julianCentury(julianDay);
        Degrees meanLongitude = geometricMeanLongitude(century);
        Degrees meanAnomaly = geometricMeanAnomaly(century);
        double eccentricity = eccentricityOfEarthOrbit(century);
        Degrees center = equationOfCenter(century, meanAnomaly);
        Degrees apparentLongitude = apparentLongitude(trueLongitude(meanLongitude, center), century);
        Degrees obliquity = obliquityCorrection(meanObliquityOfEcliptic(century), century);
        Degrees declination = declination(obliquity, apparentLongitude);
        double equationOfTime = equationOfTime(varY(obliquity), meanLongitude, eccentricity, meanAnomaly);
        Degrees hourAngleSunrise = hourAngleSunrise(location.latitude(), declination);
        double noon = solarNoonFraction(equationOfTime, location.longitude(), utcOffsetHours);
        return new SolarEvents(
                toDuration(sunriseFraction(noon, hourAngleSunrise), date, dstAdjustment),
                toDuration(sunsetFraction(noon, hourAngleSunrise), date, dstAdjustment),
                toDuration(noon, date, dstAdjustment));
    }

    @Override
    public SolarDay computeSolarDay(LocalDate date, Location location, double utcOffsetHours, double dstAdjustment) {
        assertFinite(utcOffsetHours, dstAdjustment);
        Degrees latitude = location.latitude();
        Degrees longitude = location.longitude();

        double julianDay = JulianTime.julianDay(date, utcOffsetHours);
        double century = JulianTime.julianCentury(julianDay);
        Degrees meanLongitude = geometricMeanLongitude(century);
        Degrees meanAnomaly = geometricMeanAnomaly(century);
        double eccentricity = eccentricityOfEarthOrbit(century);
        Degrees center = equationOfCenter(century, meanAnomaly);
        Degrees trueLongitude = trueLongitude(meanLongitude, center);
        Degrees trueAnomaly = trueAnomaly(meanAnomaly, center);
        Degrees apparentLongitude = apparentLongitude(trueLongitude, century);
        Degrees meanObliquity = meanObliquityOfEcliptic(century);
        Degrees obliquity = obliquityCorrection(meanObliquity, century);
        Degrees declination = declination(obliquity, apparentLongitude);
        double varY = varY(obliquity);
        double equationOfTime = equationOfTime(varY, meanLongitude, eccentricity, meanAnomaly);
        Degrees hourAngleSunrise = hourAngleSunrise(latitude, declination);
        double noon = solarNoonFraction(equationOfTime, longitude, utcOffsetHours);
        double sunrise = sunriseFraction(noon, hourAngleSunrise);
        double sunset = sunsetFraction(noon, hourAngleSunrise);
        double trueSolarTime = trueSolarTimeMinutes(equationOfTime, longitude, utcOffsetHours);
        Degrees hourAngle = hourAngle(trueSolarTime);
        Degrees zenith = solarZenithAngle(latitude, declination, hourAngle);
        Degrees elevation = solarElevationAngle(zenith);
        Degrees refraction = approxAtmosphericRefraction(elevation);

        return SolarDay.builder()
                       .date(date)
                       .julianDay(julianDay)
                       .julianCentury(century)
                       .geometricMeanLongitude(meanLongitude)
                       .geometricMeanAnomaly(meanAnomaly)
                       .eccentricityOfEarthOrbit(eccentricity)
                       .equationOfCenter(center)
                       .trueLongitude(trueLongitude)
                       .trueAnomaly(trueAnomaly)
                       .radiusVector(radiusVector(eccentricity, trueAnomaly))
                       .apparentLongitude(apparentLongitude)
                       .meanObliquityOfEcliptic(meanObliquity)
                       .obliquityCorrection(obliquity)
                       .rightAscension(rightAscension(apparentLongitude, obliquity))
                       .declination(declination)
                       .varY(varY)
                       .equationOfTime(equationOfTime)
                       .hourAngleSunrise(hourAngleSunrise)
                       .solarNoonFraction(noon)
                       .sunriseFraction(sunrise)
                       .sunsetFraction(sunset)
                       .solarNoon(toDuration(noon, date, dstAdjustment))
                       .sunrise(toDuration(sunrise, date, dstAdjustment))
                       .sunset(toDuration(sunset, date, dstAdjustment))
                       .sunlightDurationMinutes(sunlightDurationMinutes(hourAngleSunrise))
                       .trueSolarTime(trueSolarTime)
                       .hourAngle(hourAngle)
                       .solarZenithAngle(zenith)
                       .solarElevationAngle(elevation)
                       .approxAtmosphericRefraction(refraction)
                       .correctedElevation(correctedElevation(refraction, elevation))
                       .solarAzimuth(solarAzimuth(hourAngle, latitude, zenith, declination))
                       .build();
    }

    private static Duration toDuration(double fraction, LocalDate date, double dstAdjustment) {
        return JulianTime.toDuration(fraction, date, dstAdjustment);
    }

    private static void assertFinite(double utcOffsetHours, double dstAdjustment) {
        if (!Double.isFinite(utcOffsetHours)) {
            throw new InvalidCoordinateException("UTC offset must be a finite number of hours, but was " + utcOffsetHours);
        }
        if (!Double.isFinite(dstAdjustment)) {
            throw new InvalidCoordinateException("DST adjustment must be a finite fraction of a day, but was " + dstAdjustment);
        }
    }
}
