package at.sv.sunriset.time;

import java.time.LocalDate;
import java.time.LocalDateTime;

public interface SunTimesProvider {

    /**
     * @param date the local date to resolve the sunrise for
     * @return the local date-time of the sunrise, may fall on the previous day for extreme offsets
     * @throws at.sv.sunriset.calc.NoSunriseSunsetException if the sun does not rise on that date
     */
    LocalDateTime getSunrise(LocalDate date);

    LocalDateTime getNoon(LocalDate date);

    LocalDateTime getSunset(LocalDate date);

    /**
     * @return the sunrise, noon, sunset and day length of the given date, one per line
     */
    String toDebugString(LocalDate date);

    void clearCache();
}
