package at.sv.sunriset.calc;

import java.time.Duration;

/**
 * Sunrise, sunset and solar noon as durations since local midnight. Values may be negative or exceed
 * one day near the date line or at high latitudes.
 */
public record SolarEvents(Duration sunrise, Duration sunset, Duration solarNoon) {

    public Duration dayLength() {
        return sunset.minus(sunrise);
    }
}
