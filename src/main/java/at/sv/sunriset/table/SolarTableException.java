package at.sv.sunriset.table;

import java.time.LocalDate;

/**
 * Thrown if a date of the requested span has no complete solar result.
 */
public final class SolarTableException extends RuntimeException {

    private final LocalDate date;

    public SolarTableException(LocalDate date, Throwable cause) {
        super("Failed to compute solar data for " + date + ": " + cause.getMessage(), cause);
        this.date = date;
    }

    public LocalDate getDate() {
        return date;
    }
}
