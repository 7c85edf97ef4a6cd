package at.sv.sunriset;

import java.time.Duration;
import java.util.Locale;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * Formats the given duration as {@code [-]H:MM:SS[.ffffff]}. Hours are not wrapped at 24, and the
     * fraction is only printed if the duration has a sub-second part.
     */
    public static String formatDuration(Duration duration) {
        String sign = duration.isNegative() ? "-" : "";
        Duration abs = duration.abs();
        long hours = abs.toHours();
        int minutes = abs.toMinutesPart();
        int seconds = abs.toSecondsPart();
        long micros = abs.getNano() / 1_000L;
        if (abs.getNano() == 0) {
            return String.format(Locale.ROOT, "%s%d:%02d:%02d", sign, hours, minutes, seconds);
        }
        return String.format(Locale.ROOT, "%s%d:%02d:%02d.%06d", sign, hours, minutes, seconds, micros);
    }
}
