package at.sv.sunriset.time;

import at.sv.sunriset.FormatUtil;
import at.sv.sunriset.calc.Location;
import at.sv.sunriset.calc.SolarEvents;
import at.sv.sunriset.calc.SolarPipeline;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final SolarPipeline pipeline;
    private final Location location;
    private final double utcOffsetHours;
    private final double dstAdjustment;

    private final Map<LocalDate, SolarEvents> cache;

    public SunTimesProviderImpl(SolarPipeline pipeline, Location location, double utcOffsetHours, double dstAdjustment) {
        this.pipeline = pipeline;
        this.location = location;
        this.utcOffsetHours = utcOffsetHours;
        this.dstAdjustment = dstAdjustment;
        cache = new ConcurrentHashMap<>();
    }

    @Override
    public LocalDateTime getSunrise(LocalDate date) {
        return atDate(date, eventsFor(date).sunrise());
    }

    @Override
    public LocalDateTime getNoon(LocalDate date) {
        return atDate(date, eventsFor(date).solarNoon());
    }

    @Override
    public LocalDateTime getSunset(LocalDate date) {
        return atDate(date, eventsFor(date).sunset());
    }

    private SolarEvents eventsFor(LocalDate date) {
        return cache.computeIfAbsent(date, d -> pipeline.computeSolarEvents(d, location, utcOffsetHours, dstAdjustment));
    }

    private static LocalDateTime atDate(LocalDate date, Duration sinceMidnight) {
        return date.atStartOfDay().plus(sinceMidnight);
    }

    @Override
    public String toDebugString(LocalDate date) {
        return "sunrise: " + format(date, getSunrise(date)) +
               "\nnoon: " + format(date, getNoon(date)) +
               "\nsunset: " + format(date, getSunset(date)) +
               "\nday_length: " + FormatUtil.formatDuration(eventsFor(date).dayLength().withNanos(0));
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    private static String format(LocalDate date, LocalDateTime time) {
        String formatted = TIME_FORMATTER.format(time);
        if (time.toLocalDate().equals(date)) {
            return formatted;
        }
        return formatted + " (" + time.toLocalDate() + ")";
    }
}
