package at.sv.sunriset;

import at.sv.sunriset.calc.InvalidCoordinateException;
import at.sv.sunriset.calc.Location;
import at.sv.sunriset.calc.SolarDomainException;
import at.sv.sunriset.calc.SolarPipeline;
import at.sv.sunriset.calc.SolarPipelineImpl;
import at.sv.sunriset.table.OutputFormat;
import at.sv.sunriset.table.SolarTable;
import at.sv.sunriset.table.SolarTableBuilder;
import at.sv.sunriset.table.SolarTableException;
import at.sv.sunriset.table.SolarTableWriter;
import at.sv.sunriset.time.SunTimesProvider;
import at.sv.sunriset.time.SunTimesProviderImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.concurrent.Callable;

@Command(name = "sunriset", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Generates a table of solar position data (sunrise, solar noon, sunset, solar angles) " +
                      "for every day of the requested span.")
public final class Sunriset implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(Sunriset.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees (-90..90), exclusive at the poles.")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180], positive east of Greenwich.")
    double longitude;
    @Option(names = "--utc-offset", paramLabel = "<hours>",
            defaultValue = "${env:UTC_OFFSET:-0}",
            description = "The fixed offset of your local clock to UTC in hours, e.g. -8 for PST. " +
                          "Daylight saving time is not applied. Default: ${DEFAULT-VALUE}")
    double utcOffsetHours;
    @Option(names = "--dst-adjustment", paramLabel = "<days>",
            defaultValue = "${env:DST_ADJUSTMENT:-0}",
            description = "An additional fraction of a day added to sunrise, noon and sunset, " +
                          "e.g. 0.0416667 for one hour. Default: ${DEFAULT-VALUE}")
    double dstAdjustment;
    @Option(names = "--start-date", paramLabel = "<yyyy-MM-dd>",
            defaultValue = "${env:START_DATE}",
            description = "The first date of the table. Default: today")
    LocalDate startDate;
    @Option(names = "--years",
            defaultValue = "${env:YEARS:-1}",
            description = "The number of years to generate, starting at the start date. Default: ${DEFAULT-VALUE}")
    int numberOfYears;
    @Option(names = "--days",
            description = "The number of days to generate. Overrides --years if set.")
    Integer numberOfDays;
    @Option(names = "--format",
            defaultValue = "${env:OUTPUT_FORMAT:-CSV}",
            description = "The output format: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    OutputFormat format;
    @Option(names = "--output", paramLabel = "<file>",
            description = "The file to write the table to. Default: standard output")
    Path output;
    @Option(names = "--skip-undefined-days",
            defaultValue = "${env:SKIP_UNDEFINED_DAYS:-false}",
            description = "Leave out days without sunrise or sunset (polar day or night) instead of failing." +
                          " Default: ${DEFAULT-VALUE}")
    boolean skipUndefinedDays;

    private final SolarPipeline pipeline;
    private final Writer standardOutput;

    public Sunriset() {
        this(new SolarPipelineImpl(), new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    public Sunriset(SolarPipeline pipeline, Writer standardOutput) {
        this.pipeline = pipeline;
        this.standardOutput = standardOutput;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new Sunriset()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    /**
     * The main entry point for the command line. Validates the configuration, builds the table and writes
     * it to the configured output.
     */
    @Override
    public Integer call() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        Location location = createLocation();
        LocalDate start = startDate != null ? startDate : LocalDate.now();
        logSolarTimes(location, start);

        MDC.put("context", "table");
        SolarTable table;
        try {
            table = createTableBuilder(location).build(start, getEndDate(start));
        } catch (SolarTableException e) {
            LOG.error("{}. Use --skip-undefined-days to leave out such days.", e.getLocalizedMessage());
            return 1;
        }
        write(table);
        LOG.info("Wrote {} rows as {}{}.", table.size(), format, output != null ? " to '" + output + "'" : "");
        if (!table.getSkippedDates().isEmpty()) {
            LOG.warn("Skipped {} days without sunrise or sunset.", table.getSkippedDates().size());
        }
        return 0;
    }

    private Location createLocation() {
        try {
            return Location.of(latitude, longitude);
        } catch (InvalidCoordinateException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private SolarTableBuilder createTableBuilder(Location location) {
        return new SolarTableBuilder(pipeline, location, utcOffsetHours, dstAdjustment, skipUndefinedDays);
    }

    private LocalDate getEndDate(LocalDate start) {
        if (numberOfDays != null) {
            return start.plusDays(numberOfDays);
        }
        return start.plusYears(numberOfYears);
    }

    private void logSolarTimes(Location location, LocalDate date) {
        SunTimesProvider sunTimesProvider = new SunTimesProviderImpl(pipeline, location, utcOffsetHours, dstAdjustment);
        try {
            LOG.info("Solar times for {} on {}:\n{}", location, date, sunTimesProvider.toDebugString(date));
        } catch (SolarDomainException e) {
            LOG.info("No solar times for {} on {}: {}", location, date, e.getLocalizedMessage());
        }
    }

    private void write(SolarTable table) {
        SolarTableWriter tableWriter = SolarTableWriter.forFormat(format);
        try {
            if (output == null) {
                tableWriter.write(table, standardOutput);
                return;
            }
            try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                tableWriter.write(table, writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write table", e);
        }
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertTimeConfigurations();
        assertSpanConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (!(latitude > -90 && latitude < 90)) {
            fail("--lat must be between -90 and 90 degrees (exclusive)");
        }
        if (!(longitude >= -180 && longitude <= 180)) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void assertTimeConfigurations() {
        if (!Double.isFinite(utcOffsetHours) || utcOffsetHours < -24 || utcOffsetHours > 24) {
            fail("--utc-offset must be between -24 and 24 hours");
        }
        if (!Double.isFinite(dstAdjustment)) {
            fail("--dst-adjustment must be a finite number");
        }
    }

    private void assertSpanConfigurations() {
        if (numberOfYears < 1) {
            fail("--years must be >= 1");
        }
        if (numberOfDays != null && numberOfDays < 1) {
            fail("--days must be >= 1");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
