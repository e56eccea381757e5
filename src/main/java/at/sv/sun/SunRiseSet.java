package at.sv.sun;

import at.sv.sun.time.ZoneUtcOffsetProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.function.Supplier;

@Command(name = "SunRiseSet", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the local time of sunrise and sunset for a location and date.")
public final class SunRiseSet implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SunRiseSet.class);

    enum Format {TEXT, JSON}

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The date to calculate sunrise and sunset for. Default: today")
    LocalDate date;
    @Option(names = "--utc-offset", paramLabel = "<hours>",
            description = "The offset from UTC in hours, e.g. -4 or 9.5. Default: the offset of --zone on the given date")
    Double utcOffset;
    @Option(names = "--zone", paramLabel = "<zone>",
            description = "The time zone ID used if no --utc-offset is given, e.g. Europe/Vienna. Default: the system time zone")
    ZoneId zone;
    @Option(names = "--dst",
            defaultValue = "false",
            description = "Adds one hour of daylight saving to --utc-offset. Ignored without --utc-offset. Default: ${DEFAULT-VALUE}")
    boolean daylightSaving;
    @Option(names = "--format",
            defaultValue = "TEXT",
            description = "The output format, one of ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    Format format;

    private final Supplier<ZonedDateTime> currentTime;

    public SunRiseSet() {
        this(ZonedDateTime::now);
    }

    SunRiseSet(Supplier<ZonedDateTime> currentTime) {
        this.currentTime = currentTime;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new SunRiseSet()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        assertConfigurationParameters();
        ZoneId effectiveZone = zone != null ? zone : ZoneId.systemDefault();
        SunriseSunsetCalculator calculator = new SunriseSunsetCalculator(new ZoneUtcOffsetProvider(effectiveZone),
                () -> currentTime.get().withZoneSameInstant(effectiveZone).toLocalDate());
        SunEventsReport report = createReport(calculator);
        LOG.debug("Calculated {}", report);
        PrintWriter out = spec.commandLine().getOut();
        out.println(render(report));
        out.flush();
    }

    SunEventsReport createReport(SunriseSunsetCalculator calculator) {
        LocalDate effectiveDate = date != null ? date : calculator.today();
        double offset;
        boolean dst;
        if (utcOffset != null) {
            offset = utcOffset;
            dst = daylightSaving;
        } else {
            offset = calculator.getUtcOffsetHours(effectiveDate);
            dst = false;
        }
        return new SunEventsReport(effectiveDate, dst ? offset + 1 : offset, latitude, longitude,
                calculator.sunriseAt(latitude, longitude, effectiveDate, offset, dst).orElse(null),
                calculator.sunsetAt(latitude, longitude, effectiveDate, offset, dst).orElse(null));
    }

    private String render(SunEventsReport report) {
        if (format == Format.JSON) {
            return toJson(report);
        }
        return report.toText();
    }

    private static String toJson(SunEventsReport report) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertTimeConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void assertTimeConfigurations() {
        if (utcOffset != null && (utcOffset < -18 || utcOffset > 18)) {
            fail("--utc-offset must be between -18 and 18 hours");
        }
        if (daylightSaving && utcOffset == null) {
            LOG.warn("--dst has no effect without --utc-offset, the offset of the time zone already includes it.");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
