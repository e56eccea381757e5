package at.sv.sun;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SunRiseSetTest {

    private ZonedDateTime now;
    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    private int execute(String... args) {
        return commandLine.execute(args);
    }

    @BeforeEach
    void setUp() {
        now = ZonedDateTime.of(2018, 12, 25, 12, 0, 0, 0, ZoneId.of("America/New_York"));
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new SunRiseSet(() -> now));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void text_explicitOffset() {
        int exitCode = execute("--lat", "40.72", "--long=-74.02", "--date", "2018-12-25", "--utc-offset=-5");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains(
                "Date: 2018-12-25",
                "UTC Offset: -5.0",
                "Coordinates: LAT 40.72 LONG -74.02",
                "Sunrise: 2018-12-25 07:18:24",
                "Sunset: 2018-12-25 16:34:06");
    }

    @Test
    void text_offsetOfZone_includingDaylightSaving() {
        int exitCode = execute("--lat", "40.72", "--long=-74.02", "--date", "2018-06-21", "--zone", "America/New_York");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("UTC Offset: -4.0", "Sunrise: 2018-06-21 05:25:01");
    }

    @Test
    void text_explicitOffsetWithDaylightSaving() {
        int exitCode = execute("--lat", "40.72", "--long=-74.02", "--date", "2018-06-21", "--utc-offset=-5", "--dst");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("UTC Offset: -4.0", "Sunrise: 2018-06-21 05:25:01");
    }

    @Test
    void text_withoutDate_usesTodayOfZone() {
        int exitCode = execute("--lat", "40.72", "--long=-74.02", "--zone", "America/New_York");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Date: 2018-12-25", "Sunrise: 2018-12-25 07:18:24");
    }

    @Test
    void text_todayDependsOnZone() {
        now = ZonedDateTime.of(2018, 12, 25, 23, 0, 0, 0, ZoneId.of("America/New_York"));

        int exitCode = execute("--lat=-12.46", "--long", "130.842", "--zone", "Australia/Darwin");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Date: 2018-12-26", "UTC Offset: 9.5");
    }

    @Test
    void text_midnightSun_none() {
        int exitCode = execute("--lat", "68.96", "--long", "32.95", "--date", "2018-06-21", "--utc-offset", "3");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Sunrise: none", "Sunset: none");
    }

    @Test
    void json() throws Exception {
        int exitCode = execute("--lat", "40.72", "--long=-74.02", "--date", "2018-12-25", "--utc-offset=-5",
                "--format", "JSON");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.get("date").asText()).isEqualTo("2018-12-25");
        assertThat(json.get("utcOffset").asDouble()).isEqualTo(-5.0);
        assertThat(json.get("latitude").asDouble()).isEqualTo(40.72);
        assertThat(json.get("longitude").asDouble()).isEqualTo(-74.02);
        assertThat(json.get("sunrise").asText()).isEqualTo("2018-12-25T07:18:24");
        assertThat(json.get("sunset").asText()).isEqualTo("2018-12-25T16:34:06");
    }

    @Test
    void json_midnightSun_null() throws Exception {
        int exitCode = execute("--lat", "68.96", "--long", "32.95", "--date", "2018-06-21", "--utc-offset", "3",
                "--format", "JSON");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.get("sunrise").isNull()).isTrue();
        assertThat(json.get("sunset").isNull()).isTrue();
    }

    @Test
    void invalidLatitude_usageError() {
        int exitCode = execute("--lat", "91", "--long", "0", "--date", "2018-06-21");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--lat must be between -90 and 90 degrees");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void invalidLongitude_usageError() {
        int exitCode = execute("--lat", "0", "--long", "181", "--date", "2018-06-21");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--long must be between -180 and 180 degrees");
    }

    @Test
    void invalidUtcOffset_usageError() {
        int exitCode = execute("--lat", "0", "--long", "0", "--utc-offset", "19");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--utc-offset must be between -18 and 18 hours");
    }

    @Test
    void invalidDate_usageError() {
        int exitCode = execute("--lat", "0", "--long", "0", "--date", "2018-02-30");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void withoutCommandLine_invalidLatitude_illegalArgument() {
        SunRiseSet command = new SunRiseSet(() -> now);
        command.latitude = -91;

        assertThatThrownBy(command::run)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--lat");
    }
}
