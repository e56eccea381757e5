package at.sv.sun;

import com.fasterxml.jackson.annotation.JsonFormat;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Sunrise and sunset of one date at one location, as printed by {@link SunRiseSet}.
 */
public record SunEventsReport(
        LocalDate date,
        double utcOffset,
        double latitude,
        double longitude,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
        @Nullable LocalDateTime sunrise,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
        @Nullable LocalDateTime sunset) {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public String toText() {
        return "Date: " + date +
               "\nUTC Offset: " + utcOffset +
               "\nCoordinates: LAT " + latitude + " LONG " + longitude +
               "\nSunrise: " + format(sunrise) +
               "\nSunset: " + format(sunset);
    }

    private static String format(@Nullable LocalDateTime time) {
        if (time == null) {
            return "none";
        }
        return TIME_FORMATTER.format(time);
    }
}
