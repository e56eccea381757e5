package at.sv.sun.time;

import java.time.LocalDate;

public interface UtcOffsetProvider {

    /**
     * @param date the local date the offset is needed for
     * @return the offset from UTC in hours, including daylight saving if in effect on that date
     */
    double getUtcOffsetHours(LocalDate date);
}
