package in.elpyfi.service.compliance;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar-week boundaries in the market time zone.
 *
 * The PDT window is approximated by the calendar week starting Monday 00:00,
 * not by five exact business days (no holidays, no intraday timestamps).
 */
public final class WeekWindow {

    /**
     * Monday 00:00 of the week containing the instant.
     */
    public static Instant weekStart(Instant now, ZoneId zone) {
        return now.atZone(zone)
            .toLocalDate()
            .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
            .atStartOfDay(zone)
            .toInstant();
    }

    /**
     * Monday 00:00 of the following week.
     */
    public static Instant nextWeekStart(Instant now, ZoneId zone) {
        ZonedDateTime start = weekStart(now, zone).atZone(zone);
        return start.plusWeeks(1).toInstant();
    }

    private WeekWindow() {}
}
