package at.sv.tide.astro;

import java.time.ZonedDateTime;

/**
 * How the fraction of the day is derived from a zoned timestamp when computing the Julian date for the moon phase.
 * <p>
 * Which variant matches published moon phases is not confirmed yet.
 */
public enum DayFractionMode {
    /**
     * Uses the local wall clock corrected by the UTC offset, i.e. the Julian date refers to UT.
     */
    UTC_CORRECTED {
        @Override
        double dayFraction(ZonedDateTime dateTime) {
            return (clockHours(dateTime) - dateTime.getOffset().getTotalSeconds() / 3600.0) / 24.0;
        }
    },
    /**
     * Uses the local wall clock as is.
     */
    LOCAL_CLOCK {
        @Override
        double dayFraction(ZonedDateTime dateTime) {
            return clockHours(dateTime) / 24.0;
        }
    };

    abstract double dayFraction(ZonedDateTime dateTime);

    private static double clockHours(ZonedDateTime dateTime) {
        return dateTime.getHour() + dateTime.getMinute() / 60.0 + dateTime.getSecond() / 3600.0;
    }
}
