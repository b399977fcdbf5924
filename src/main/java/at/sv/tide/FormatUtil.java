package at.sv.tide;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class FormatUtil {

    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("hh:mm", Locale.ROOT);

    private FormatUtil() {
    }

    /**
     * Heights between 0 and 10 feet get two decimals, all others one, so the text keeps its width.
     */
    public static String formatTideHeight(double heightFeet) {
        int digits = heightFeet > 0 && heightFeet < 10 ? 2 : 1;
        return String.format(Locale.ROOT, "%." + digits + "f", heightFeet);
    }

    /**
     * Formats a fractional hour of the day on a 12 hour clock, e.g. {@code 6.5} as {@code 06:30 A}.
     */
    public static String formatHourOfDay(double hour) {
        int wholeHour = (int) hour;
        int displayHour = (wholeHour + 23) % 12 + 1;
        int minute = (int) ((hour - Math.floor(hour)) * 60);
        String amPm = hour >= 12 ? "P" : "A";
        return String.format(Locale.ROOT, "%02d:%02d %s", displayHour, minute, amPm);
    }

    /**
     * Formats a time on a 12 hour clock with a single letter meridiem, e.g. {@code 03:15 P}.
     */
    public static String formatClockTime(ZonedDateTime time) {
        return HOUR_MINUTE.format(time) + " " + (time.getHour() >= 12 ? "P" : "A");
    }
}
