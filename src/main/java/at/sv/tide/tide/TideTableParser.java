package at.sv.tide.tide;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses annual tide prediction tables as exported by NOAA (text format, GMT, 24 hour or 12 hour clock).
 * <p>
 * After a fixed number of header lines, each row has the columns
 * {@code date dayName time [AM|PM] heightFeet ... highLowFlag}, separated by spaces or tabs. The date is either
 * {@code MM/DD/YYYY} or {@code YYYY/MM/DD}. A flag containing {@code H} marks a high tide.
 */
@Slf4j
public final class TideTableParser {

    private static final String SEPARATORS = "[ \\t]+";

    private final int headerLines;

    public TideTableParser(int headerLines) {
        if (headerLines < 0) {
            throw new IllegalArgumentException("headerLines must be >= 0");
        }
        this.headerLines = headerLines;
    }

    /**
     * Reads all rows of the given reader. Fails on the first invalid row without returning partial results.
     *
     * @throws TideTableParseException if a row can't be parsed or rows are not in chronological order
     * @throws IOException             if reading fails
     */
    public TideTable parse(String stationId, int year, String resourceName, BufferedReader reader) throws IOException {
        List<TideEvent> events = new ArrayList<>();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (lineNumber <= headerLines) {
                logHeaderLine(resourceName, lineNumber, line);
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            TideEvent event = parseRow(resourceName, lineNumber, line);
            if (!events.isEmpty() && event.timestamp().isBefore(events.get(events.size() - 1).timestamp())) {
                throw new TideTableParseException(resourceName, lineNumber, line, "not in chronological order");
            }
            events.add(event);
        }
        log.trace("Parsed {} tide events from '{}'", events.size(), resourceName);
        return TideTable.of(stationId, List.of(year), events);
    }

    private static void logHeaderLine(String resourceName, int lineNumber, String line) {
        if ((lineNumber == 4 || lineNumber == 5) && !line.isBlank()) {
            log.debug("{}: {}", resourceName, line.trim());
        }
    }

    TideEvent parseRow(String resourceName, int lineNumber, String line) {
        String[] tokens = line.trim().split(SEPARATORS);
        try {
            if (tokens.length < 5) {
                throw new TideTableParseException(resourceName, lineNumber, line,
                        "expected at least 5 columns but got " + tokens.length);
            }
            LocalDate date = parseDate(tokens[0]);
            int heightIndex = 3;
            String meridiem = null;
            if (isMeridiem(tokens[3])) {
                meridiem = tokens[3].toUpperCase(Locale.ROOT);
                heightIndex = 4;
            }
            if (tokens.length <= heightIndex + 1) {
                throw new TideTableParseException(resourceName, lineNumber, line, "missing high/low column");
            }
            LocalTime time = parseTime(tokens[2], meridiem);
            double height = Double.parseDouble(tokens[heightIndex]);
            boolean highTide = tokens[tokens.length - 1].contains("H");
            return new TideEvent(date.atTime(time).toInstant(ZoneOffset.UTC), height, highTide);
        } catch (NumberFormatException | DateTimeException | ArrayIndexOutOfBoundsException e) {
            throw new TideTableParseException(resourceName, lineNumber, line, e);
        }
    }

    private static boolean isMeridiem(String token) {
        return token.equalsIgnoreCase("AM") || token.equalsIgnoreCase("PM");
    }

    static LocalDate parseDate(String value) {
        String[] parts = value.split("/");
        if (parts.length != 3) {
            throw new DateTimeException("Invalid date '" + value + "', expected MM/DD/YYYY or YYYY/MM/DD");
        }
        if (parts[0].length() == 4) {
            return LocalDate.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        }
        return LocalDate.of(Integer.parseInt(parts[2]), Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }

    static LocalTime parseTime(String value, String meridiem) {
        String[] parts = value.split(":");
        if (parts.length != 2) {
            throw new DateTimeException("Invalid time '" + value + "', expected HH:MM");
        }
        int hour = Integer.parseInt(parts[0]);
        int minute = Integer.parseInt(parts[1]);
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                throw new DateTimeException("Invalid 12 hour clock time '" + value + " " + meridiem + "'");
            }
            hour = hour % 12;
            if (meridiem.equals("PM")) {
                hour += 12;
            }
        }
        return LocalTime.of(hour, minute);
    }
}
