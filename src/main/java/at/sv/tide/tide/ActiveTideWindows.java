package at.sv.tide.tide;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

public final class ActiveTideWindows {

    private static final int TIDES_BEFORE = ActiveTideWindow.NEXT_TIDE_POSITION;
    private static final int TIDES_AFTER = ActiveTideWindow.SIZE - ActiveTideWindow.NEXT_TIDE_POSITION - 1;

    private ActiveTideWindows() {
    }

    /**
     * @return the index of the first event at or after {@code now}, or empty if all events lie in the past
     */
    public static OptionalInt findNextIndex(TideTable table, Instant now) {
        for (int i = 0; i < table.size(); i++) {
            if (!table.get(i).timestamp().isBefore(now)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Builds the window around the given next tide. Falls back to the {@link ActiveTideWindow#placeholder()} if the
     * table lacks the two preceding or the three following events.
     */
    public static ActiveTideWindow buildWindow(TideTable table, int nextIndex, Instant now) {
        if (nextIndex < TIDES_BEFORE || nextIndex + TIDES_AFTER >= table.size()) {
            return ActiveTideWindow.placeholder();
        }
        List<TidePoint> points = new ArrayList<>(ActiveTideWindow.SIZE);
        for (int i = nextIndex - TIDES_BEFORE; i <= nextIndex + TIDES_AFTER; i++) {
            TideEvent event = table.get(i);
            points.add(new TidePoint(hoursBetween(now, event.timestamp()), event.heightFeet(), event.highTide()));
        }
        return new ActiveTideWindow(points, table.get(nextIndex), false);
    }

    public static ActiveTideWindow buildWindow(TideTable table, Instant now) {
        OptionalInt nextIndex = findNextIndex(table, now);
        if (nextIndex.isEmpty()) {
            return ActiveTideWindow.placeholder();
        }
        return buildWindow(table, nextIndex.getAsInt(), now);
    }

    private static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).getSeconds() / 3600.0;
    }
}
