package at.sv.tide.tide;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.OptionalInt;

/**
 * Keeps the active tide window of a frame loop up to date. The window is rebuilt once per minute; the index of the
 * next tide is only searched again once that tide has passed or the table changed.
 */
@Slf4j
public final class TideWindowTracker {

    private TideTable table;
    private Instant lastMinute;
    private int nextIndex = -1;
    private Instant nextTideTime;
    private ActiveTideWindow window = ActiveTideWindow.placeholder();

    /**
     * @param currentTable the active table, or null while none is loaded
     */
    public ActiveTideWindow update(@Nullable TideTable currentTable, ZonedDateTime now) {
        Instant instant = now.toInstant();
        Instant minute = instant.truncatedTo(ChronoUnit.MINUTES);
        boolean tableChanged = currentTable != table;
        if (!tableChanged && minute.equals(lastMinute)) {
            return window;
        }
        table = currentTable;
        lastMinute = minute;
        if (table == null) {
            window = ActiveTideWindow.placeholder();
            return window;
        }
        if (tableChanged || nextTideTime == null || instant.isAfter(nextTideTime)) {
            updateNextIndex(instant);
        }
        window = nextIndex < 0 ? ActiveTideWindow.placeholder() : ActiveTideWindows.buildWindow(table, nextIndex, instant);
        return window;
    }

    private void updateNextIndex(Instant now) {
        OptionalInt index = ActiveTideWindows.findNextIndex(table, now);
        nextIndex = index.orElse(-1);
        nextTideTime = index.isPresent() ? table.get(nextIndex).timestamp() : null;
        log.trace("Next tide index: {} at {}", nextIndex, nextTideTime);
    }

    public ActiveTideWindow getWindow() {
        return window;
    }

    public void reset() {
        table = null;
        lastMinute = null;
        nextIndex = -1;
        nextTideTime = null;
        window = ActiveTideWindow.placeholder();
    }
}
