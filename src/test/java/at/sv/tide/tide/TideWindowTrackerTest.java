package at.sv.tide.tide;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static at.sv.tide.tide.ActiveTideWindowsTest.START;
import static at.sv.tide.tide.ActiveTideWindowsTest.sixHourTable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

class TideWindowTrackerTest {

    private TideWindowTracker tracker;
    private TideTable table;
    private ZonedDateTime now;

    @BeforeEach
    void setUp() {
        tracker = new TideWindowTracker();
        table = sixHourTable(12);
        now = START.plus(Duration.ofHours(20)).atZone(ZoneOffset.UTC);
    }

    @Test
    void update_noTable_placeholder() {
        assertThat(tracker.update(null, now).isPlaceholder(), is(true));
    }

    @Test
    void update_sameMinute_returnsSameWindow() {
        ActiveTideWindow first = tracker.update(table, now);
        ActiveTideWindow second = tracker.update(table, now.plusSeconds(30));

        assertThat(second, sameInstance(first));
    }

    @Test
    void update_nextMinute_recomputesOffsets() {
        ActiveTideWindow first = tracker.update(table, now);
        ActiveTideWindow second = tracker.update(table, now.plusMinutes(1));

        assertThat(second.get(2).hourOffset()).isLessThan(first.get(2).hourOffset());
        assertThat(second.getNextTide(), is(first.getNextTide()));
    }

    @Test
    void update_afterNextTidePassed_advances() {
        ActiveTideWindow first = tracker.update(table, now);
        ActiveTideWindow later = tracker.update(table, now.plusHours(5));

        assertThat(first.getNextTide().orElseThrow(), is(table.get(4)));
        assertThat(later.getNextTide().orElseThrow(), is(table.get(5)));
        assertThat(tracker.getWindow(), sameInstance(later));
    }

    @Test
    void update_tableChanged_searchesAgain() {
        tracker.update(table, now);
        TideTable other = sixHourTable(12);

        ActiveTideWindow window = tracker.update(other, now);

        assertThat(window.getNextTide().orElseThrow(), is(other.get(4)));
    }

    @Test
    void update_tableCleared_placeholder() {
        tracker.update(table, now);

        assertThat(tracker.update(null, now).isPlaceholder(), is(true));
    }

    @Test
    void reset_forgetsState() {
        tracker.update(table, now);

        tracker.reset();

        assertThat(tracker.getWindow().isPlaceholder(), is(true));
        assertThat(tracker.update(table, now).isPlaceholder(), is(false));
    }
}
