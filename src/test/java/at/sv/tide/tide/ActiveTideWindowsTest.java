package at.sv.tide.tide;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class ActiveTideWindowsTest {

    static final Instant START = Instant.parse("2023-06-01T00:00:00Z");

    private TideTable table;

    /**
     * Alternating low and high tides every six hours, starting with a low tide at {@link #START}.
     */
    static TideTable sixHourTable(int size) {
        List<TideEvent> events = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            boolean high = i % 2 == 1;
            events.add(new TideEvent(START.plus(Duration.ofHours(6L * i)), high ? 5.0 + i * 0.1 : 0.5 - i * 0.1, high));
        }
        return TideTable.of("9410583", List.of(2023), events);
    }

    @BeforeEach
    void setUp() {
        table = sixHourTable(10);
    }

    @Test
    void findNextIndex_firstEventAtOrAfterNow() {
        assertThat(ActiveTideWindows.findNextIndex(table, START.minusSeconds(1)), is(OptionalInt.of(0)));
        assertThat(ActiveTideWindows.findNextIndex(table, START), is(OptionalInt.of(0)));
        assertThat(ActiveTideWindows.findNextIndex(table, START.plusSeconds(1)), is(OptionalInt.of(1)));
        assertThat(ActiveTideWindows.findNextIndex(table, START.plus(Duration.ofHours(54))), is(OptionalInt.of(9)));
        assertThat(ActiveTideWindows.findNextIndex(table, START.plus(Duration.ofHours(55))), is(OptionalInt.empty()));
    }

    @Test
    void findNextIndex_isMonotonic() {
        int previous = 0;
        for (int minutes = -60; minutes < 60 * 60; minutes += 13) {
            int index = ActiveTideWindows.findNextIndex(table, START.plus(Duration.ofMinutes(minutes)))
                                         .orElse(table.size());

            assertThat(index).isGreaterThanOrEqualTo(previous);
            previous = index;
        }
    }

    @Test
    void findNextIndex_emptyTable() {
        assertThat(ActiveTideWindows.findNextIndex(TideTable.empty("1"), START), is(OptionalInt.empty()));
    }

    @Test
    void buildWindow_twoBeforeAndFourFromNext() {
        Instant now = START.plus(Duration.ofHours(26));

        ActiveTideWindow window = ActiveTideWindows.buildWindow(table, now);

        assertThat(window.isPlaceholder(), is(false));
        assertThat(window.isNeedsReload(), is(false));
        assertThat(window.getNextTide().orElseThrow(), is(table.get(5)));
        assertThat(window.getPoints()).hasSize(ActiveTideWindow.SIZE);
        assertThat(window.get(0).hourOffset()).isCloseTo(-8.0, within(1e-9));
        assertThat(window.get(1).hourOffset()).isCloseTo(-2.0, within(1e-9));
        assertThat(window.get(ActiveTideWindow.NEXT_TIDE_POSITION).hourOffset()).isCloseTo(4.0, within(1e-9));
        assertThat(window.get(5).hourOffset()).isCloseTo(22.0, within(1e-9));
        assertThat(window.get(2).heightFeet(), is(table.get(5).heightFeet()));
        assertThat(window.get(2).highTide(), is(true));
        assertThat(window.get(3).highTide(), is(false));
    }

    @Test
    void buildWindow_offsetsIncrease() {
        ActiveTideWindow window = ActiveTideWindows.buildWindow(table, START.plus(Duration.ofMinutes(20 * 60 + 7)));

        for (int i = 1; i < window.getPoints().size(); i++) {
            assertThat(window.get(i).hourOffset()).isGreaterThan(window.get(i - 1).hourOffset());
        }
        assertThat(window.get(1).hourOffset()).isLessThan(0);
        assertThat(window.get(2).hourOffset()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void buildWindow_atTideTime_tideIsNext() {
        ActiveTideWindow window = ActiveTideWindows.buildWindow(table, START.plus(Duration.ofHours(18)));

        assertThat(window.getNextTide().orElseThrow(), is(table.get(3)));
        assertThat(window.get(2).hourOffset(), is(0.0));
    }

    @Test
    void buildWindow_notEnoughPastTides_placeholder() {
        ActiveTideWindow window = ActiveTideWindows.buildWindow(table, START.plus(Duration.ofHours(3)));

        assertThat(window, is(ActiveTideWindow.placeholder()));
        assertThat(window.isNeedsReload(), is(true));
        assertThat(window.getNextTide().isPresent(), is(false));
    }

    @Test
    void buildWindow_notEnoughFutureTides_placeholder() {
        assertThat(ActiveTideWindows.buildWindow(table, START.plus(Duration.ofHours(37))).isPlaceholder(), is(true));
        assertThat(ActiveTideWindows.buildWindow(table, START.plus(Duration.ofHours(36))).isPlaceholder(), is(false));
    }

    @Test
    void buildWindow_allTidesPast_placeholder() {
        assertThat(ActiveTideWindows.buildWindow(table, START.plus(Duration.ofDays(10))).isPlaceholder(), is(true));
    }

    @Test
    void placeholder_semidiurnalPattern() {
        ActiveTideWindow placeholder = ActiveTideWindow.placeholder();

        assertThat(placeholder.getPoints()).extracting(TidePoint::hourOffset)
                                           .containsExactly(-16.0, -8.0, 0.0, 8.0, 16.0, 24.0);
        assertThat(placeholder.getPoints()).extracting(TidePoint::heightFeet)
                                           .containsExactly(-1.0, 5.0, 1.0, 3.0, -1.0, 4.0);
        assertThat(placeholder.getPoints()).extracting(TidePoint::highTide)
                                           .containsExactly(false, true, false, true, false, true);
    }
}
