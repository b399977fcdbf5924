package at.sv.tide.tide;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TideTableTest {

    private static TideEvent event(String instant, double height, boolean high) {
        return new TideEvent(Instant.parse(instant), height, high);
    }

    @Test
    void of_unsortedEvents_throws() {
        assertThrows(IllegalArgumentException.class, () -> TideTable.of("1", List.of(2023), List.of(
                event("2023-01-02T00:00:00Z", 1, false),
                event("2023-01-01T00:00:00Z", 5, true))));
    }

    @Test
    void of_observedMinAndMax() {
        TideTable table = TideTable.of("1", List.of(2023), List.of(
                event("2023-01-01T00:00:00Z", 2.5, false),
                event("2023-01-01T06:00:00Z", 6.1, true),
                event("2023-01-01T12:00:00Z", 1.5, false)));

        assertThat(table.getMinHeight(), is(1.5));
        assertThat(table.getMaxHeight(), is(6.1));
    }

    @Test
    void concat_appendsEventsAndYears() {
        TideTable first = TideTable.of("1", List.of(2023), List.of(event("2023-12-31T20:00:00Z", -0.5, false)));
        TideTable second = TideTable.of("1", List.of(2024), List.of(event("2024-01-01T02:00:00Z", 5.5, true)));

        TideTable combined = first.concat(second);

        assertThat(combined.size(), is(2));
        assertThat(combined.getYears(), is(List.of(2023, 2024)));
        assertThat(combined.getMinHeight(), is(-0.5));
        assertThat(combined.getMaxHeight(), is(5.5));
    }

    @Test
    void concat_overlappingTables_throws() {
        TideTable first = TideTable.of("1", List.of(2024), List.of(event("2024-01-01T02:00:00Z", 5.5, true)));
        TideTable second = TideTable.of("1", List.of(2023), List.of(event("2023-12-31T20:00:00Z", -0.5, false)));

        assertThrows(IllegalArgumentException.class, () -> first.concat(second));
    }

    @Test
    void concat_differentStations_throws() {
        assertThrows(IllegalArgumentException.class, () -> TideTable.empty("1").concat(TideTable.empty("2")));
    }

    @Test
    void events_areUnmodifiable() {
        TideTable table = TideTable.of("1", List.of(2023), List.of(event("2023-01-01T00:00:00Z", 1, false)));

        assertThrows(UnsupportedOperationException.class, () -> table.getEvents().clear());
    }
}
