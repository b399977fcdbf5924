package at.sv.tide.tide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable list of tide events of one station, ordered by time.
 */
public final class TideTable {

    private final String stationId;
    private final List<Integer> years;
    private final List<TideEvent> events;
    private final double minHeight;
    private final double maxHeight;

    private TideTable(String stationId, List<Integer> years, List<TideEvent> events) {
        this.stationId = stationId;
        this.years = List.copyOf(years);
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        assertChronologicalOrder(this.events);
        this.minHeight = this.events.stream().mapToDouble(TideEvent::heightFeet).min().orElse(0.0);
        this.maxHeight = this.events.stream().mapToDouble(TideEvent::heightFeet).max().orElse(0.0);
    }

    public static TideTable of(String stationId, List<Integer> years, List<TideEvent> events) {
        return new TideTable(stationId, years, events);
    }

    public static TideTable empty(String stationId) {
        return new TideTable(stationId, List.of(), List.of());
    }

    private static void assertChronologicalOrder(List<TideEvent> events) {
        for (int i = 1; i < events.size(); i++) {
            if (events.get(i).timestamp().isBefore(events.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Tide events not in chronological order at index " + i + ": "
                                                   + events.get(i - 1) + " > " + events.get(i));
            }
        }
    }

    /**
     * Appends the events of the given table, which has to start at or after the last event of this table.
     */
    public TideTable concat(TideTable other) {
        if (!stationId.equals(other.stationId)) {
            throw new IllegalArgumentException("Can't concatenate tables of different stations: " + stationId
                                               + ", " + other.stationId);
        }
        List<Integer> combinedYears = new ArrayList<>(years);
        combinedYears.addAll(other.years);
        List<TideEvent> combinedEvents = new ArrayList<>(events);
        combinedEvents.addAll(other.events);
        return new TideTable(stationId, combinedYears, combinedEvents);
    }

    public String getStationId() {
        return stationId;
    }

    public List<Integer> getYears() {
        return years;
    }

    public List<TideEvent> getEvents() {
        return events;
    }

    public TideEvent get(int index) {
        return events.get(index);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * @return the lowest height of all events, 0 for an empty table
     */
    public double getMinHeight() {
        return minHeight;
    }

    /**
     * @return the highest height of all events, 0 for an empty table
     */
    public double getMaxHeight() {
        return maxHeight;
    }

    @Override
    public String toString() {
        return "TideTable{" +
               "stationId='" + stationId + '\'' +
               ", years=" + years +
               ", events=" + events.size() +
               ", height=[" + minHeight + "," + maxHeight + "]" +
               '}';
    }
}
