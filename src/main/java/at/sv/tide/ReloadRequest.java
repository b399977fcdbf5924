package at.sv.tide;

import java.util.List;

/**
 * A request to load the tide tables of the given station and years.
 */
public record ReloadRequest(String stationId, List<Integer> years) {
    @Override
    public String toString() {
        return stationId + years;
    }
}
