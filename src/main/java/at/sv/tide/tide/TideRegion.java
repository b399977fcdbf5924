package at.sv.tide.tide;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The tide stations selectable on the watch face, grouped by coast.
 */
public enum TideRegion {
    WEST_COAST("West Coast", List.of(
            new TideStation("Newport Beach, CA", "9410583"),
            new TideStation("Oceanside, CA", "TWC0419"),
            new TideStation("La Jolla, CA", "9410230"))),
    EAST_COAST("East Coast", List.of(
            new TideStation("Long Island, NY", "8512354"),
            new TideStation("Seaside Heights, NJ", "8533071"),
            new TideStation("Outer Banks, NC", "8652226"),
            new TideStation("Cocoa Beach, FL", "8721649")));

    private final String regionName;
    private final List<TideStation> stations;

    TideRegion(String regionName, List<TideStation> stations) {
        this.regionName = regionName;
        this.stations = stations;
    }

    public String getRegionName() {
        return regionName;
    }

    public List<TideStation> getStations() {
        return stations;
    }

    /**
     * Unknown indices fall back to the west coast.
     */
    public static TideRegion byIndex(int index) {
        if (index == 1) {
            return EAST_COAST;
        }
        return WEST_COAST;
    }

    /**
     * Indices outside this region's stations fall back to its first station.
     */
    public TideStation station(int index) {
        if (index < 0 || index >= stations.size()) {
            return stations.get(0);
        }
        return stations.get(index);
    }

    public static Optional<TideStation> findStation(String stationId) {
        return Arrays.stream(values())
                     .flatMap(region -> region.stations.stream())
                     .filter(station -> station.id().equals(stationId))
                     .findFirst();
    }

    public static TideStation defaultStation() {
        return WEST_COAST.station(0);
    }
}
