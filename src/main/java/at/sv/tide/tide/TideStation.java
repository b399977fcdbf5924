package at.sv.tide.tide;

/**
 * @param name human readable location, shown on the face
 * @param id   NOAA station id, used to look up the tide tables
 */
public record TideStation(String name, String id) {
}
