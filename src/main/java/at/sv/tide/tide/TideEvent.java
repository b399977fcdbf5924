package at.sv.tide.tide;

import java.time.Instant;

/**
 * A predicted high or low tide.
 *
 * @param timestamp  the UTC instant of the extremum
 * @param heightFeet the predicted height in feet relative to the station datum (usually MLLW)
 * @param highTide   true for a local maximum, false for a local minimum
 */
public record TideEvent(Instant timestamp, double heightFeet, boolean highTide) {
}
