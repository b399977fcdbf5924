package at.sv.tide.tide;

/**
 * A tide extremum relative to the current time.
 *
 * @param hourOffset hours from now, negative for past tides
 */
public record TidePoint(double hourOffset, double heightFeet, boolean highTide) {
}
