package at.sv.tide.tide;

import java.util.List;

/**
 * @param table          the loaded table, possibly spanning two years
 * @param requestedYears the years asked for, before substituting unsupported years
 * @param degraded       true if an unsupported year was replaced with the earliest supported one, the caller should
 *                       reload once the clock provides a valid date
 */
public record TideLoadResult(TideTable table, List<Integer> requestedYears, boolean degraded) {
}
