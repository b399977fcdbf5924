package at.sv.tide;

import at.sv.tide.astro.CelestialState;
import at.sv.tide.render.DaylightBlock;
import at.sv.tide.render.RenderArea;
import at.sv.tide.render.TideCurve;
import at.sv.tide.tide.ActiveTideWindow;
import at.sv.tide.tide.TideEvent;
import lombok.Builder;
import lombok.Getter;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Everything the drawing layer needs for one frame. Never modified; each change produces a new instance.
 */
@Getter
@Builder(toBuilder = true)
public final class FaceState {
    private final ZonedDateTime frameTime;
    private final RenderMode renderMode;
    private final FaceSettings settings;
    private final CelestialState celestialState;
    private final ActiveTideWindow tideWindow;
    /**
     * Null until a valid render area could be built.
     */
    private final RenderArea renderArea;
    /**
     * Number of tide events in the active table, 0 while none is loaded.
     */
    private final int loadedTideCount;
    /**
     * True if the active table was loaded for a substitute year.
     */
    private final boolean degraded;

    public Optional<TideEvent> getNextTide() {
        return tideWindow.getNextTide();
    }

    public Optional<TideCurve> getTideCurve() {
        if (renderArea == null || !renderMode.isTideChartVisible()) {
            return Optional.empty();
        }
        return Optional.of(TideCurve.of(renderArea, tideWindow));
    }

    public List<DaylightBlock> getDaylightBlocks() {
        if (renderArea == null || !renderMode.isTideChartVisible()) {
            return List.of();
        }
        return DaylightBlock.of(renderArea, frameTime, celestialState);
    }
}
