package at.sv.tide.render;

import java.util.ArrayList;
import java.util.List;

/**
 * The tide chart of the watch face: hours -4 to 16 around now, placed in the upper part of the face.
 */
public final class TideAreaLayout {

    static final double MIN_HOUR = -4;
    static final double MAX_HOUR = 16;
    static final double PLACEHOLDER_MIN_TIDE = -1;
    static final double PLACEHOLDER_MAX_TIDE = 5;

    private TideAreaLayout() {
    }

    /**
     * Creates the render area for a face of the given size and the observed tide heights, rounded outwards to whole
     * feet. If the heights have no spread, the range of the placeholder tide window is used instead.
     *
     * @throws InvalidRenderBoundsException if the resulting bounds are degenerate
     */
    public static RenderArea forFace(double sizePx, double minHeight, double maxHeight) {
        double minTide = Math.floor(minHeight);
        double maxTide = Math.ceil(maxHeight);
        if (!(maxTide > minTide)) {
            minTide = PLACEHOLDER_MIN_TIDE;
            maxTide = PLACEHOLDER_MAX_TIDE;
        }
        return RenderArea.build(PixelPoint.of(0, 0.3 * sizePx), PixelPoint.of(0.8 * sizePx, 0.1 * sizePx),
                MIN_HOUR, MAX_HOUR, minTide, maxTide);
    }

    /**
     * @return the pixel y of one horizontal grid line per whole foot, from {@code minTide} to {@code maxTide}
     */
    public static List<Double> footGridLines(RenderArea area) {
        List<Double> lines = new ArrayList<>();
        for (int i = 0; i <= (int) area.getNumFeet(); i++) {
            lines.add(area.mapHeight(area.getMinTide() + i));
        }
        return lines;
    }

    /**
     * @return the pixel x of one vertical grid line per hour, starting at the left edge
     */
    public static List<Double> hourGridLines(RenderArea area) {
        List<Double> lines = new ArrayList<>();
        for (int i = 0; i < (int) area.getNumHours(); i++) {
            lines.add(area.getLowerLeftPx().x() + i * area.getHourUnit());
        }
        return lines;
    }
}
