package at.sv.tide.render;

import at.sv.tide.tide.ActiveTideWindow;
import at.sv.tide.tide.TidePoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The closed outline of the tide chart: from the zero line on the left edge through all points of the active window
 * and back to the zero line on the right edge. Consecutive extrema are joined by cubic curves whose control points
 * lie at the horizontal midpoint, giving flat tangents at every high and low tide.
 */
public final class TideCurve {

    private final PixelPoint start;
    private final PixelPoint firstPoint;
    private final List<CubicSegment> segments;
    private final PixelPoint end;

    private TideCurve(PixelPoint start, PixelPoint firstPoint, List<CubicSegment> segments, PixelPoint end) {
        this.start = start;
        this.firstPoint = firstPoint;
        this.segments = segments;
        this.end = end;
    }

    public static TideCurve of(RenderArea area, ActiveTideWindow window) {
        List<TidePoint> points = window.getPoints();
        List<CubicSegment> segments = new ArrayList<>();
        for (int i = 0; i < points.size() - 1; i++) {
            TidePoint current = points.get(i);
            TidePoint next = points.get(i + 1);
            double midX = area.mapHour((current.hourOffset() + next.hourOffset()) / 2);
            segments.add(new CubicSegment(
                    PixelPoint.of(midX, area.mapHeight(current.heightFeet())),
                    PixelPoint.of(midX, area.mapHeight(next.heightFeet())),
                    area.map(next.hourOffset(), next.heightFeet())));
        }
        TidePoint first = points.get(0);
        return new TideCurve(PixelPoint.of(area.getLowerLeftPx().x(), area.getTide0Px()),
                area.map(first.hourOffset(), first.heightFeet()),
                Collections.unmodifiableList(segments),
                PixelPoint.of(area.getUpperRightPx().x(), area.getTide0Px()));
    }

    /**
     * Where the outline starts, on the zero tide line at the left edge.
     */
    public PixelPoint getStart() {
        return start;
    }

    public PixelPoint getFirstPoint() {
        return firstPoint;
    }

    public List<CubicSegment> getSegments() {
        return segments;
    }

    /**
     * Where the outline ends before it is closed, on the zero tide line at the right edge.
     */
    public PixelPoint getEnd() {
        return end;
    }

    public record CubicSegment(PixelPoint control1, PixelPoint control2, PixelPoint end) {
    }
}
