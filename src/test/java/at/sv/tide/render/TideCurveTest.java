package at.sv.tide.render;

import at.sv.tide.tide.ActiveTideWindow;
import at.sv.tide.tide.TidePoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class TideCurveTest {

    private RenderArea area;
    private ActiveTideWindow window;
    private TideCurve curve;

    @BeforeEach
    void setUp() {
        area = TideAreaLayout.forFace(450, -1, 5);
        window = ActiveTideWindow.placeholder();
        curve = TideCurve.of(area, window);
    }

    @Test
    void outline_startsAndEndsOnZeroTideLine() {
        assertThat(curve.getStart(), is(PixelPoint.of(0, area.getTide0Px())));
        assertThat(curve.getEnd(), is(PixelPoint.of(360, area.getTide0Px())));
    }

    @Test
    void outline_passesThroughAllWindowPoints() {
        List<TidePoint> points = window.getPoints();

        assertThat(curve.getFirstPoint(), is(area.map(points.get(0).hourOffset(), points.get(0).heightFeet())));
        assertThat(curve.getSegments()).hasSize(ActiveTideWindow.SIZE - 1);
        for (int i = 1; i < points.size(); i++) {
            TidePoint point = points.get(i);
            assertThat(curve.getSegments().get(i - 1).end(), is(area.map(point.hourOffset(), point.heightFeet())));
        }
    }

    @Test
    void segments_haveFlatTangentsAtExtrema() {
        List<TidePoint> points = window.getPoints();
        for (int i = 0; i < curve.getSegments().size(); i++) {
            TideCurve.CubicSegment segment = curve.getSegments().get(i);
            double midX = area.mapHour((points.get(i).hourOffset() + points.get(i + 1).hourOffset()) / 2);

            assertThat(segment.control1().x()).isCloseTo(midX, within(1e-9));
            assertThat(segment.control2().x()).isCloseTo(midX, within(1e-9));
            assertThat(segment.control1().y()).isCloseTo(area.mapHeight(points.get(i).heightFeet()), within(1e-9));
            assertThat(segment.control2().y()).isCloseTo(area.mapHeight(points.get(i + 1).heightFeet()), within(1e-9));
        }
    }
}
