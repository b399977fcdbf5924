package at.sv.tide.render;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class TideAreaLayoutTest {

    @Test
    void forFace_placesAreaInUpperPartOfFace() {
        RenderArea area = TideAreaLayout.forFace(450, -0.5, 5.66);

        assertThat(area.getLowerLeftPx(), is(PixelPoint.of(0, 135)));
        assertThat(area.getUpperRightPx(), is(PixelPoint.of(360, 45)));
        assertThat(area.getMinHour(), is(-4.0));
        assertThat(area.getMaxHour(), is(16.0));
    }

    @Test
    void forFace_roundsHeightsOutwards() {
        RenderArea area = TideAreaLayout.forFace(450, -0.5, 5.66);

        assertThat(area.getMinTide(), is(-1.0));
        assertThat(area.getMaxTide(), is(6.0));
    }

    @Test
    void forFace_noSpread_usesPlaceholderRange() {
        RenderArea area = TideAreaLayout.forFace(450, 0, 0);

        assertThat(area.getMinTide(), is(-1.0));
        assertThat(area.getMaxTide(), is(5.0));
    }

    @Test
    void footGridLines_oneLinePerFoot() {
        RenderArea area = TideAreaLayout.forFace(450, -1, 5);

        List<Double> lines = TideAreaLayout.footGridLines(area);

        assertThat(lines).hasSize(7);
        assertThat(lines.get(0)).isCloseTo(135.0, within(1e-9));
        assertThat(lines.get(6)).isCloseTo(45.0, within(1e-9));
    }

    @Test
    void hourGridLines_startAtLeftEdge_evenlySpaced() {
        RenderArea area = TideAreaLayout.forFace(450, -1, 5);

        List<Double> lines = TideAreaLayout.hourGridLines(area);

        assertThat(lines).hasSize(20);
        assertThat(lines.get(0)).isEqualTo(0.0);
        assertThat(lines.get(1) - lines.get(0)).isCloseTo(area.getHourUnit(), within(1e-9));
    }
}
