package at.sv.tide.render;

import lombok.Getter;

/**
 * Linear mapping from the (hour offset, tide height) domain into a rectangular pixel area.
 * <p>
 * The hour unit divides the pixel width by {@code maxHour - minHour - 1}, so the mapped window ends one hour before
 * {@code maxHour}. Heights are mapped without inverting the axis; the pixel y of {@code upperRightPx} is usually the
 * smaller one on screen.
 */
@Getter
public final class RenderArea {

    private final PixelPoint lowerLeftPx;
    private final PixelPoint upperRightPx;
    private final double minHour;
    private final double maxHour;
    private final double minTide;
    private final double maxTide;

    private final double hourUnit;
    private final double footUnit;
    private final double time0Px;
    private final double tide0Px;

    private RenderArea(PixelPoint lowerLeftPx, PixelPoint upperRightPx, double minHour, double maxHour,
                       double minTide, double maxTide) {
        this.lowerLeftPx = lowerLeftPx;
        this.upperRightPx = upperRightPx;
        this.minHour = minHour;
        this.maxHour = maxHour;
        this.minTide = minTide;
        this.maxTide = maxTide;
        hourUnit = (upperRightPx.x() - lowerLeftPx.x()) / (maxHour - minHour - 1);
        time0Px = lowerLeftPx.x() - minHour * hourUnit;
        footUnit = (upperRightPx.y() - lowerLeftPx.y()) / (maxTide - minTide);
        tide0Px = lowerLeftPx.y() - minTide * footUnit;
    }

    public static RenderArea build(PixelPoint lowerLeftPx, PixelPoint upperRightPx, double minHour, double maxHour,
                                   double minTide, double maxTide) {
        assertBounds(minHour, maxHour, minTide, maxTide);
        return new RenderArea(lowerLeftPx, upperRightPx, minHour, maxHour, minTide, maxTide);
    }

    private static void assertBounds(double minHour, double maxHour, double minTide, double maxTide) {
        if (!(maxHour > minHour)) {
            throw new InvalidRenderBoundsException("maxHour (" + maxHour + ") must be greater than minHour (" + minHour + ")");
        }
        if (maxHour - minHour - 1 == 0) {
            throw new InvalidRenderBoundsException("Hour span of [" + minHour + "," + maxHour + "] must not be exactly one hour");
        }
        if (!(maxTide > minTide)) {
            throw new InvalidRenderBoundsException("maxTide (" + maxTide + ") must be greater than minTide (" + minTide + ")");
        }
    }

    public PixelPoint map(double hourOffset, double heightFeet) {
        return new PixelPoint(mapHour(hourOffset), mapHeight(heightFeet));
    }

    public double mapHour(double hourOffset) {
        return time0Px + hourOffset * hourUnit;
    }

    public double mapHeight(double heightFeet) {
        return tide0Px + heightFeet * footUnit;
    }

    public double getNumHours() {
        return maxHour - minHour;
    }

    public double getNumFeet() {
        return maxTide - minTide;
    }

    @Override
    public String toString() {
        return "RenderArea{" +
               "lowerLeft=" + lowerLeftPx +
               ", upperRight=" + upperRightPx +
               ", hours=[" + minHour + "," + maxHour + "]" +
               ", tide=[" + minTide + "," + maxTide + "]" +
               ", hourUnit=" + hourUnit +
               ", footUnit=" + footUnit +
               '}';
    }
}
