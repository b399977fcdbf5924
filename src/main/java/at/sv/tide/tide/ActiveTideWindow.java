package at.sv.tide.tide;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * The six tides drawn on the face: the two before and the next four from now on, relative to now.
 */
public final class ActiveTideWindow {

    public static final int SIZE = 6;
    /**
     * Position of the next upcoming tide within the window.
     */
    public static final int NEXT_TIDE_POSITION = 2;

    private static final ActiveTideWindow PLACEHOLDER = new ActiveTideWindow(List.of(
            new TidePoint(-16, -1, false),
            new TidePoint(-8, 5, true),
            new TidePoint(0, 1, false),
            new TidePoint(8, 3, true),
            new TidePoint(16, -1, false),
            new TidePoint(24, 4, true)), null, true);

    private final List<TidePoint> points;
    private final TideEvent nextTide;
    private final boolean placeholder;

    ActiveTideWindow(List<TidePoint> points, @Nullable TideEvent nextTide, boolean placeholder) {
        if (points.size() != SIZE) {
            throw new IllegalArgumentException("A tide window has exactly " + SIZE + " points, got " + points.size());
        }
        this.points = List.copyOf(points);
        this.nextTide = nextTide;
        this.placeholder = placeholder;
    }

    /**
     * A generic semidiurnal pattern, used while not enough tide events around now are loaded.
     */
    public static ActiveTideWindow placeholder() {
        return PLACEHOLDER;
    }

    public List<TidePoint> getPoints() {
        return points;
    }

    public TidePoint get(int index) {
        return points.get(index);
    }

    public Optional<TideEvent> getNextTide() {
        return Optional.ofNullable(nextTide);
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    /**
     * Placeholder windows signal that the tide table should be loaded again once enough context is available.
     */
    public boolean isNeedsReload() {
        return placeholder;
    }

    @Override
    public String toString() {
        return "ActiveTideWindow{" +
               "points=" + points +
               ", placeholder=" + placeholder +
               '}';
    }
}
