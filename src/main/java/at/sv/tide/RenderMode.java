package at.sv.tide;

/**
 * How the host is currently drawing the face. Determines which parts of the face state are shown.
 */
public enum RenderMode {
    /**
     * Full face with tide chart, sun and moon.
     */
    INTERACTIVE(true, true),
    /**
     * Low power mode, only time and date.
     */
    AMBIENT(false, false),
    /**
     * Outline layer used by the host to highlight editable elements.
     */
    HIGHLIGHT(false, false);

    private final boolean tideChartVisible;
    private final boolean secondsVisible;

    RenderMode(boolean tideChartVisible, boolean secondsVisible) {
        this.tideChartVisible = tideChartVisible;
        this.secondsVisible = secondsVisible;
    }

    public boolean isTideChartVisible() {
        return tideChartVisible;
    }

    public boolean isSecondsVisible() {
        return secondsVisible;
    }
}
