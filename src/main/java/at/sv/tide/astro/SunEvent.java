package at.sv.tide.astro;

public enum SunEvent {
    SUNRISE(6.0),
    SUNSET(18.0);

    /**
     * The approximate local hour of the event, used as the starting guess of the almanac algorithm.
     */
    private final double approximateHour;

    SunEvent(double approximateHour) {
        this.approximateHour = approximateHour;
    }

    double getApproximateHour() {
        return approximateHour;
    }
}
