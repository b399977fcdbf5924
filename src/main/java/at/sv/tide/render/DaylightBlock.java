package at.sv.tide.render;

import at.sv.tide.astro.CelestialState;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * A vertical band of the tide chart covering the hours between sunrise and sunset.
 */
public record DaylightBlock(double left, double right, double top, double bottom) {

    /**
     * Computes today's and tomorrow's daylight band relative to the given time.
     */
    public static List<DaylightBlock> of(RenderArea area, ZonedDateTime now, CelestialState celestialState) {
        double daylightHours = celestialState.daylightHours();
        double sunriseDiff = now.getHour() + now.getMinute() / 60.0 - celestialState.sunriseHour();
        double top = area.getUpperRightPx().y();
        double bottom = area.getLowerLeftPx().y();

        double todayLeft = area.getTime0Px() - sunriseDiff * area.getHourUnit();
        double tomorrowLeft = area.getTime0Px() - (sunriseDiff - 24) * area.getHourUnit();
        double width = daylightHours * area.getHourUnit();
        return List.of(new DaylightBlock(todayLeft, todayLeft + width, top, bottom),
                new DaylightBlock(tomorrowLeft, tomorrowLeft + width, top, bottom));
    }

    public double width() {
        return right - left;
    }
}
