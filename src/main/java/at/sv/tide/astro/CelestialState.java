package at.sv.tide.astro;

/**
 * Sun and moon data of one hour for the configured location.
 *
 * @param sunriseHour local hour of sunrise in [0,24), 0 if there is none
 * @param sunsetHour  local hour of sunset in [0,24), 0 if there is none. On the first and last day of a polar day
 *                    or night only one of both events may exist.
 * @param moonPhase   moon phase in [0,1), 0 = new moon, 0.5 = full moon
 * @param daylight    whether sunrise and sunset exist on that day
 */
public record CelestialState(double sunriseHour, double sunsetHour, double moonPhase, Daylight daylight) {

    public double daylightHours() {
        return switch (daylight) {
            case POLAR_DAY -> 24.0;
            case POLAR_NIGHT -> 0.0;
            case NORMAL -> AngleUtil.floorMod(sunsetHour - sunriseHour + 24.0, 24.0);
        };
    }
}
