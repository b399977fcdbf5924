package at.sv.tide.astro;

import java.time.ZonedDateTime;
import java.util.OptionalDouble;

import static at.sv.tide.astro.AngleUtil.cosDeg;
import static at.sv.tide.astro.AngleUtil.floorMod;
import static at.sv.tide.astro.AngleUtil.sinDeg;
import static at.sv.tide.astro.AngleUtil.tanDeg;

/**
 * Sunrise and sunset times using the classic almanac approximation (Almanac for Computers, 1990).
 * Accuracy is in the range of one to two minutes for non-polar latitudes.
 */
public final class SolarEphemeris {

    /**
     * Includes atmospheric refraction and the radius of the solar disk.
     */
    static final double ZENITH = -0.83;

    private SolarEphemeris() {
    }

    /**
     * Computes the local hour of sunrise or sunset for the calendar day of the given date.
     *
     * @param date      the day to compute the event for; its UTC offset defines the returned local time
     * @param latitude  in degrees, north positive
     * @param longitude in degrees, east positive
     * @param event     sunrise or sunset
     * @return the local hour in [0,24), or empty if the sun does not cross the horizon on that day
     */
    public static OptionalDouble computeEventHour(ZonedDateTime date, double latitude, double longitude,
                                                  SunEvent event) {
        SolarPosition position = SolarPosition.of(date, longitude, event);
        double cosH = position.cosLocalHourAngle(latitude);
        if (cosH > 1 || cosH < -1) {
            return OptionalDouble.empty();
        }
        double hourAngle = Math.toDegrees(Math.acos(cosH));
        if (event == SunEvent.SUNRISE) {
            hourAngle = 360 - hourAngle;
        }
        hourAngle /= 15;

        double localMeanTime = hourAngle + position.rightAscensionHours - (0.06571 * position.t) - 6.622;
        double utcTime = floorMod(localMeanTime - position.lonHour, 24.0);
        double localOffset = date.getOffset().getTotalSeconds() / 3600.0;
        return OptionalDouble.of(floorMod(utcTime + localOffset + 24.0, 24.0));
    }

    /**
     * Classifies the day of the given date at the given location, using the sunrise position of the sun.
     */
    public static Daylight daylightOn(ZonedDateTime date, double latitude, double longitude) {
        return daylightOn(date, latitude, longitude, SunEvent.SUNRISE);
    }

    /**
     * Classifies the day using the position of the sun at the approximate time of the given event. Near the start
     * and end of polar day or night, sunrise and sunset may disagree; classify with the event that is missing.
     */
    public static Daylight daylightOn(ZonedDateTime date, double latitude, double longitude, SunEvent event) {
        double cosH = SolarPosition.of(date, longitude, event).cosLocalHourAngle(latitude);
        if (cosH > 1) {
            return Daylight.POLAR_NIGHT;
        }
        if (cosH < -1) {
            return Daylight.POLAR_DAY;
        }
        return Daylight.NORMAL;
    }

    static int dayOfYear(int year, int month, int day) {
        double n1 = Math.floor(275.0 * month / 9.0);
        double n2 = Math.floor((month + 9.0) / 12.0);
        double n3 = 1 + Math.floor((year - 4 * Math.floor(year / 4.0) + 2) / 3.0);
        return (int) (n1 - (n2 * n3) + day - 30);
    }

    private static final class SolarPosition {
        private final double t;
        private final double lonHour;
        private final double rightAscensionHours;
        private final double sinDec;
        private final double cosDec;

        private SolarPosition(double t, double lonHour, double rightAscensionHours, double sinDec) {
            this.t = t;
            this.lonHour = lonHour;
            this.rightAscensionHours = rightAscensionHours;
            this.sinDec = sinDec;
            this.cosDec = Math.cos(Math.asin(sinDec));
        }

        static SolarPosition of(ZonedDateTime date, double longitude, SunEvent event) {
            int dayOfYear = dayOfYear(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
            double lonHour = longitude / 15.0;
            double t = dayOfYear + ((event.getApproximateHour() - lonHour) / 24.0);

            double meanAnomaly = (0.9856 * t) - 3.289;
            double trueLongitude = AngleUtil.wrapDegrees(meanAnomaly + (1.916 * sinDeg(meanAnomaly))
                                                         + (0.020 * sinDeg(2 * meanAnomaly)) + 282.634);

            double rightAscension = AngleUtil.wrapDegrees(Math.toDegrees(Math.atan(0.91764 * tanDeg(trueLongitude))));
            double trueLongitudeQuadrant = Math.floor(trueLongitude / 90.0) * 90.0;
            double rightAscensionQuadrant = Math.floor(rightAscension / 90.0) * 90.0;
            rightAscension += trueLongitudeQuadrant - rightAscensionQuadrant;

            double sinDec = 0.39782 * sinDeg(trueLongitude);
            return new SolarPosition(t, lonHour, rightAscension / 15.0, sinDec);
        }

        double cosLocalHourAngle(double latitude) {
            return (sinDeg(ZENITH) - (sinDec * sinDeg(latitude))) / (cosDec * cosDeg(latitude));
        }
    }
}
