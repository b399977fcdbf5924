package at.sv.tide.astro;

import java.time.ZonedDateTime;

import static at.sv.tide.astro.AngleUtil.sinDeg;
import static at.sv.tide.astro.AngleUtil.wrapDegrees;

/**
 * Computes the phase of the moon as the age of the moon relative to the sun, based on the orbital elements at
 * epoch 1980 January 0.0 (John Walker's moontool).
 * <p>
 * A phase of 0 is new moon, 0.5 full moon, approaching 1 it wanes back towards the next new moon.
 */
public final class LunarPhaseCalculator {

    /**
     * 1980 January 0.0 as Julian date.
     */
    static final double EPOCH = 2444238.5;
    static final double SUN_ECLIPTIC_LONGITUDE_EPOCH = 278.833540;
    static final double SUN_ECLIPTIC_LONGITUDE_PERIGEE = 282.596403;
    static final double EARTH_ECCENTRICITY = 0.016718;
    static final double MOON_MEAN_LONGITUDE_EPOCH = 64.975464;
    static final double MOON_MEAN_PERIGEE_EPOCH = 349.383063;
    static final double MOON_DAILY_MOTION = 13.1763966;
    static final double MOON_PERIGEE_DAILY_MOTION = 0.1114041;

    private final DayFractionMode dayFractionMode;

    public LunarPhaseCalculator() {
        this(DayFractionMode.UTC_CORRECTED);
    }

    public LunarPhaseCalculator(DayFractionMode dayFractionMode) {
        this.dayFractionMode = dayFractionMode;
    }

    /**
     * @return the moon phase in [0,1)
     */
    public double computePhase(ZonedDateTime dateTime) {
        double day = julianDate(dateTime) - EPOCH;

        // Sun
        double n = wrapDegrees((360 / 365.2422) * day);
        double sunMeanAnomaly = wrapDegrees(n + SUN_ECLIPTIC_LONGITUDE_EPOCH - SUN_ECLIPTIC_LONGITUDE_PERIGEE);
        double eccentricAnomaly = KeplerSolver.solve(sunMeanAnomaly, EARTH_ECCENTRICITY);
        double trueAnomaly = Math.toDegrees(2 * Math.atan(Math.sqrt((1 + EARTH_ECCENTRICITY) / (1 - EARTH_ECCENTRICITY))
                                                          * Math.tan(eccentricAnomaly / 2.0)));
        double sunLongitude = wrapDegrees(trueAnomaly + SUN_ECLIPTIC_LONGITUDE_PERIGEE);

        // Moon
        double moonLongitude = wrapDegrees(MOON_DAILY_MOTION * day + MOON_MEAN_LONGITUDE_EPOCH);
        double moonMeanAnomaly = wrapDegrees(moonLongitude - MOON_PERIGEE_DAILY_MOTION * day - MOON_MEAN_PERIGEE_EPOCH);
        double evection = 1.2739 * sinDeg(2 * (moonLongitude - sunLongitude) - moonMeanAnomaly);
        double annualEquation = 0.1858 * sinDeg(sunMeanAnomaly);
        double correction3 = 0.37 * sinDeg(sunMeanAnomaly);
        double correctedAnomaly = moonMeanAnomaly + evection - annualEquation - correction3;
        double equationOfCenter = 6.2886 * sinDeg(correctedAnomaly);
        double correction4 = 0.214 * sinDeg(2 * correctedAnomaly);
        double correctedLongitude = moonLongitude + evection + equationOfCenter - annualEquation + correction4;
        double variation = 0.6583 * sinDeg(2 * (correctedLongitude - sunLongitude));
        double trueLongitude = correctedLongitude + variation;

        double phase = wrapDegrees(trueLongitude - sunLongitude) / 360.0;
        return phase >= 1.0 ? 0.0 : phase;
    }

    double julianDate(ZonedDateTime dateTime) {
        int year = dateTime.getYear();
        int month = dateTime.getMonthValue();
        int a = (month + 9) / 12;
        int b = (7 * (year + a)) / 4;
        int c = (275 * month) / 9;
        return (367 * year - b + c + dateTime.getDayOfMonth()) + 1721013.5 + dayFractionMode.dayFraction(dateTime);
    }
}
