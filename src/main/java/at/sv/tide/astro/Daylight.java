package at.sv.tide.astro;

/**
 * Classifies a day at a given location by whether the sun crosses the horizon at all.
 */
public enum Daylight {
    NORMAL,
    /**
     * The sun never sets on that day.
     */
    POLAR_DAY,
    /**
     * The sun never rises on that day.
     */
    POLAR_NIGHT
}
