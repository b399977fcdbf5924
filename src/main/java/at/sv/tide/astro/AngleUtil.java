package at.sv.tide.astro;

final class AngleUtil {

    private AngleUtil() {
    }

    /**
     * Floor modulo for doubles, i.e. the result always has the sign of the divisor.
     */
    static double floorMod(double value, double divisor) {
        return value - divisor * Math.floor(value / divisor);
    }

    static double wrapDegrees(double angle) {
        return floorMod(angle, 360.0);
    }

    static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    static double cosDeg(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    static double tanDeg(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }
}
