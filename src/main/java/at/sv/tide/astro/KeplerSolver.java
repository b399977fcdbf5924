package at.sv.tide.astro;

import lombok.extern.slf4j.Slf4j;

/**
 * Solves Kepler's equation {@code E - e*sin(E) = M} for the eccentric anomaly using Newton iteration.
 */
@Slf4j
public final class KeplerSolver {

    static final double EPSILON = 1e-6;
    static final int MAX_ITERATIONS = 50;

    private KeplerSolver() {
    }

    /**
     * @param meanAnomalyDegrees the mean anomaly M in degrees
     * @param eccentricity       orbital eccentricity in [0,1)
     * @return the eccentric anomaly E in radians
     */
    public static double solve(double meanAnomalyDegrees, double eccentricity) {
        double m = Math.toRadians(meanAnomalyDegrees);
        double e = m;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double delta = e - eccentricity * Math.sin(e) - m;
            e -= delta / (1.0 - eccentricity * Math.cos(e));
            if (Math.abs(delta) <= EPSILON) {
                return e;
            }
        }
        log.warn("Kepler iteration did not converge after {} steps (M={}, ecc={}). Using last estimate.",
                MAX_ITERATIONS, meanAnomalyDegrees, eccentricity);
        return e;
    }
}
