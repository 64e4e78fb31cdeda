package dev.issuebench.results;

import javax.annotation.Nonnull;

/**
 * Success-rate difference between two configurations of the same run.
 *
 * @param baselineConfig configuration compared against
 * @param candidateConfig configuration being assessed
 * @param baselineRate baseline success rate in [0, 1]
 * @param candidateRate candidate success rate in [0, 1]
 * @param delta {@code (candidateRate - baselineRate) * 100}, in percentage points
 * @param significant whether {@code |delta|} reaches {@link #SIGNIFICANCE_THRESHOLD}
 */
public record Comparison(
        @Nonnull String baselineConfig,
        @Nonnull String candidateConfig,
        double baselineRate,
        double candidateRate,
        double delta,
        boolean significant) {

    /** Smallest difference, in percentage points, reported as significant. */
    public static final double SIGNIFICANCE_THRESHOLD = 5.0;

    private static final double DELTA_PRECISION = 1e9;

    public static Comparison of(
            String baselineConfig,
            String candidateConfig,
            double baselineRate,
            double candidateRate) {
        double delta = (candidateRate - baselineRate) * 100.0;
        // 0.59 - 0.54 is 4.999999999999993 in binary floating point
        double rounded = Math.round(delta * DELTA_PRECISION) / DELTA_PRECISION;
        return new Comparison(
                baselineConfig,
                candidateConfig,
                baselineRate,
                candidateRate,
                delta,
                Math.abs(rounded) >= SIGNIFICANCE_THRESHOLD);
    }
}
