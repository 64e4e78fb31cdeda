package dev.issuebench.eval;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Outcome of evaluating one attempt.
 *
 * @param success whether the attempt counts as solved
 * @param score normalized score between 0 (inclusive) and 1 (inclusive)
 * @param details human-readable rationale
 */
public record Verdict(boolean success, double score, @Nonnull String details) {
    /** Minimum score for a threshold-derived success. */
    public static final double ACCEPTANCE_THRESHOLD = 0.70;

    public Verdict {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0 and 1: " + score);
        }
        Objects.requireNonNull(details);
    }

    /** A verdict for a strategy with a binary pass signal that passed. */
    public static Verdict passed(String details) {
        return new Verdict(true, 1.0, details);
    }

    /** A verdict for a strategy with a binary pass signal that failed, with a partial score. */
    public static Verdict failed(double score, String details) {
        return new Verdict(false, score, details);
    }

    /** A verdict whose success is derived from the score and {@link #ACCEPTANCE_THRESHOLD}. */
    public static Verdict scored(double score, String details) {
        return new Verdict(meetsThreshold(score), score, details);
    }

    public static boolean meetsThreshold(double score) {
        return score >= ACCEPTANCE_THRESHOLD;
    }
}
