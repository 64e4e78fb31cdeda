package dev.issuebench.eval;

import java.util.Objects;

/**
 * Runs the automated check and then the judge, and weights their scores 60/40.
 *
 * <p>The two evaluations run one after the other on the calling thread.
 */
public final class HybridStrategy implements EvaluationStrategy {
    public static final double CHECK_WEIGHT = 0.6;
    public static final double JUDGE_WEIGHT = 0.4;

    private final EvaluationStrategy check;
    private final EvaluationStrategy judge;

    public HybridStrategy(EvaluationStrategy check, EvaluationStrategy judge) {
        this.check = Objects.requireNonNull(check);
        this.judge = Objects.requireNonNull(judge);
    }

    @Override
    public String name() {
        return "hybrid";
    }

    @Override
    public Verdict evaluate(Attempt attempt) {
        var checkVerdict = check.evaluate(attempt);
        var judgeVerdict = judge.evaluate(attempt);
        return combine(checkVerdict, judgeVerdict);
    }

    static Verdict combine(Verdict checkVerdict, Verdict judgeVerdict) {
        var combined = combinedScore(checkVerdict.score(), judgeVerdict.score());
        var details =
                String.format(
                        "Test score: %.0f%%, Judge score: %.0f%%\nTests: %s\nJudge: %s",
                        checkVerdict.score() * 100,
                        judgeVerdict.score() * 100,
                        checkVerdict.details(),
                        judgeVerdict.details());
        return Verdict.scored(combined, details);
    }

    public static double combinedScore(double checkScore, double judgeScore) {
        // weights sum to 1, the min guards against rounding just above it
        return Math.min(1.0, CHECK_WEIGHT * checkScore + JUDGE_WEIGHT * judgeScore);
    }
}
