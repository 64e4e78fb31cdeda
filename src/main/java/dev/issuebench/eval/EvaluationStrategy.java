package dev.issuebench.eval;

/**
 * Turns the evidence of one attempt into a {@link Verdict}.
 *
 * <p>Implementations are total: every failure, whether a missing command, a crashed process or
 * an expired deadline, is reported as a low-scoring verdict rather than thrown.
 */
public interface EvaluationStrategy {
    String name();

    Verdict evaluate(Attempt attempt);
}
