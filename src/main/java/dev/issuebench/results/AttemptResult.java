package dev.issuebench.results;

import dev.issuebench.corpus.Difficulty;
import dev.issuebench.corpus.Issue;
import dev.issuebench.corpus.TaskType;
import dev.issuebench.eval.Verdict;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The evaluated outcome of one issue under one configuration.
 *
 * <p>The issue's classification tags are copied in so results can be aggregated without the
 * corpus at hand.
 *
 * @param issueId the attempted issue
 * @param configName configuration the attempt ran under
 * @param difficulty copied from the issue
 * @param taskType copied from the issue
 * @param language copied from the issue
 * @param success verdict success flag
 * @param score verdict score in [0, 1]
 * @param evalDetails verdict rationale
 * @param agentOutput what the coding agent printed
 * @param error why the attempt itself failed, if it did
 * @param duration wall-clock time of the attempt including evaluation
 * @param workDir where the attempt ran, kept for diagnosis
 */
public record AttemptResult(
        @Nonnull String issueId,
        @Nonnull String configName,
        @Nonnull Difficulty difficulty,
        @Nonnull TaskType taskType,
        @Nonnull String language,
        boolean success,
        double score,
        @Nonnull String evalDetails,
        @Nonnull String agentOutput,
        @Nullable String error,
        @Nonnull Duration duration,
        @Nonnull String workDir) {

    public AttemptResult {
        Objects.requireNonNull(issueId, "issueId");
        Objects.requireNonNull(configName, "configName");
        Objects.requireNonNull(difficulty, "difficulty");
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(duration, "duration");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0 and 1: " + score);
        }
        evalDetails = evalDetails == null ? "" : evalDetails;
        agentOutput = agentOutput == null ? "" : agentOutput;
        workDir = workDir == null ? "" : workDir;
    }

    /** Records an attempt that ran and was evaluated. */
    public static AttemptResult of(
            Issue issue,
            String configName,
            Verdict verdict,
            String agentOutput,
            @Nullable String error,
            Duration duration,
            String workDir) {
        return new AttemptResult(
                issue.id(),
                configName,
                issue.difficulty(),
                issue.taskType(),
                issue.language(),
                verdict.success(),
                verdict.score(),
                verdict.details(),
                agentOutput,
                error,
                duration,
                workDir);
    }

    /** Records an attempt that could not be set up or evaluated; it counts as a zero. */
    public static AttemptResult failed(
            Issue issue, String configName, String error, Duration duration, String workDir) {
        return new AttemptResult(
                issue.id(),
                configName,
                issue.difficulty(),
                issue.taskType(),
                issue.language(),
                false,
                0.0,
                "",
                "",
                Objects.requireNonNull(error),
                duration,
                workDir);
    }
}
