package dev.issuebench.results;

import dev.issuebench.corpus.Difficulty;
import dev.issuebench.corpus.TaskType;
import java.time.Duration;

/** Builds attempt results for tests. */
final class ResultFixtures {

    static AttemptResult result(
            String configName,
            String issueId,
            Difficulty difficulty,
            boolean success,
            double score) {
        return result(configName, issueId, difficulty, TaskType.BUG_FIX, "go", success, score);
    }

    static AttemptResult result(
            String configName,
            String issueId,
            Difficulty difficulty,
            TaskType taskType,
            String language,
            boolean success,
            double score) {
        return new AttemptResult(
                issueId,
                configName,
                difficulty,
                taskType,
                language,
                success,
                score,
                success ? "All tests passed" : "Tests failed: exit code 1",
                "agent output for " + issueId,
                null,
                Duration.ofSeconds(10),
                "/tmp/work/" + configName + "/" + issueId);
    }

    /** {@code successes} passing results followed by failures, {@code total} in all. */
    static BenchmarkRun.Builder addRate(
            BenchmarkRun.Builder builder, String configName, int successes, int total) {
        for (int i = 0; i < total; i++) {
            boolean success = i < successes;
            builder.add(
                    result(
                            configName,
                            "issue-" + i,
                            Difficulty.MEDIUM,
                            success,
                            success ? 1.0 : 0.0));
        }
        return builder;
    }

    private ResultFixtures() {}
}
