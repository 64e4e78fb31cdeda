package dev.issuebench.results;

import java.util.HashMap;
import java.util.Map;

/**
 * Folds attempt results into {@link ConfigSummary} values.
 *
 * <p>Every fold returns a new summary. Folding a batch is defined as folding its results one at
 * a time in order, so both paths produce identical statistics. Means are kept as running means,
 * {@code (mean * (n - 1) + score) / n}, never recomputed from a running sum.
 *
 * <p>A fold does not copy the results already folded: the new summary's result list extends the
 * old one in place. Only the partition maps are copied, and those hold one entry per distinct
 * tag.
 *
 * <p>Summaries are immutable, but a caller that keeps a shared "current summary" reference and
 * folds into it from several threads must serialize those folds itself.
 */
public final class SummaryAggregator {

    public static ConfigSummary summarize(String configName, Iterable<AttemptResult> results) {
        return foldAll(ConfigSummary.empty(configName), results);
    }

    public static ConfigSummary foldAll(ConfigSummary summary, Iterable<AttemptResult> results) {
        var current = summary;
        for (var result : results) {
            current = fold(current, result);
        }
        return current;
    }

    /**
     * @throws IllegalArgumentException if the result belongs to another configuration
     */
    public static ConfigSummary fold(ConfigSummary summary, AttemptResult result) {
        if (!summary.configName().equals(result.configName())) {
            throw new IllegalArgumentException(
                    "result for %s/%s cannot be folded into summary %s"
                            .formatted(
                                    result.configName(),
                                    result.issueId(),
                                    summary.configName()));
        }
        var results = ResultLog.copyOf(summary.results()).append(result);

        int total = summary.totalIssues() + 1;
        int successes = result.success() ? summary.successCount() + 1 : summary.successCount();
        return new ConfigSummary(
                summary.configName(),
                results,
                total,
                successes,
                PartitionStats.rate(successes, total),
                PartitionStats.runningMean(summary.averageScore(), result.score(), total),
                summary.totalDuration().plus(result.duration()),
                plus(summary.byDifficulty(), result.difficulty().tag(), result),
                plus(summary.byTaskType(), result.taskType().tag(), result),
                plus(summary.byLanguage(), result.language(), result));
    }

    private static Map<String, PartitionStats> plus(
            Map<String, PartitionStats> partition, String tag, AttemptResult result) {
        var updated = new HashMap<>(partition);
        updated.put(
                tag,
                partition
                        .getOrDefault(tag, PartitionStats.EMPTY)
                        .plus(result.success(), result.score()));
        return updated;
    }

    private SummaryAggregator() {}
}
