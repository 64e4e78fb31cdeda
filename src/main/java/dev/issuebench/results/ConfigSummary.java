package dev.issuebench.results;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import javax.annotation.Nonnull;

/**
 * Aggregate statistics for every attempt run under one configuration.
 *
 * <p>Summaries are values: {@link SummaryAggregator} derives a new one per result rather than
 * changing an existing one. The constructor checks that each partition map accounts for every
 * result exactly once. {@link #results()} is unmodifiable and shares storage with the summary
 * it was folded from.
 *
 * @param configName the configuration
 * @param results attempts in the order they were folded in
 * @param totalIssues number of attempts
 * @param successCount number of successful attempts
 * @param successRate {@code successCount / totalIssues}, 0 when empty
 * @param averageScore mean score
 * @param totalDuration summed attempt durations
 * @param byDifficulty stats keyed by difficulty tag
 * @param byTaskType stats keyed by task type tag
 * @param byLanguage stats keyed by language
 */
public record ConfigSummary(
        @Nonnull String configName,
        @Nonnull List<AttemptResult> results,
        int totalIssues,
        int successCount,
        double successRate,
        double averageScore,
        @Nonnull Duration totalDuration,
        @Nonnull Map<String, PartitionStats> byDifficulty,
        @Nonnull Map<String, PartitionStats> byTaskType,
        @Nonnull Map<String, PartitionStats> byLanguage) {

    public ConfigSummary {
        Objects.requireNonNull(configName, "configName");
        Objects.requireNonNull(totalDuration, "totalDuration");
        results = ResultLog.copyOf(results);
        byDifficulty = sortedCopy(byDifficulty);
        byTaskType = sortedCopy(byTaskType);
        byLanguage = sortedCopy(byLanguage);
        if (totalIssues < 0 || successCount < 0 || successCount > totalIssues) {
            throw new IllegalArgumentException(
                    "invalid counts for %s: total=%d successes=%d"
                            .formatted(configName, totalIssues, successCount));
        }
        requireCovers("by_difficulty", byDifficulty, totalIssues);
        requireCovers("by_task_type", byTaskType, totalIssues);
        requireCovers("by_language", byLanguage, totalIssues);
    }

    public static ConfigSummary empty(String configName) {
        return new ConfigSummary(
                configName, List.of(), 0, 0, 0.0, 0.0, Duration.ZERO, Map.of(), Map.of(), Map.of());
    }

    private static Map<String, PartitionStats> sortedCopy(Map<String, PartitionStats> partition) {
        return Collections.unmodifiableMap(new TreeMap<>(partition));
    }

    private static void requireCovers(
            String partitionName, Map<String, PartitionStats> partition, int totalIssues) {
        int covered = partition.values().stream().mapToInt(PartitionStats::total).sum();
        if (covered != totalIssues) {
            throw new IllegalArgumentException(
                    "%s covers %d results but the summary has %d"
                            .formatted(partitionName, covered, totalIssues));
        }
    }
}
