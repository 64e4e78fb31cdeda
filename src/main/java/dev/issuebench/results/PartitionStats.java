package dev.issuebench.results;

/**
 * Aggregate for the results sharing one tag (a difficulty, a task type or a language).
 *
 * @param total number of results
 * @param successes number of successful results
 * @param successRate {@code successes / total}, 0 when there are no results
 * @param avgScore mean score
 */
public record PartitionStats(int total, int successes, double successRate, double avgScore) {
    public static final PartitionStats EMPTY = new PartitionStats(0, 0, 0.0, 0.0);

    public PartitionStats {
        if (total < 0 || successes < 0 || successes > total) {
            throw new IllegalArgumentException(
                    "invalid partition counts: total=%d successes=%d".formatted(total, successes));
        }
    }

    /** The stats after one more result. */
    PartitionStats plus(boolean success, double score) {
        int newTotal = total + 1;
        int newSuccesses = success ? successes + 1 : successes;
        return new PartitionStats(
                newTotal,
                newSuccesses,
                rate(newSuccesses, newTotal),
                runningMean(avgScore, score, newTotal));
    }

    static double rate(int successes, int total) {
        return total == 0 ? 0.0 : (double) successes / total;
    }

    /** Mean of {@code n} values given the mean of the first {@code n - 1} and the n-th value. */
    static double runningMean(double previousMean, double value, int n) {
        return (previousMean * (n - 1) + value) / n;
    }
}
