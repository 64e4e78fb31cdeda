package dev.issuebench.results;

import dev.issuebench.corpus.Difficulty;
import java.io.PrintStream;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Human-readable rendering of a {@link BenchmarkRun}. */
public final class ConsoleReport {
    static final int NAME_WIDTH = 20;

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    public static void print(BenchmarkRun run, PrintStream out) {
        out.print(render(run));
    }

    public static String render(BenchmarkRun run) {
        var sb = new StringBuilder();
        sb.append("=".repeat(61)).append("\n");
        sb.append("BENCHMARK REPORT: ").append(run.corpusName()).append("\n");
        sb.append("Version: ")
                .append(run.corpusVersion())
                .append(" | Run: ")
                .append(TIMESTAMP_FORMAT.format(run.timestamp()))
                .append(" | Duration: ")
                .append(formatDuration(run.duration()))
                .append("\n");
        sb.append("=".repeat(61)).append("\n");

        // configs() is sorted by name
        sb.append("\n## Summary by Configuration\n\n");
        sb.append(format("%-20s %8s %8s %10s\n", "Config", "Success", "Score", "Duration"));
        sb.append("-".repeat(50)).append("\n");
        run.configs()
                .forEach(
                        (name, summary) ->
                                sb.append(
                                        format(
                                                "%-20s %7.0f%% %7.0f%% %10s\n",
                                                truncateName(name),
                                                summary.successRate() * 100,
                                                summary.averageScore() * 100,
                                                formatDuration(summary.totalDuration()))));

        sb.append("\n## Success Rate by Difficulty\n\n");
        sb.append(format("%-20s %10s %10s %10s\n", "Config", "Easy", "Medium", "Hard"));
        sb.append("-".repeat(55)).append("\n");
        run.configs()
                .forEach(
                        (name, summary) ->
                                sb.append(
                                        format(
                                                "%-20s %9.0f%% %9.0f%% %9.0f%%\n",
                                                truncateName(name),
                                                rate(summary, Difficulty.EASY) * 100,
                                                rate(summary, Difficulty.MEDIUM) * 100,
                                                rate(summary, Difficulty.HARD) * 100)));

        if (run.configs().containsKey(RunComparator.BASELINE)) {
            sb.append("\n## Improvement vs Baseline\n\n");
            for (var comparison : RunComparator.compareAllToBaseline(run, RunComparator.BASELINE)) {
                sb.append(
                        format(
                                "  %s: %s%.1f percentage points\n",
                                comparison.candidateConfig(),
                                comparison.delta() < 0 ? "" : "+",
                                comparison.delta()));
            }
        }
        sb.append("\n");
        return sb.toString();
    }

    static String truncateName(String name) {
        if (name.length() <= NAME_WIDTH) {
            return name;
        }
        return name.substring(0, NAME_WIDTH - 3) + "...";
    }

    /** Rounds to whole seconds, rendered like {@code 1h2m3s}, {@code 4m5s} or {@code 6s}. */
    static String formatDuration(Duration duration) {
        long seconds = Math.round(duration.toMillis() / 1000.0);
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return hours + "h" + minutes + "m" + secs + "s";
        }
        if (minutes > 0) {
            return minutes + "m" + secs + "s";
        }
        return secs + "s";
    }

    private static double rate(ConfigSummary summary, Difficulty difficulty) {
        return summary.byDifficulty()
                .getOrDefault(difficulty.tag(), PartitionStats.EMPTY)
                .successRate();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    private ConsoleReport() {}
}
