package dev.issuebench.results;

import static dev.issuebench.results.ResultFixtures.result;
import static org.assertj.core.api.Assertions.*;

import dev.issuebench.corpus.Difficulty;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConsoleReportTest {
    private static final String LONG_NAME = "a-very-long-configuration-name";

    private static ConfigSummary summary(String configName, AttemptResult... results) {
        return SummaryAggregator.summarize(configName, List.of(results));
    }

    private static BenchmarkRun run(boolean withBaseline) {
        var configs = new HashMap<String, ConfigSummary>();
        configs.put(
                LONG_NAME,
                summary(
                        LONG_NAME,
                        result(LONG_NAME, "a", Difficulty.EASY, true, 1.0),
                        result(LONG_NAME, "b", Difficulty.MEDIUM, true, 0.8)));
        configs.put(
                "worse",
                summary(
                        "worse",
                        result("worse", "a", Difficulty.EASY, false, 0.2),
                        result("worse", "b", Difficulty.MEDIUM, false, 0.0)));
        if (withBaseline) {
            configs.put(
                    "baseline",
                    summary(
                            "baseline",
                            result("baseline", "a", Difficulty.EASY, true, 1.0),
                            result("baseline", "c", Difficulty.HARD, false, 0.0)));
        }
        return new BenchmarkRun(
                Instant.parse("2025-01-15T10:30:00Z"),
                "go-corpus",
                "1.2",
                Duration.ofSeconds(3725),
                configs);
    }

    @Test
    void rendersTheFullReport() {
        var expected =
                """
                =============================================================
                BENCHMARK REPORT: go-corpus
                Version: 1.2 | Run: 2025-01-15 10:30 | Duration: 1h2m5s
                =============================================================

                ## Summary by Configuration

                Config                Success    Score   Duration
                --------------------------------------------------
                a-very-long-confi...     100%      90%        20s
                baseline                  50%      50%        20s
                worse                      0%      10%        20s

                ## Success Rate by Difficulty

                Config                     Easy     Medium       Hard
                -------------------------------------------------------
                a-very-long-confi...       100%       100%         0%
                baseline                   100%         0%         0%
                worse                        0%         0%         0%

                ## Improvement vs Baseline

                  a-very-long-configuration-name: +50.0 percentage points
                  worse: -50.0 percentage points

                """;

        assertThat(ConsoleReport.render(run(true))).isEqualTo(expected);
    }

    @Test
    void baselineSectionNeedsABaseline() {
        var report = ConsoleReport.render(run(false));

        assertThat(report).contains("## Success Rate by Difficulty");
        assertThat(report).doesNotContain("Improvement vs Baseline");
    }

    @Test
    void printWritesTheRenderedReport() {
        var buffer = new ByteArrayOutputStream();
        var run = run(true);

        ConsoleReport.print(run, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo(ConsoleReport.render(run));
    }

    @Test
    void namesAreTruncatedToTheColumn() {
        assertThat(ConsoleReport.truncateName("baseline")).isEqualTo("baseline");
        assertThat(ConsoleReport.truncateName("x".repeat(20))).isEqualTo("x".repeat(20));
        assertThat(ConsoleReport.truncateName("x".repeat(21))).isEqualTo("x".repeat(17) + "...");
    }

    @Test
    void durationsRoundToWholeSeconds() {
        assertThat(ConsoleReport.formatDuration(Duration.ZERO)).isEqualTo("0s");
        assertThat(ConsoleReport.formatDuration(Duration.ofMillis(1499))).isEqualTo("1s");
        assertThat(ConsoleReport.formatDuration(Duration.ofMillis(59_600))).isEqualTo("1m0s");
        assertThat(ConsoleReport.formatDuration(Duration.ofSeconds(125))).isEqualTo("2m5s");
        assertThat(ConsoleReport.formatDuration(Duration.ofHours(2))).isEqualTo("2h0m0s");
    }
}
