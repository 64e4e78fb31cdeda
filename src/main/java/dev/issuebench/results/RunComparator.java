package dev.issuebench.results;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Compares configurations within one {@link BenchmarkRun}. */
public final class RunComparator {
    /** Conventional name of the configuration other configurations are measured against. */
    public static final String BASELINE = "baseline";

    /**
     * Compares the candidate's success rate against the baseline's.
     *
     * @return {@link ComparisonOutcome.NotComparable} naming whichever configurations are absent
     */
    public static ComparisonOutcome compare(
            BenchmarkRun run, String baselineName, String candidateName) {
        var baseline = run.configs().get(baselineName);
        var candidate = run.configs().get(candidateName);
        if (baseline == null || candidate == null) {
            var missing = new ArrayList<String>();
            if (baseline == null) {
                missing.add(baselineName);
            }
            if (candidate == null && !candidateName.equals(baselineName)) {
                missing.add(candidateName);
            }
            return new ComparisonOutcome.NotComparable(missing);
        }
        return new ComparisonOutcome.Compared(
                Comparison.of(
                        baselineName,
                        candidateName,
                        baseline.successRate(),
                        candidate.successRate()));
    }

    /**
     * Compares every other configuration with the baseline, ordered by configuration name. Empty
     * when the run has no configuration of that name.
     */
    public static List<Comparison> compareAllToBaseline(BenchmarkRun run, String baselineName) {
        var baseline = run.configs().get(baselineName);
        if (baseline == null) {
            return List.of();
        }
        var comparisons = new ArrayList<Comparison>();
        for (Map.Entry<String, ConfigSummary> entry : new TreeMap<>(run.configs()).entrySet()) {
            if (entry.getKey().equals(baselineName)) {
                continue;
            }
            comparisons.add(
                    Comparison.of(
                            baselineName,
                            entry.getKey(),
                            baseline.successRate(),
                            entry.getValue().successRate()));
        }
        return comparisons;
    }

    private RunComparator() {}
}
