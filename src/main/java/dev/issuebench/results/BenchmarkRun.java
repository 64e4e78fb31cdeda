package dev.issuebench.results;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nonnull;

/**
 * Everything one benchmark run produced: a summary per configuration.
 *
 * @param timestamp when the run started
 * @param corpusName corpus the issues came from
 * @param corpusVersion version of that corpus
 * @param duration wall-clock time of the whole run
 * @param configs summaries keyed by configuration name
 */
public record BenchmarkRun(
        @Nonnull Instant timestamp,
        @Nonnull String corpusName,
        @Nonnull String corpusVersion,
        @Nonnull Duration duration,
        @Nonnull Map<String, ConfigSummary> configs) {

    public BenchmarkRun {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(corpusName, "corpusName");
        Objects.requireNonNull(corpusVersion, "corpusVersion");
        Objects.requireNonNull(duration, "duration");
        configs = Collections.unmodifiableMap(new TreeMap<>(configs));
        configs.forEach(
                (name, summary) -> {
                    if (!name.equals(summary.configName())) {
                        throw new IllegalArgumentException(
                                "summary for %s stored under %s"
                                        .formatted(summary.configName(), name));
                    }
                });
    }

    public Optional<ConfigSummary> findConfig(String configName) {
        return Optional.ofNullable(configs.get(configName));
    }

    public static Builder builder(String corpusName, String corpusVersion) {
        return new Builder(corpusName, corpusVersion, Clock.systemUTC());
    }

    static Builder builder(String corpusName, String corpusVersion, Clock clock) {
        return new Builder(corpusName, corpusVersion, clock);
    }

    /**
     * Accumulates results as a run progresses. The start time is taken when the builder is
     * created and the run's duration when {@link #build()} is called. Not thread safe.
     */
    public static final class Builder {
        private final String corpusName;
        private final String corpusVersion;
        private final Clock clock;
        private final Instant startedAt;
        private final Map<String, ConfigSummary> configs = new LinkedHashMap<>();

        private Builder(String corpusName, String corpusVersion, Clock clock) {
            this.corpusName = Objects.requireNonNull(corpusName);
            this.corpusVersion = Objects.requireNonNull(corpusVersion);
            this.clock = clock;
            this.startedAt = clock.instant();
        }

        /** Registers a configuration so it is reported even if no result arrives for it. */
        public Builder config(String configName) {
            configs.putIfAbsent(configName, ConfigSummary.empty(configName));
            return this;
        }

        public Builder add(AttemptResult result) {
            configs.compute(
                    result.configName(),
                    (name, summary) ->
                            SummaryAggregator.fold(
                                    summary == null ? ConfigSummary.empty(name) : summary,
                                    result));
            return this;
        }

        public Builder addAll(Iterable<AttemptResult> results) {
            results.forEach(this::add);
            return this;
        }

        public BenchmarkRun build() {
            return new BenchmarkRun(
                    startedAt,
                    corpusName,
                    corpusVersion,
                    Duration.between(startedAt, clock.instant()),
                    configs);
        }
    }
}
