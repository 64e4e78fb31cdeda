package dev.issuebench.results;

import java.util.List;
import java.util.Optional;

/** Result of asking for a comparison that may not be possible. */
public sealed interface ComparisonOutcome
        permits ComparisonOutcome.Compared, ComparisonOutcome.NotComparable {

    /** The comparison, when both configurations were present. */
    default Optional<Comparison> toOptional() {
        if (this instanceof Compared compared) {
            return Optional.of(compared.comparison());
        }
        return Optional.empty();
    }

    record Compared(Comparison comparison) implements ComparisonOutcome {}

    /**
     * @param missingConfigs the requested configurations the run does not contain
     */
    record NotComparable(List<String> missingConfigs) implements ComparisonOutcome {
        public NotComparable {
            missingConfigs = List.copyOf(missingConfigs);
        }
    }
}
