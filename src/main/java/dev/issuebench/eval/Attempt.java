package dev.issuebench.eval;

import dev.issuebench.corpus.Issue;
import java.nio.file.Path;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * The evidence left behind by one coding attempt.
 *
 * @param issue the issue that was attempted
 * @param workDir the attempt's working tree
 * @param agentOutput everything the coding agent printed, empty if nothing
 */
public record Attempt(@Nonnull Issue issue, @Nonnull Path workDir, @Nonnull String agentOutput) {
    public Attempt {
        Objects.requireNonNull(issue);
        Objects.requireNonNull(workDir);
        agentOutput = agentOutput == null ? "" : agentOutput;
    }

    public static Attempt of(Issue issue, Path workDir) {
        return new Attempt(issue, workDir, "");
    }
}
