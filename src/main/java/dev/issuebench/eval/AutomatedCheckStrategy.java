package dev.issuebench.eval;

import dev.issuebench.corpus.Issue;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores an attempt by running a check command, usually the repository's test suite, in the
 * attempt's work tree.
 *
 * <p>Exit code 0 is a pass with score 1. Any other outcome fails, with partial credit taken from
 * the test output by {@link TestOutputScanner}.
 */
@Slf4j
public final class AutomatedCheckStrategy implements EvaluationStrategy {
    private final CommandRunner runner;
    private final Duration timeout;
    private final int detailsLimit;

    public AutomatedCheckStrategy(CommandRunner runner, Duration timeout, int detailsLimit) {
        this.runner = Objects.requireNonNull(runner);
        this.timeout = Objects.requireNonNull(timeout);
        this.detailsLimit = detailsLimit;
    }

    @Override
    public String name() {
        return "automated_check";
    }

    @Override
    public Verdict evaluate(Attempt attempt) {
        var issue = attempt.issue();
        var command = checkCommand(issue);
        if (command.isBlank()) {
            return Verdict.failed(0.0, "No test command specified");
        }
        var words = CommandLine.split(command).orElse(null);
        if (words == null || words.isEmpty() || words.get(0).isEmpty()) {
            return Verdict.failed(0.0, "Unparseable test command: " + command);
        }

        final CommandRunner.CommandResult result;
        try {
            result =
                    runner.run(
                            new CommandRunner.CommandRequest(words, attempt.workDir(), timeout));
        } catch (EvaluationException e) {
            log.debug("Check command for {} could not run", issue.id(), e);
            return Verdict.failed(0.0, "Test command failed to run: " + e.getMessage());
        }

        if (result.succeeded()) {
            return Verdict.passed("All tests passed");
        }
        var output = result.combinedOutput();
        var score = TestOutputScanner.score(output, issue.language());
        var cause =
                result.timedOut()
                        ? "Tests timed out after " + Outputs.describe(timeout)
                        : "Tests failed: exit code " + result.exitCode();
        return Verdict.failed(score, cause + "\n" + Outputs.truncate(output, detailsLimit));
    }

    /** The issue's own command, or the conventional test command for its language. */
    static String checkCommand(Issue issue) {
        var command = issue.testCommand();
        if (command != null && !command.isEmpty()) {
            return command;
        }
        switch (issue.language().trim().toLowerCase(Locale.ROOT)) {
            case "go":
                return "go test ./...";
            case "typescript":
            case "javascript":
                return "npm test";
            case "python":
                return "pytest";
            case "rust":
                return "cargo test";
            case "java":
                return "mvn -B test";
            default:
                return "make test";
        }
    }
}
