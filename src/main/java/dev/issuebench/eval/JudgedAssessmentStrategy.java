package dev.issuebench.eval;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores an attempt by asking an external judge process to grade the diff and the agent's
 * output against the issue's success criteria.
 */
@Slf4j
public final class JudgedAssessmentStrategy implements EvaluationStrategy {
    private final CommandRunner runner;
    private final DiffProvider diffProvider;
    private final String judgeBinary;
    private final Duration timeout;
    private final int diffLimit;
    private final int outputLimit;

    public JudgedAssessmentStrategy(
            CommandRunner runner,
            DiffProvider diffProvider,
            String judgeBinary,
            Duration timeout,
            int diffLimit,
            int outputLimit) {
        this.runner = Objects.requireNonNull(runner);
        this.diffProvider = Objects.requireNonNull(diffProvider);
        this.judgeBinary = Objects.requireNonNull(judgeBinary);
        this.timeout = Objects.requireNonNull(timeout);
        this.diffLimit = diffLimit;
        this.outputLimit = outputLimit;
    }

    @Override
    public String name() {
        return "judged_assessment";
    }

    @Override
    public Verdict evaluate(Attempt attempt) {
        var prompt =
                JudgePrompt.build(
                        attempt.issue(),
                        diff(attempt),
                        attempt.agentOutput(),
                        diffLimit,
                        outputLimit);

        final CommandRunner.CommandResult result;
        try {
            result =
                    runner.run(
                            new CommandRunner.CommandRequest(
                                    List.of(judgeBinary, "--print", prompt),
                                    attempt.workDir(),
                                    timeout));
        } catch (EvaluationException e) {
            log.debug("Judge for {} could not run", attempt.issue().id(), e);
            return Verdict.failed(0.0, "Judge failed: " + e.getMessage());
        }
        if (result.timedOut()) {
            return Verdict.failed(0.0, "Judge timed out after " + Outputs.describe(timeout));
        }
        if (result.exitCode() != 0) {
            return Verdict.failed(
                    0.0,
                    "Judge failed: exit code " + result.exitCode() + " " + result.stderr().strip());
        }

        var response = JudgeResponseParser.parse(result.stdout());
        return Verdict.scored(response.score(), response.reason());
    }

    private String diff(Attempt attempt) {
        try {
            return diffProvider.diff(attempt.workDir());
        } catch (RuntimeException e) {
            log.warn("Diff for {} failed, judging without it", attempt.issue().id(), e);
            return "";
        }
    }
}
