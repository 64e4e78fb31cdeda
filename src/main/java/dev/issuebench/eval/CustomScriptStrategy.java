package dev.issuebench.eval;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores an attempt with an issue-supplied shell script. The script passes by exiting 0.
 *
 * <p>The script is written to a temporary file inside the work tree so it can use relative
 * paths, and that file is removed again however the run ends.
 */
@Slf4j
public final class CustomScriptStrategy implements EvaluationStrategy {
    static final String SCRIPT_PREFIX = ".issuebench_check_";

    private final CommandRunner runner;
    private final String shell;
    private final Duration timeout;

    public CustomScriptStrategy(CommandRunner runner, String shell, Duration timeout) {
        this.runner = Objects.requireNonNull(runner);
        this.shell = Objects.requireNonNull(shell);
        this.timeout = Objects.requireNonNull(timeout);
    }

    @Override
    public String name() {
        return "custom_script";
    }

    @Override
    public Verdict evaluate(Attempt attempt) {
        var body = attempt.issue().checkScript();
        if (body == null || body.isBlank()) {
            return Verdict.failed(0.0, "No check script specified");
        }

        final Path script;
        try {
            script = writeScript(attempt.workDir(), body);
        } catch (IOException e) {
            return Verdict.failed(0.0, "Failed to write check script: " + e.getMessage());
        }
        try {
            return run(attempt, script);
        } finally {
            delete(script);
        }
    }

    private Verdict run(Attempt attempt, Path script) {
        final CommandRunner.CommandResult result;
        try {
            result =
                    runner.run(
                            new CommandRunner.CommandRequest(
                                    List.of(shell, script.toString()), attempt.workDir(), timeout));
        } catch (EvaluationException e) {
            return Verdict.failed(0.0, "Check failed to run: " + e.getMessage());
        }
        if (result.timedOut()) {
            return Verdict.failed(0.0, "Check script timed out after " + Outputs.describe(timeout));
        }
        if (result.exitCode() != 0) {
            return Verdict.failed(
                    0.0, "Check failed: exit code " + result.exitCode() + "\n" + result.stderr());
        }
        return Verdict.passed(result.stdout());
    }

    private static Path writeScript(Path workDir, String body) throws IOException {
        var script = Files.createTempFile(workDir, SCRIPT_PREFIX, ".sh");
        Files.writeString(script, body, StandardCharsets.UTF_8);
        try {
            Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            if (!script.toFile().setExecutable(true)) {
                log.debug("Could not mark {} executable", script);
            }
        }
        return script;
    }

    private static void delete(Path script) {
        try {
            Files.deleteIfExists(script);
        } catch (IOException e) {
            log.warn("Unable to remove check script {}", script, e);
        }
    }
}
