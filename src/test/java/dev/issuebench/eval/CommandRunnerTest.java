package dev.issuebench.eval;

import static org.assertj.core.api.Assertions.*;

import dev.issuebench.eval.CommandRunner.CommandRequest;
import dev.issuebench.eval.CommandRunner.CommandResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class CommandRunnerTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @TempDir Path workDir;

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void capturesExitCodeAndBothStreams() {
        var result =
                CommandRunner.local()
                        .run(
                                new CommandRequest(
                                        List.of("sh", "-c", "echo out; echo err >&2; exit 3"),
                                        workDir,
                                        TIMEOUT));

        assertThat(result).isEqualTo(CommandResult.exited(3, "out\n", "err\n"));
        assertThat(result.succeeded()).isFalse();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void runsInTheWorkDir() throws IOException {
        var result =
                CommandRunner.local().run(new CommandRequest(List.of("pwd"), workDir, TIMEOUT));

        assertThat(result.succeeded()).isTrue();
        assertThat(Path.of(result.stdout().strip()).toRealPath()).isEqualTo(workDir.toRealPath());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void killsTheProcessTreeOnTimeout() {
        long start = System.nanoTime();
        var result =
                CommandRunner.local()
                        .run(
                                new CommandRequest(
                                        List.of("sh", "-c", "echo started; sleep 30; echo late"),
                                        workDir,
                                        Duration.ofMillis(500)));
        var elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(result.timedOut()).isTrue();
        assertThat(result.exitCode()).isEqualTo(-1);
        assertThat(result.stdout()).doesNotContain("late");
        assertThat(elapsed).isLessThan(Duration.ofSeconds(15));
    }

    @Test
    void missingProgramIsAnEvaluationException() {
        var request =
                new CommandRequest(List.of("/nonexistent/issuebench-binary"), workDir, TIMEOUT);

        assertThatThrownBy(() -> CommandRunner.local().run(request))
                .isInstanceOf(EvaluationException.class)
                .hasMessageStartingWith("Failed to start /nonexistent/issuebench-binary");
    }

    @Test
    void requestValidation() {
        assertThatThrownBy(() -> new CommandRequest(List.of(), workDir, TIMEOUT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CommandRequest(List.of("true"), workDir, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resultHelpers() {
        assertThat(CommandResult.exited(0, "a", "b").succeeded()).isTrue();
        assertThat(CommandResult.exited(0, "a", "b").combinedOutput()).isEqualTo("a\nb");
        assertThat(CommandResult.killedOnTimeout("", "").succeeded()).isFalse();
        assertThat(CommandResult.killedOnTimeout("", "").exitCode()).isEqualTo(-1);
    }

    @Test
    void inMemoryRunnerRecordsRequests() {
        var runner = CommandRunner.InMemoryImpl.returning(CommandResult.exited(0, "", ""));
        var request = new CommandRequest(List.of("make", "test"), workDir, TIMEOUT);

        runner.run(request);

        assertThat(runner.requests()).containsExactly(request);
    }
}
