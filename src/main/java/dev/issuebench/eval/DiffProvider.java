package dev.issuebench.eval;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Reports the changes an attempt made to its work tree. */
public interface DiffProvider {

    /**
     * Returns the attempt's changes relative to the pre-attempt state. Never fails: when the
     * changes cannot be determined the diff is empty.
     */
    String diff(Path workDir);

    static DiffProvider git(CommandRunner runner) {
        return new GitImpl(runner);
    }

    /** Diffs against {@code HEAD}, falling back to the unstaged diff when there is no commit. */
    @Slf4j
    class GitImpl implements DiffProvider {
        private static final Duration GIT_TIMEOUT = Duration.ofSeconds(30);

        private final CommandRunner runner;

        GitImpl(CommandRunner runner) {
            this.runner = Objects.requireNonNull(runner);
        }

        @Override
        public String diff(Path workDir) {
            try {
                var result = git(workDir, "diff", "HEAD");
                if (result.succeeded()) {
                    return result.stdout();
                }
                log.debug("git diff HEAD failed in {}, trying plain git diff", workDir);
                var fallback = git(workDir, "diff");
                if (fallback.succeeded()) {
                    return fallback.stdout();
                }
                log.warn(
                        "Unable to diff {} (exit {}): {}",
                        workDir,
                        fallback.exitCode(),
                        fallback.stderr().strip());
            } catch (EvaluationException e) {
                log.warn("Unable to diff {}, using an empty diff", workDir, e);
            }
            return "";
        }

        private CommandRunner.CommandResult git(Path workDir, String... args) {
            var command = new ArrayList<String>();
            command.add("git");
            command.addAll(List.of(args));
            return runner.run(new CommandRunner.CommandRequest(command, workDir, GIT_TIMEOUT));
        }
    }

    /** Implementation for test doubling */
    class InMemoryImpl implements DiffProvider {
        private final Map<Path, String> diffs;

        public InMemoryImpl(Map<Path, String> diffs) {
            this.diffs = Map.copyOf(diffs);
        }

        @Override
        public String diff(Path workDir) {
            return diffs.getOrDefault(workDir, "");
        }
    }
}
