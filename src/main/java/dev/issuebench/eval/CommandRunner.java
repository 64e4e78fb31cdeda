package dev.issuebench.eval;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/** Runs external processes under a deadline. */
public interface CommandRunner {

    /**
     * Runs the command to completion or until its timeout expires, whichever is first. A process
     * that outlives its timeout is killed together with its descendants and reported with {@link
     * CommandResult#timedOut()} set.
     *
     * @throws EvaluationException if the process cannot be started or the caller is interrupted
     */
    CommandResult run(CommandRequest request);

    static CommandRunner local() {
        return new LocalImpl();
    }

    @Slf4j
    class LocalImpl implements CommandRunner {
        private static final Duration STREAM_DRAIN_TIMEOUT = Duration.ofSeconds(5);
        private static final ExecutorService STREAM_READERS =
                Executors.newCachedThreadPool(
                        runnable -> {
                            var thread = new Thread(runnable, "issuebench-process-io");
                            thread.setDaemon(true);
                            return thread;
                        });

        LocalImpl() {}

        @Override
        public CommandResult run(CommandRequest request) {
            log.debug("Running {} in {}", request.command(), request.workDir());
            final Process process;
            try {
                process =
                        new ProcessBuilder(request.command())
                                .directory(request.workDir().toFile())
                                .start();
            } catch (IOException e) {
                throw new EvaluationException(
                        "Failed to start " + request.command().get(0) + ": " + e.getMessage(), e);
            }
            closeStdin(process);

            var stdout = new ByteArrayOutputStream();
            var stderr = new ByteArrayOutputStream();
            var stdoutDrain = drain(process.getInputStream(), stdout);
            var stderrDrain = drain(process.getErrorStream(), stderr);

            final boolean finished;
            try {
                finished = process.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                destroyTree(process);
                Thread.currentThread().interrupt();
                throw new EvaluationException("Interrupted while running " + request.command(), e);
            }
            if (!finished) {
                log.debug("Timed out after {}: {}", request.timeout(), request.command());
                destroyTree(process);
            }
            awaitDrain(stdoutDrain);
            awaitDrain(stderrDrain);
            return new CommandResult(
                    finished ? process.exitValue() : -1,
                    stdout.toString(StandardCharsets.UTF_8),
                    stderr.toString(StandardCharsets.UTF_8),
                    !finished);
        }

        private static void closeStdin(Process process) {
            try {
                process.getOutputStream().close();
            } catch (IOException e) {
                log.debug("Unable to close stdin of pid {}", process.pid(), e);
            }
        }

        private static CompletableFuture<Void> drain(InputStream in, ByteArrayOutputStream sink) {
            return CompletableFuture.runAsync(
                    () -> {
                        try (in) {
                            in.transferTo(sink);
                        } catch (IOException e) {
                            // the stream is closed under us when the process is killed
                            log.debug("Process stream closed early", e);
                        }
                    },
                    STREAM_READERS);
        }

        private static void awaitDrain(CompletableFuture<Void> drain) {
            try {
                drain.get(STREAM_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.debug(
                        "Output still open {} after exit, keeping what was read",
                        STREAM_DRAIN_TIMEOUT);
                drain.cancel(true);
            } catch (ExecutionException e) {
                log.debug("Output reader failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EvaluationException("Interrupted while reading process output", e);
            }
        }

        private static void destroyTree(Process process) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            try {
                process.waitFor(STREAM_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Implementation for test doubling */
    class InMemoryImpl implements CommandRunner {
        private final Function<CommandRequest, CommandResult> handler;
        private final List<CommandRequest> requests =
                Collections.synchronizedList(new ArrayList<>());

        public InMemoryImpl(Function<CommandRequest, CommandResult> handler) {
            this.handler = Objects.requireNonNull(handler);
        }

        /** A runner that answers every command with the same result. */
        public static InMemoryImpl returning(CommandResult result) {
            return new InMemoryImpl(request -> result);
        }

        @Override
        public CommandResult run(CommandRequest request) {
            requests.add(request);
            return handler.apply(request);
        }

        /** Every request seen so far, in order. */
        public List<CommandRequest> requests() {
            return List.copyOf(requests);
        }
    }

    /**
     * @param command program followed by its arguments
     * @param workDir directory the process runs in
     * @param timeout wall-clock budget
     */
    record CommandRequest(
            @Nonnull List<String> command, @Nonnull Path workDir, @Nonnull Duration timeout) {
        public CommandRequest {
            command = List.copyOf(command);
            if (command.isEmpty()) {
                throw new IllegalArgumentException("command must not be empty");
            }
            Objects.requireNonNull(workDir);
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
        }
    }

    /**
     * @param exitCode process exit code, -1 when the process was killed on timeout
     * @param stdout captured standard output
     * @param stderr captured standard error
     * @param timedOut whether the deadline expired before the process exited
     */
    record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

        public static CommandResult exited(int exitCode, String stdout, String stderr) {
            return new CommandResult(exitCode, stdout, stderr, false);
        }

        public static CommandResult killedOnTimeout(String stdout, String stderr) {
            return new CommandResult(-1, stdout, stderr, true);
        }

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }

        public String combinedOutput() {
            return stdout + "\n" + stderr;
        }
    }
}
