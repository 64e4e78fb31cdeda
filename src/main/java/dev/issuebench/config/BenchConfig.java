package dev.issuebench.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Evaluation engine settings, read from {@code ISSUEBENCH_*} environment variables. */
@Getter
@Accessors(fluent = true)
public final class BenchConfig extends BaseConfig {
    private final String judgeBinary = getConfig("ISSUEBENCH_JUDGE_BINARY", "claude");
    private final String shell = getConfig("ISSUEBENCH_SHELL", "bash");
    private final Duration checkTimeout =
            Duration.ofSeconds(getConfig("ISSUEBENCH_CHECK_TIMEOUT_SECONDS", 300));
    private final Duration judgeTimeout =
            Duration.ofSeconds(getConfig("ISSUEBENCH_JUDGE_TIMEOUT_SECONDS", 120));
    private final Duration scriptTimeout =
            Duration.ofSeconds(getConfig("ISSUEBENCH_SCRIPT_TIMEOUT_SECONDS", 120));
    private final int diffLimit = getConfig("ISSUEBENCH_DIFF_LIMIT", 3000);
    private final int outputLimit = getConfig("ISSUEBENCH_OUTPUT_LIMIT", 2000);
    private final int detailsLimit = getConfig("ISSUEBENCH_DETAILS_LIMIT", 500);
    private final boolean enableTraceConsoleLog =
            getConfig("ISSUEBENCH_ENABLE_TRACE_CONSOLE_LOG", false);

    public static BenchConfig fromEnvironment() {
        return of();
    }

    public static BenchConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new BenchConfig(overridesMap);
    }

    private BenchConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        requirePositive("ISSUEBENCH_CHECK_TIMEOUT_SECONDS", checkTimeout.getSeconds());
        requirePositive("ISSUEBENCH_JUDGE_TIMEOUT_SECONDS", judgeTimeout.getSeconds());
        requirePositive("ISSUEBENCH_SCRIPT_TIMEOUT_SECONDS", scriptTimeout.getSeconds());
        requirePositive("ISSUEBENCH_DIFF_LIMIT", diffLimit);
        requirePositive("ISSUEBENCH_OUTPUT_LIMIT", outputLimit);
        requirePositive("ISSUEBENCH_DETAILS_LIMIT", detailsLimit);
        if (judgeBinary.isBlank() || shell.isBlank()) {
            throw new IllegalArgumentException("judge binary and shell must not be blank");
        }
    }

    private static void requirePositive(String settingName, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(
                    "%s must be positive, got %d".formatted(settingName, value));
        }
    }
}
