package dev.issuebench.eval;

import java.time.Duration;
import javax.annotation.Nullable;

final class Outputs {
    static final String TRUNCATION_MARKER = "... [truncated]";

    /** Limits {@code text} to {@code maxLength} chars, marking the cut. Null reads as empty. */
    static String truncate(@Nullable String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + TRUNCATION_MARKER;
    }

    /** Formats a budget the way rationales name it: {@code 5m}, {@code 90s}, {@code 250ms}. */
    static String describe(Duration duration) {
        if (duration.toMillis() % 1000 != 0) {
            return duration.toMillis() + "ms";
        }
        long seconds = duration.getSeconds();
        return seconds % 60 == 0 ? (seconds / 60) + "m" : seconds + "s";
    }

    private Outputs() {}
}
