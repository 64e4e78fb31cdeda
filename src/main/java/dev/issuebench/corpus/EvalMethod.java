package dev.issuebench.corpus;

import java.util.Arrays;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * How an attempt at an issue is verified.
 *
 * <p>The corpus stores the method as a free-form tag. Tags that match none of the constants are
 * not an error here; the dispatcher decides what to do with them.
 */
public enum EvalMethod {
    /** Run the repository's test suite, or a per-issue check command. */
    TEST_SUITE("test_suite"),
    /** Ask an external judge process to grade the change. */
    LLM_JUDGE("llm_judge"),
    /** Run an issue-supplied shell script. */
    CUSTOM_CHECK("custom_check"),
    /** Test suite and judge, weighted. */
    HYBRID("hybrid");

    private final String tag;

    EvalMethod(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /** Resolves a corpus tag, ignoring case and surrounding whitespace. */
    public static Optional<EvalMethod> fromTag(@Nullable String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        var normalized = tag.trim();
        return Arrays.stream(values())
                .filter(method -> method.tag.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
