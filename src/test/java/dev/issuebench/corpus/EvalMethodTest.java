package dev.issuebench.corpus;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class EvalMethodTest {

    @ParameterizedTest
    @CsvSource({
        "test_suite, TEST_SUITE",
        "llm_judge, LLM_JUDGE",
        "custom_check, CUSTOM_CHECK",
        "hybrid, HYBRID",
        "' Hybrid ', HYBRID",
        "LLM_JUDGE, LLM_JUDGE"
    })
    void resolvesKnownTags(String tag, EvalMethod expected) {
        assertThat(EvalMethod.fromTag(tag)).contains(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"manual", "test-suite", "judge"})
    void unknownTagsResolveToEmpty(String tag) {
        assertThat(EvalMethod.fromTag(tag)).isEmpty();
    }

    @Test
    void tagsRoundTrip() {
        for (var method : EvalMethod.values()) {
            assertThat(EvalMethod.fromTag(method.tag())).contains(method);
        }
    }
}
