package dev.issuebench.eval;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class JudgeResponseParserTest {

    @Test
    void percentageScoreIsNormalized() {
        var response = JudgeResponseParser.parse("SCORE: 85\nREASON: good fix");

        assertThat(response.score()).isEqualTo(0.85);
        assertThat(response.reason()).isEqualTo("good fix");
    }

    @Test
    void fractionalScoreIsUsedAsIs() {
        var response =
                JudgeResponseParser.parse("Here is my review.\nscore: 0.5\nreason: half done");

        assertThat(response.score()).isEqualTo(0.5);
        assertThat(response.reason()).isEqualTo("half done");
    }

    @Test
    void scoreLineToleratesDecoration() {
        assertThat(JudgeResponseParser.parse("  Score:  [70]  \nReason: ok").score())
                .isEqualTo(0.7);
        assertThat(JudgeResponseParser.parse("SCORE: 90/100").score()).isEqualTo(0.9);
    }

    @Test
    void scoreIsClamped() {
        assertThat(JudgeResponseParser.parse("SCORE: 150").score()).isEqualTo(1.0);
        assertThat(JudgeResponseParser.parse("SCORE: -3").score()).isEqualTo(0.0);
    }

    @Test
    void scoreLineWithoutNumberScoresZero() {
        var response = JudgeResponseParser.parse("SCORE: excellent\nREASON: no number given");

        assertThat(response.score()).isEqualTo(0.0);
        assertThat(response.reason()).isEqualTo("no number given");
    }

    @Test
    void reasonWithoutScoreScoresZero() {
        var response = JudgeResponseParser.parse("REASON: this looks like a success");

        assertThat(response.score()).isEqualTo(0.0);
        assertThat(response.reason()).isEqualTo("this looks like a success");
    }

    @Test
    void keywordFallbackWhenNoStructuredLines() {
        assertThat(JudgeResponseParser.parse("The change is a success.").score()).isEqualTo(0.8);
        assertThat(JudgeResponseParser.parse("This is correct").score()).isEqualTo(0.8);
        assertThat(JudgeResponseParser.parse("Only partially addressed").score()).isEqualTo(0.5);
        assertThat(JudgeResponseParser.parse("Nothing was changed").score()).isEqualTo(0.0);
    }

    @Test
    void keywordFallbackReasonIsTruncated() {
        var response = JudgeResponseParser.parse("x".repeat(300));

        assertThat(response.reason())
                .startsWith("x".repeat(JudgeResponseParser.FALLBACK_REASON_LIMIT))
                .endsWith(Outputs.TRUNCATION_MARKER)
                .hasSize(
                        JudgeResponseParser.FALLBACK_REASON_LIMIT
                                + Outputs.TRUNCATION_MARKER.length());
    }
}
