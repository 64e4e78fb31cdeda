package dev.issuebench.eval;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a score and a reason from a judge's free-text answer.
 *
 * <p>The judge is asked to answer with a {@code SCORE:} line and a {@code REASON:} line. A score
 * above 1 is read as a percentage. When neither line is present the whole answer is scanned for
 * a few keywords instead.
 */
public final class JudgeResponseParser {
    static final int FALLBACK_REASON_LIMIT = 200;
    static final double KEYWORD_SUCCESS_SCORE = 0.8;
    static final double KEYWORD_PARTIAL_SCORE = 0.5;

    private static final Pattern SCORE_LINE = Pattern.compile("^score:\\s*(.*)$");
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern REASON_LINE =
            Pattern.compile("^reason:\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    public static JudgeResponse parse(String response) {
        boolean scoreFound = false;
        boolean reasonFound = false;
        double score = 0.0;
        String reason = "";
        for (var rawLine : response.split("\\R")) {
            var line = rawLine.strip();
            Matcher scoreLine = SCORE_LINE.matcher(line.toLowerCase(Locale.ROOT));
            if (scoreLine.matches()) {
                scoreFound = true;
                score = readScore(scoreLine.group(1));
                continue;
            }
            Matcher reasonLine = REASON_LINE.matcher(line);
            if (reasonLine.matches()) {
                reasonFound = true;
                reason = reasonLine.group(1).strip();
            }
        }
        if (!scoreFound && !reasonFound) {
            return keywordFallback(response);
        }
        return new JudgeResponse(score, reason);
    }

    private static double readScore(String text) {
        Matcher number = NUMBER.matcher(text);
        if (!number.find()) {
            return 0.0;
        }
        double value = Double.parseDouble(number.group());
        if (value > 1.0) {
            value = value / 100.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }

    private static JudgeResponse keywordFallback(String response) {
        var upper = response.toUpperCase(Locale.ROOT);
        double score = 0.0;
        if (upper.contains("SUCCESS") || upper.contains("CORRECT")) {
            score = KEYWORD_SUCCESS_SCORE;
        } else if (upper.contains("PARTIAL")) {
            score = KEYWORD_PARTIAL_SCORE;
        }
        return new JudgeResponse(score, Outputs.truncate(response, FALLBACK_REASON_LIMIT));
    }

    /**
     * @param score normalized score in [0, 1]
     * @param reason the judge's explanation, possibly empty
     */
    public record JudgeResponse(double score, String reason) {}

    private JudgeResponseParser() {}
}
