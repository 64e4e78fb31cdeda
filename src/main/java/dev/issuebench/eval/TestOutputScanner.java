package dev.issuebench.eval;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort partial credit from the output of a failed test run.
 *
 * <p>Each language has a few well-known summary shapes. The scanner counts passed and failed
 * tests in whichever shapes it finds and scores {@code passed / (passed + failed)}. Output with
 * no recognizable markers scores 0.
 */
public final class TestOutputScanner {
    private static final Pattern GO_PASS = Pattern.compile("--- pass");
    private static final Pattern GO_FAIL = Pattern.compile("--- fail");
    private static final Pattern COUNT_PASSED = Pattern.compile("(\\d+) passed");
    private static final Pattern COUNT_FAILED = Pattern.compile("(\\d+) failed");
    private static final Pattern COUNT_ERRORS = Pattern.compile("(\\d+) errors?\\b");
    private static final Pattern MOCHA_PASSING = Pattern.compile("(\\d+) passing");
    private static final Pattern MOCHA_FAILING = Pattern.compile("(\\d+) failing");
    private static final Pattern JEST_TESTS_LINE = Pattern.compile("(?m)^\\s*tests:.*$");
    private static final Pattern SUREFIRE_SUMMARY =
            Pattern.compile("tests run: (\\d+), failures: (\\d+), errors: (\\d+)");
    private static final Pattern GENERIC_PASS = Pattern.compile("(?m)^\\W*pass(ed)?\\b");
    private static final Pattern GENERIC_FAIL = Pattern.compile("(?m)^\\W*fail(ed|ure)?\\b");

    /** Partial score in [0, 1] for {@code output} produced by a {@code language} test run. */
    public static double score(String output, String language) {
        return count(output.toLowerCase(Locale.ROOT), language.toLowerCase(Locale.ROOT).trim())
                .ratio();
    }

    static Counts count(String output, String language) {
        switch (language) {
            case "go":
                return new Counts(occurrences(GO_PASS, output), occurrences(GO_FAIL, output));
            case "python":
                return new Counts(
                        sum(COUNT_PASSED, output),
                        sum(COUNT_FAILED, output) + sum(COUNT_ERRORS, output));
            case "javascript":
            case "typescript":
                return javascript(output);
            case "rust":
                return new Counts(sum(COUNT_PASSED, output), sum(COUNT_FAILED, output));
            case "java":
                return surefire(output);
            default:
                return new Counts(
                        occurrences(GENERIC_PASS, output), occurrences(GENERIC_FAIL, output));
        }
    }

    private static Counts javascript(String output) {
        var mocha = new Counts(sum(MOCHA_PASSING, output), sum(MOCHA_FAILING, output));
        if (mocha.total() > 0) {
            return mocha;
        }
        // jest: "Tests:       1 failed, 3 passed, 4 total"
        long passed = 0;
        long failed = 0;
        Matcher lines = JEST_TESTS_LINE.matcher(output);
        while (lines.find()) {
            passed += sum(COUNT_PASSED, lines.group());
            failed += sum(COUNT_FAILED, lines.group());
        }
        return new Counts(passed, failed);
    }

    private static Counts surefire(String output) {
        // keep the last summary: maven prints per-class lines followed by the module total
        Matcher matcher = SUREFIRE_SUMMARY.matcher(output);
        Counts last = new Counts(0, 0);
        while (matcher.find()) {
            long run = parseCount(matcher.group(1));
            long broken = parseCount(matcher.group(2)) + parseCount(matcher.group(3));
            last = new Counts(Math.max(0, run - broken), broken);
        }
        return last;
    }

    private static long occurrences(Pattern pattern, String output) {
        long count = 0;
        Matcher matcher = pattern.matcher(output);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static long sum(Pattern pattern, String output) {
        long total = 0;
        Matcher matcher = pattern.matcher(output);
        while (matcher.find()) {
            total += parseCount(matcher.group(1));
        }
        return total;
    }

    /** A count too large for a {@code long} is not a real test summary; it counts as no marker. */
    private static long parseCount(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    record Counts(long passed, long failed) {
        Counts {
            passed = Math.max(0, passed);
            failed = Math.max(0, failed);
        }

        double total() {
            return (double) passed + (double) failed;
        }

        double ratio() {
            double total = total();
            if (total == 0) {
                return 0.0;
            }
            return Math.min(1.0, Math.max(0.0, passed / total));
        }
    }

    private TestOutputScanner() {}
}
