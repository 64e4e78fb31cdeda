package dev.issuebench.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a check command into program and arguments without involving a shell.
 *
 * <p>Words are separated by whitespace. Single or double quotes group a word and are removed;
 * a backslash inside double quotes escapes the next character. Anything fancier (pipes,
 * redirects, variables) needs an explicit {@code sh -c '...'} in the command.
 */
final class CommandLine {

    /**
     * @return the words of {@code command}, or empty if the command has an unbalanced quote
     */
    static Optional<List<String>> split(String command) {
        var words = new ArrayList<String>();
        var current = new StringBuilder();
        boolean inWord = false;
        char quote = 0;
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else if (quote == '"' && c == '\\' && i + 1 < command.length()) {
                    current.append(command.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
            } else if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
            } else {
                current.append(c);
                inWord = true;
            }
        }
        if (quote != 0) {
            return Optional.empty();
        }
        if (inWord) {
            words.add(current.toString());
        }
        return Optional.of(List.copyOf(words));
    }

    private CommandLine() {}
}
