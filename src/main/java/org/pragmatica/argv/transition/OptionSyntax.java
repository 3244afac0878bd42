package org.pragmatica.argv.transition;

import java.util.Optional;
import java.util.Set;

/**
 * Lexical rules for option-like arguments.
 */
public final class OptionSyntax {
    public static final String SHORT_PREFIX = "-";
    public static final String LONG_PREFIX = "--";
    public static final char ASSIGN = '=';

    private OptionSyntax() {}

    /**
     * Starts with a dash but is not the lone {@code -} conventionally naming stdin.
     */
    public static boolean isOptionLike(String text) {
        return !SHORT_PREFIX.equals(text) && text.startsWith(SHORT_PREFIX);
    }

    /**
     * A long option is valid when its name holds only letters, digits and dashes; a short option
     * when its name holds only letters.
     */
    public static boolean isValidOption(String text) {
        if (text.startsWith(LONG_PREFIX)) {
            return text.substring(LONG_PREFIX.length())
                       .codePoints()
                       .allMatch(c -> Character.isLetterOrDigit(c) || c == '-');
        }
        if (text.startsWith(SHORT_PREFIX)) {
            return text.substring(SHORT_PREFIX.length())
                       .codePoints()
                       .allMatch(Character::isLetter);
        }
        return false;
    }

    /**
     * A bundle like {@code -rf} where every character after the dash names a known short option.
     */
    public static boolean isBatch(String text, Set<String> knownOptions) {
        if (!text.startsWith(SHORT_PREFIX) || text.length() <= 2) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!isAsciiLetterOrDigit(c) || !knownOptions.contains(shortName(c))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Option name of an argument carrying its value after {@code =}.
     */
    public static Optional<String> boundName(String text) {
        int assignAt = text.indexOf(ASSIGN);
        return assignAt < 0
               ? Optional.empty()
               : Optional.of(text.substring(0, assignAt));
    }

    public static String shortName(char c) {
        return SHORT_PREFIX + c;
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
