package notestore.domain.persist;

import java.util.Locale;

/**
 * Turns a literal search query into the pattern syntax of each engine, so that characters that are special in
 * that syntax are matched literally.
 */
public final class SearchPatterns {
    private static final String REGEX_SPECIAL = "\\^$.|?*+()[]{}";

    private SearchPatterns() {
    }

    /**
     * Escapes regular expression meta characters. The result means the same thing to Java regular expressions
     * (used by Cypher) and to PCRE (used by MongoDB).
     */
    public static String escapeRegex(final String query) {
        final StringBuilder builder = new StringBuilder(query.length() * 2);
        for (final char c : query.toCharArray()) {
            if (REGEX_SPECIAL.indexOf(c) >= 0) {
                builder.append('\\');
            }
            builder.append(c);
        }
        return builder.toString();
    }

    /**
     * A lower case, two-sided SQL LIKE pattern. Wildcards in the query are escaped with a backslash, which the
     * statement must declare with ESCAPE '\'.
     */
    public static String containsLikePattern(final String query) {
        final String escaped = query.toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    /**
     * The substring test every backend must agree with.
     */
    public static boolean containsIgnoreCase(final String text, final String query) {
        return text.toLowerCase(Locale.ROOT).contains(query.toLowerCase(Locale.ROOT));
    }
}
