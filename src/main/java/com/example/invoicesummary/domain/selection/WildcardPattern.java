package com.example.invoicesummary.domain.selection;

import java.util.regex.Pattern;

/**
 * Case-insensitive glob pattern supporting {@code *} (any run of characters) and {@code ?} (one character).
 * The pattern is anchored: it must match the whole field, so {@code ACME*} is a prefix match and
 * {@code *ACME*} a substring match.
 */
public final class WildcardPattern {

    private final String glob;
    private final Pattern pattern;

    private WildcardPattern(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    /**
     * Compiles a glob expression. Every character other than {@code *} and {@code ?} is taken literally.
     *
     * @param glob wildcard expression
     * @return compiled pattern
     */
    public static WildcardPattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char ch : glob.toCharArray()) {
            if (ch == '*' || ch == '?') {
                flushLiteral(regex, literal);
                regex.append(ch == '*' ? ".*" : ".");
            } else {
                literal.append(ch);
            }
        }
        flushLiteral(regex, literal);
        Pattern compiled = Pattern.compile(regex.toString(),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
        return new WildcardPattern(glob, compiled);
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    /**
     * @param value field to test, {@code null} never matches
     * @return {@code true} when the whole value matches
     */
    public boolean matches(String value) {
        return value != null && pattern.matcher(value.trim()).matches();
    }

    @Override
    public String toString() {
        return glob;
    }
}
