package com.tyron.nanofs.core.filter;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style glob over a single basename, case-sensitive.
 * <ul>
 *     <li>{@code *} any run of characters except the separator</li>
 *     <li>{@code ?} exactly one character</li>
 *     <li>{@code [abc]}, {@code [a-z]}, {@code [!a-z]} / {@code [^a-z]} character classes</li>
 *     <li>{@code \} takes the next character literally</li>
 * </ul>
 */
public final class GlobMatcher {

    private static final String REGEX_META = "\\.[]{}()<>*+-=!?^$|&";

    private final String glob;
    private final Pattern pattern;

    private GlobMatcher(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    /**
     * @throws IllegalArgumentException if a character class is not closed
     */
    public static GlobMatcher compile(String glob) {
        Objects.requireNonNull(glob, "glob");
        return new GlobMatcher(glob, Pattern.compile(toRegex(glob)));
    }

    public boolean matches(String basename) {
        return pattern.matcher(basename).matches();
    }

    @Override
    public String toString() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder b = new StringBuilder(glob.length() + 16);

        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);

            if (c == '*') {
                b.append("[^/]*");
            } else if (c == '?') {
                b.append("[^/]");
            } else if (c == '[') {
                i = appendClass(glob, i, b);
            } else if (c == '\\' && i + 1 < glob.length()) {
                appendLiteral(glob.charAt(++i), b);
            } else {
                appendLiteral(c, b);
            }
        }
        return b.toString();
    }

    /**
     * @return index of the closing bracket
     */
    private static int appendClass(String glob, int open, StringBuilder b) {
        int i = open + 1;
        boolean negate = i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^');
        if (negate) {
            i++;
        }

        StringBuilder body = new StringBuilder();
        boolean first = true;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == ']' && !first) {
                b.append(negate ? "[^" : "[").append(body).append(']');
                return i;
            }
            if (c == '\\' && i + 1 < glob.length()) {
                c = glob.charAt(++i);
                appendClassLiteral(c, body);
            } else if (c == '-' && !first && i + 1 < glob.length() && glob.charAt(i + 1) != ']') {
                body.append('-');
            } else {
                appendClassLiteral(c, body);
            }
            first = false;
            i++;
        }
        throw new IllegalArgumentException("Unterminated character class in glob: " + glob);
    }

    private static void appendClassLiteral(char c, StringBuilder body) {
        if ("\\[]^&-".indexOf(c) >= 0) {
            body.append('\\');
        }
        body.append(c);
    }

    private static void appendLiteral(char c, StringBuilder b) {
        if (REGEX_META.indexOf(c) >= 0) {
            b.append('\\');
        }
        b.append(c);
    }
}
