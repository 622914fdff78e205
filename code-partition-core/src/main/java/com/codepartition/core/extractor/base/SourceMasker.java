package com.codepartition.core.extractor.base;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Blanks comments and string literal contents with spaces.
 *
 * <p>The masked text has exactly the length and line structure of the input, so
 * offsets and line numbers found in it apply to the original source. String
 * delimiters are kept; only the characters between them are blanked.
 */
public final class SourceMasker {

    /**
     * Comment and string syntax families.
     */
    public enum Syntax {
        /** {@code //} and {@code /* *}{@code /} comments, single and double quoted literals. */
        C_FAMILY,
        /** C family plus template literals with nested substitutions and regex literals. */
        JAVASCRIPT,
        /** {@code #} comments, single, double and triple quoted strings. */
        PYTHON,
        /** C family plus {@code #} comments, multi-line strings, heredoc and nowdoc. */
        PHP
    }

    private static final Pattern HEREDOC_START = Pattern.compile("<<<[ \\t]*([\"']?)([A-Za-z_]\\w*)\\1[ \\t]*\\r?\\n");

    /** Characters after which a {@code /} starts a regex literal rather than a division. */
    private static final String REGEX_PRECEDERS = "=(,:[!&|?;{";

    private static final Set<String> REGEX_KEYWORDS = Set.of(
        "return", "typeof", "case", "in", "of", "delete", "void", "throw", "new", "yield", "await", "else", "do"
    );

    private SourceMasker() {
        // Utility class
    }

    /**
     * Blanks comments only.
     *
     * @param content source text
     * @param syntax comment syntax
     * @return masked text of equal length
     */
    public static String maskComments(String content, Syntax syntax) {
        return mask(content, syntax, false);
    }

    /**
     * Blanks comments and the contents of string literals.
     *
     * @param content source text
     * @param syntax comment syntax
     * @return masked text of equal length
     */
    public static String maskCommentsAndStrings(String content, Syntax syntax) {
        return mask(content, syntax, true);
    }

    /**
     * Blanks preprocessor directive lines ({@code #include}, {@code #define}, ...),
     * including their backslash continuations.
     *
     * @param content source text, usually already masked
     * @return text of equal length without directives
     */
    public static String blankPreprocessorLines(String content) {
        char[] out = content.toCharArray();
        int lineStart = 0;
        while (lineStart < out.length) {
            int i = lineStart;
            while (i < out.length && (out[i] == ' ' || out[i] == '\t')) {
                i++;
            }
            int lineEnd = lineEnd(content, lineStart);
            if (i < out.length && out[i] == '#') {
                int end = lineEnd;
                while (end < out.length && end > lineStart && content.charAt(end - 1) == '\\') {
                    end = lineEnd(content, end + 1);
                }
                blank(out, lineStart, end);
                lineEnd = end;
            }
            lineStart = lineEnd + 1;
        }
        return new String(out);
    }

    private static String mask(String content, Syntax syntax, boolean maskStrings) {
        char[] out = content.toCharArray();
        int n = content.length();
        int i = 0;
        while (i < n) {
            char c = content.charAt(i);
            char next = i + 1 < n ? content.charAt(i + 1) : '\0';

            if (syntax != Syntax.PYTHON && c == '/' && next == '/'
                    || (syntax == Syntax.PYTHON || syntax == Syntax.PHP) && c == '#') {
                int end = lineEnd(content, i);
                blank(out, i, end);
                i = end;
            } else if (syntax != Syntax.PYTHON && c == '/' && next == '*') {
                int close = content.indexOf("*/", i + 2);
                int end = close < 0 ? n : close + 2;
                blank(out, i, end);
                i = end;
            } else if (syntax == Syntax.PYTHON && (c == '"' || c == '\'') && content.startsWith("" + c + c + c, i)) {
                int end = tripleQuotedEnd(content, i + 3, c);
                if (maskStrings) {
                    blank(out, i + 3, Math.max(i + 3, end - 3));
                }
                i = end;
            } else if (syntax == Syntax.PHP && c == '<' && content.startsWith("<<<", i)) {
                i = heredoc(content, out, i, maskStrings);
            } else if (syntax == Syntax.JAVASCRIPT && c == '`') {
                int end = templateEnd(content, i + 1);
                if (maskStrings) {
                    int contentEnd = end > i + 1 && content.charAt(end - 1) == '`' ? end - 1 : end;
                    blank(out, i + 1, contentEnd);
                }
                i = end;
            } else if (c == '"' || c == '\'') {
                int end = quotedEnd(content, i + 1, c, syntax == Syntax.PHP);
                if (maskStrings) {
                    int contentEnd = end <= n && end > i + 1 && content.charAt(end - 1) == c ? end - 1 : end;
                    blank(out, i + 1, contentEnd);
                }
                i = end;
            } else if (syntax == Syntax.JAVASCRIPT && c == '/' && regexAllowed(out, i)) {
                int end = regexEnd(content, i + 1);
                if (end < 0) {
                    i++;
                } else {
                    if (maskStrings) {
                        blank(out, i + 1, content.lastIndexOf('/', end - 1));
                    }
                    i = end;
                }
            } else {
                i++;
            }
        }
        return new String(out);
    }

    /**
     * Skips a heredoc or nowdoc, blanking its body. Returns the offset after it, or
     * after the {@code <<<} when the text is no heredoc opener.
     */
    private static int heredoc(String content, char[] out, int start, boolean maskStrings) {
        Matcher opener = HEREDOC_START.matcher(content);
        opener.region(start, content.length());
        if (!opener.lookingAt()) {
            return start + 3;
        }
        String label = opener.group(2);
        int bodyStart = opener.end();
        int lineStart = bodyStart;
        while (lineStart < content.length()) {
            int labelStart = lineStart;
            while (labelStart < content.length()
                    && (content.charAt(labelStart) == ' ' || content.charAt(labelStart) == '\t')) {
                labelStart++;
            }
            int labelEnd = labelStart + label.length();
            if (content.startsWith(label, labelStart)
                    && (labelEnd >= content.length() || !isIdentifierPart(content.charAt(labelEnd)))) {
                if (maskStrings) {
                    blank(out, bodyStart, lineStart);
                }
                return labelEnd;
            }
            lineStart = lineEnd(content, lineStart) + 1;
        }
        if (maskStrings) {
            blank(out, bodyStart, content.length());
        }
        return content.length();
    }

    /**
     * Finds the end of a template literal, stepping over {@code ${...}} substitutions
     * that may contain strings, comments and further templates.
     */
    private static int templateEnd(String content, int from) {
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '`') {
                return i + 1;
            } else if (c == '$' && i + 1 < content.length() && content.charAt(i + 1) == '{') {
                i = substitutionEnd(content, i + 2);
            } else {
                i++;
            }
        }
        return content.length();
    }

    private static int substitutionEnd(String content, int from) {
        int depth = 1;
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            char next = i + 1 < content.length() ? content.charAt(i + 1) : '\0';
            if (c == '"' || c == '\'') {
                i = quotedEnd(content, i + 1, c, false);
            } else if (c == '`') {
                i = templateEnd(content, i + 1);
            } else if (c == '/' && next == '/') {
                i = lineEnd(content, i);
            } else if (c == '/' && next == '*') {
                int close = content.indexOf("*/", i + 2);
                i = close < 0 ? content.length() : close + 2;
            } else if (c == '{') {
                depth++;
                i++;
            } else if (c == '}') {
                depth--;
                i++;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return content.length();
    }

    /**
     * Decides from the preceding code whether a {@code /} opens a regex literal.
     */
    private static boolean regexAllowed(char[] out, int slash) {
        int i = slash - 1;
        while (i >= 0 && Character.isWhitespace(out[i])) {
            i--;
        }
        if (i < 0) {
            return true;
        }
        if (REGEX_PRECEDERS.indexOf(out[i]) >= 0) {
            return true;
        }
        int wordEnd = i + 1;
        while (i >= 0 && isIdentifierPart(out[i])) {
            i--;
        }
        return wordEnd > i + 1 && REGEX_KEYWORDS.contains(new String(out, i + 1, wordEnd - i - 1));
    }

    /**
     * Returns the offset after a regex literal and its flags, or -1 if the line ends first.
     */
    private static int regexEnd(String content, int from) {
        boolean inClass = false;
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\n') {
                return -1;
            }
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                if (i == from) {
                    return -1;
                }
                i++;
                while (i < content.length() && Character.isLetter(content.charAt(i))) {
                    i++;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static int quotedEnd(String content, int from, char quote, boolean multiline) {
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n' && !multiline) {
                return i;
            }
            i++;
        }
        return content.length();
    }

    private static int tripleQuotedEnd(String content, int from, char quote) {
        String close = "" + quote + quote + quote;
        int i = from;
        while (i < content.length()) {
            if (content.charAt(i) == '\\') {
                i += 2;
                continue;
            }
            if (content.startsWith(close, i)) {
                return i + 3;
            }
            i++;
        }
        return content.length();
    }

    private static int lineEnd(String content, int from) {
        int newline = content.indexOf('\n', from);
        return newline < 0 ? content.length() : newline;
    }

    private static void blank(char[] out, int from, int to) {
        int end = Math.min(to, out.length);
        for (int i = from; i < end; i++) {
            if (out[i] != '\n' && out[i] != '\r') {
                out[i] = ' ';
            }
        }
    }
}
