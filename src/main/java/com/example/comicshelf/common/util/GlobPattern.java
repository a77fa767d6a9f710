package com.example.comicshelf.common.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shell-style wildcards: {@code *}, {@code ?}, {@code [abc]}, {@code [!abc]}. Matching is case-insensitive.
 */
public final class GlobPattern {

    private GlobPattern() {
    }

    public static Pattern compile(String glob) {
        if (glob == null) {
            throw new IllegalArgumentException("glob must not be null");
        }
        String source = glob.trim().toLowerCase(Locale.ROOT);
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '*') {
                regex.append(".*");
                i++;
            } else if (c == '?') {
                regex.append('.');
                i++;
            } else if (c == '[') {
                int close = source.indexOf(']', i + 2);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed character class in pattern: " + glob);
                }
                String body = source.substring(i + 1, close);
                regex.append('[');
                if (body.startsWith("!")) {
                    regex.append('^');
                    body = body.substring(1);
                } else if (body.startsWith("^")) {
                    regex.append('\\');
                }
                regex.append(body.replace("\\", "\\\\").replace("[", "\\[").replace("&&", "\\&\\&"));
                regex.append(']');
                i = close + 1;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }
}
