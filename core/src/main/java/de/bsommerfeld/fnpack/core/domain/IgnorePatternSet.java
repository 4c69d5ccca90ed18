package de.bsommerfeld.fnpack.core.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Glob patterns for files that must never reach the staging tree:
 * version-control metadata and bytecode cache directories.
 *
 * <h3>Matching</h3>
 * Globs follow shell {@code fnmatch} rules: {@code *} matches any run of
 * characters including {@code /}, {@code ?} matches one character and
 * {@code [...]} a character class. A relative path is ignored when the whole
 * path matches a glob, or when any single segment of it does. Matching per
 * segment catches {@code a/b/__pycache__/c.pyc} through the bare
 * {@code __pycache__} glob, the same way a directory copy that filters by
 * entry name would.
 *
 * <p>
 * Backslashes in the input are normalized to {@code /} before matching.
 */
public final class IgnorePatternSet {

    public static final List<String> DEFAULT_GLOBS = List.of(
            "__pycache__",
            ".git",
            "__pycache__/*",
            ".git/*",
            "*/__pycache__/*",
            "*/.git/*");

    private final List<String> globs;
    private final List<Pattern> patterns;

    private IgnorePatternSet(List<String> globs) {
        this.globs = List.copyOf(globs);
        List<Pattern> compiled = new ArrayList<>(globs.size());
        for (String glob : globs) {
            compiled.add(Pattern.compile(translate(glob)));
        }
        this.patterns = List.copyOf(compiled);
    }

    public static IgnorePatternSet defaults() {
        return new IgnorePatternSet(DEFAULT_GLOBS);
    }

    public static IgnorePatternSet of(List<String> globs) {
        return new IgnorePatternSet(globs);
    }

    public List<String> globs() {
        return globs;
    }

    /**
     * Returns {@code true} if the relative path, or any of its segments,
     * matches one of the globs.
     */
    public boolean matches(String relativePath) {
        String normalized = relativePath.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.isEmpty())
            return false;

        if (matchesAny(normalized))
            return true;
        for (String segment : normalized.split("/")) {
            if (matchesAny(segment))
                return true;
        }
        return false;
    }

    private boolean matchesAny(String candidate) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(candidate).matches())
                return true;
        }
        return false;
    }

    /**
     * Translates an fnmatch glob into an anchored regular expression.
     * An unterminated {@code [} is taken literally.
     */
    static String translate(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && glob.charAt(j) == '!')
                        j++;
                    if (j < n && glob.charAt(j) == ']')
                        j++;
                    while (j < n && glob.charAt(j) != ']')
                        j++;
                    if (j >= n) {
                        regex.append("\\[");
                    } else {
                        String body = glob.substring(i, j).replace("\\", "\\\\");
                        i = j + 1;
                        if (body.startsWith("!")) {
                            body = "^" + body.substring(1);
                        } else if (body.startsWith("^")) {
                            body = "\\" + body;
                        }
                        regex.append('[').append(body).append(']');
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return "(?s)" + regex;
    }

    @Override
    public String toString() {
        return "IgnorePatternSet" + globs;
    }
}
