package de.bsommerfeld.fnpack.index;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates an environment marker such as
 * {@code python_version == "2.6" or python_version == "2.7"} or
 * {@code sys_platform != 'win32' and extra == 'socks'}.
 *
 * <h3>Grammar</h3>
 * <pre>{@code
 * or         := and ('or' and)*
 * and        := expression ('and' expression)*
 * expression := '(' or ')' | operand op operand
 * operand    := variable | quoted string
 * op         := == != < <= > >= ~= === in 'not in'
 * }</pre>
 *
 * <h3>Comparison</h3>
 * The version variables ({@code python_version},
 * {@code python_full_version}, {@code implementation_version}) compare
 * numerically per dotted component, with {@code ==} and {@code !=}
 * accepting a trailing {@code .*} wildcard. Everything else compares as
 * plain strings. A comparison that involves a variable the environment does
 * not know holds.
 */
final class Marker {

    private final List<String> tokens;
    private final MarkerEnvironment environment;
    private int position;

    private Marker(List<String> tokens, MarkerEnvironment environment) {
        this.tokens = tokens;
        this.environment = environment;
    }

    /**
     * @throws IllegalArgumentException if the marker cannot be parsed
     */
    static boolean evaluate(String marker, MarkerEnvironment environment) {
        Marker parser = new Marker(tokenize(marker), environment);
        boolean result = parser.or();
        if (parser.position != parser.tokens.size())
            throw new IllegalArgumentException("Unexpected '" + parser.tokens.get(parser.position)
                    + "' in marker: " + marker);
        return result;
    }

    // =====================================================================
    // Parsing
    // =====================================================================

    private boolean or() {
        boolean result = and();
        while (accept("or")) {
            // both sides are parsed even when the left one already holds
            boolean right = and();
            result = result || right;
        }
        return result;
    }

    private boolean and() {
        boolean result = expression();
        while (accept("and")) {
            boolean right = expression();
            result = result && right;
        }
        return result;
    }

    private boolean expression() {
        if (accept("(")) {
            boolean result = or();
            expect(")");
            return result;
        }
        String left = next();
        String op = next();
        if (op.equals("not")) {
            expect("in");
            op = "not in";
        }
        String right = next();
        return compare(left, op, right);
    }

    private boolean accept(String token) {
        if (position < tokens.size() && tokens.get(position).equals(token)) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!accept(token))
            throw new IllegalArgumentException("Expected '" + token + "' in marker");
    }

    private String next() {
        if (position >= tokens.size())
            throw new IllegalArgumentException("Marker ends unexpectedly");
        return tokens.get(position++);
    }

    static List<String> tokenize(String marker) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < marker.length()) {
            char c = marker.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(' || c == ')') {
                tokens.add(String.valueOf(c));
                i++;
            } else if (c == '"' || c == '\'') {
                int end = marker.indexOf(c, i + 1);
                if (end == -1)
                    throw new IllegalArgumentException("Unterminated string in marker: " + marker);
                tokens.add(marker.substring(i, end + 1));
                i = end + 1;
            } else if ("<>=!~".indexOf(c) != -1) {
                int start = i;
                while (i < marker.length() && "<>=!~".indexOf(marker.charAt(i)) != -1)
                    i++;
                tokens.add(marker.substring(start, i));
            } else if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                int start = i;
                while (i < marker.length()
                        && (Character.isLetterOrDigit(marker.charAt(i)) || marker.charAt(i) == '_'
                                || marker.charAt(i) == '.'))
                    i++;
                tokens.add(marker.substring(start, i));
            } else {
                throw new IllegalArgumentException("Unexpected character '" + c + "' in marker: " + marker);
            }
        }
        return tokens;
    }

    // =====================================================================
    // Evaluation
    // =====================================================================

    private boolean compare(String leftToken, String op, String rightToken) {
        String left = resolve(leftToken);
        String right = resolve(rightToken);
        if (left == null || right == null)
            return true;

        boolean versions = isVersionVariable(leftToken) || isVersionVariable(rightToken);
        switch (op) {
            case "==":
                return versions ? versionEquals(left, right) : left.equals(right);
            case "!=":
                return versions ? !versionEquals(left, right) : !left.equals(right);
            case "===":
                return left.equals(right);
            case "in":
                return right.contains(left);
            case "not in":
                return !right.contains(left);
            case "<":
                return compareVersions(left, right) < 0;
            case "<=":
                return compareVersions(left, right) <= 0;
            case ">":
                return compareVersions(left, right) > 0;
            case ">=":
                return compareVersions(left, right) >= 0;
            case "~=":
                return compatibleRelease(left, right);
            default:
                throw new IllegalArgumentException("Unknown marker operator: " + op);
        }
    }

    private String resolve(String token) {
        char first = token.charAt(0);
        if (first == '"' || first == '\'')
            return token.substring(1, token.length() - 1);
        return environment.value(token);
    }

    private static boolean isVersionVariable(String token) {
        return token.equals("python_version") || token.equals("python_full_version")
                || token.equals("implementation_version");
    }

    private static boolean versionEquals(String left, String right) {
        if (right.endsWith(".*")) {
            String prefix = right.substring(0, right.length() - 2);
            return left.equals(prefix) || left.startsWith(prefix + ".");
        }
        return compareVersions(left, right) == 0;
    }

    /**
     * {@code ~= 2.2} means {@code >= 2.2, == 2.*}.
     */
    private static boolean compatibleRelease(String value, String release) {
        int lastDot = release.lastIndexOf('.');
        if (lastDot == -1)
            return compareVersions(value, release) >= 0;
        return compareVersions(value, release) >= 0
                && versionEquals(value, release.substring(0, lastDot) + ".*");
    }

    /**
     * Compares dotted versions component by component, padding the shorter
     * one with zeros. Non-numeric suffixes ({@code 3.7.0rc1}) are dropped.
     */
    static int compareVersions(String left, String right) {
        String[] a = left.split("\\.");
        String[] b = right.split("\\.");
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            int x = i < a.length ? leadingNumber(a[i]) : 0;
            int y = i < b.length ? leadingNumber(b[i]) : 0;
            if (x != y)
                return Integer.compare(x, y);
        }
        return 0;
    }

    private static int leadingNumber(String component) {
        int end = 0;
        while (end < component.length() && Character.isDigit(component.charAt(end)))
            end++;
        return end == 0 ? 0 : Integer.parseInt(component.substring(0, end));
    }
}
