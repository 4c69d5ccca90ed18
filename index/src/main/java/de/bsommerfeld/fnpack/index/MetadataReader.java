package de.bsommerfeld.fnpack.index;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the header block of {@code METADATA} and {@code PKG-INFO} files,
 * and the plain requirement list of {@code requires.txt}.
 *
 * <p>
 * Both metadata formats are RFC 822 style: {@code Key: value} lines up to the
 * first blank line, followed by a free-form description body that is
 * ignored. Keys may repeat ({@code Requires-Dist}), so every key maps to a
 * list. Continuation lines (leading whitespace) belong to long descriptions
 * and are skipped.
 */
final class MetadataReader {

    private MetadataReader() {
    }

    static Map<String, List<String>> parseHeaders(String content) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String line : content.split("\r?\n")) {
            if (line.isEmpty())
                break;
            if (Character.isWhitespace(line.charAt(0)))
                continue;

            int colon = line.indexOf(':');
            if (colon <= 0)
                continue;

            String key = line.substring(0, colon).strip();
            String value = line.substring(colon + 1).strip();
            headers.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return headers;
    }

    static String first(Map<String, List<String>> headers, String key) {
        List<String> values = headers.get(key);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Collects the requirement names of a {@code Requires-Dist} header list
     * whose marker holds in the given environment.
     */
    static List<String> requiresDist(Map<String, List<String>> headers, MarkerEnvironment environment) {
        List<String> names = new ArrayList<>();
        for (String value : headers.getOrDefault("Requires-Dist", List.of())) {
            Requirement.parse(value)
                    .filter(r -> r.appliesTo(environment))
                    .ifPresent(r -> names.add(r.name()));
        }
        return names;
    }

    /**
     * Reads {@code requires.txt}. Unconditional requirements come first.
     * A {@code [:marker]} section holds requirements that apply when the
     * marker does; {@code [extra]} and {@code [extra:marker]} sections belong
     * to optional extras and are skipped.
     */
    static List<String> requiresTxt(String content, MarkerEnvironment environment) {
        List<String> names = new ArrayList<>();
        boolean active = true;
        for (String line : content.split("\r?\n")) {
            String trimmed = line.strip();
            if (trimmed.startsWith("[")) {
                active = sectionApplies(trimmed, environment);
                continue;
            }
            if (!active)
                continue;
            Requirement.parse(trimmed)
                    .filter(r -> r.appliesTo(environment))
                    .ifPresent(r -> names.add(r.name()));
        }
        return names;
    }

    private static boolean sectionApplies(String header, MarkerEnvironment environment) {
        int close = header.lastIndexOf(']');
        String section = header.substring(1, close == -1 ? header.length() : close).strip();
        if (!section.startsWith(":"))
            return false;
        return Requirement.holds(section.substring(1).strip(), environment);
    }
}
