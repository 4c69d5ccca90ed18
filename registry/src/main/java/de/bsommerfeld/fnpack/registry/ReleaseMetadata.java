package de.bsommerfeld.fnpack.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * The part of a registry's {@code /{name}/json} document the packager reads:
 * every released version with its published files, in the order the
 * registry lists them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReleaseMetadata(Map<String, List<ReleaseFile>> releases) {

    public ReleaseMetadata {
        releases = releases == null ? Map.of() : releases;
    }

    public boolean hasVersion(String version) {
        return releases.containsKey(version);
    }

    /**
     * Returns the files of the given version whose URL ends with the suffix,
     * in listed order.
     */
    public List<ReleaseFile> filesMatching(String version, String urlSuffix) {
        return releases.getOrDefault(version, List.of()).stream()
                .filter(f -> f.url() != null && f.url().endsWith(urlSuffix))
                .toList();
    }
}
