package de.bsommerfeld.fnpack.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One published file of a release.
 *
 * @param url         absolute download URL
 * @param filename    published filename
 * @param packagetype {@code bdist_wheel}, {@code sdist}, {@code bdist_egg}, ...
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReleaseFile(String url, String filename, String packagetype) {
}
