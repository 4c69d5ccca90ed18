package de.bsommerfeld.fnpack.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.fnpack.core.config.PackagerConfig;
import de.bsommerfeld.fnpack.core.error.RegistryException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Client for the public package registry's JSON API.
 *
 * <h3>Endpoints</h3>
 * <pre>
 * GET {registry}/{name}/json   → release metadata, parsed into {@link ReleaseMetadata}
 * GET {file url}               → artifact bytes, streamed to disk
 * </pre>
 *
 * <h3>Failure semantics</h3>
 * A missing version or a missing matching file is a normal outcome
 * ({@link Optional#empty()}). A non-2xx response or a transport error is a
 * {@link RegistryException}: the run cannot tell "not published" from "not
 * reachable" in that case, so it does not guess.
 */
@Singleton
public class RegistryClient {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryClient.class);

    private final Downloader downloader;
    private final String baseUrl;

    /**
     * Single shared mapper instance. Jackson's {@link ObjectMapper} is
     * thread-safe for reading.
     */
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public RegistryClient(PackagerConfig config) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), config.getRegistryUrl());
    }

    RegistryClient(HttpClient http, String baseUrl) {
        this.downloader = new Downloader(http);
        this.baseUrl = stripTrailingSlash(baseUrl);
    }

    /**
     * Fetches the release metadata of a project.
     *
     * @throws RegistryException on transport errors, non-2xx responses, or an
     *                           unparseable body
     */
    public ReleaseMetadata fetchMetadata(String name) throws RegistryException {
        String url = metadataUrl(name);
        LOG.debug("Fetching release metadata: {}", url);
        String json = downloader.toString(url);
        try {
            return mapper.readValue(json, ReleaseMetadata.class);
        } catch (JsonProcessingException e) {
            throw new RegistryException("Malformed release metadata from " + url, e);
        }
    }

    /**
     * Finds the download URL of the first file of {@code version} whose URL
     * ends with {@code platformTag}.
     *
     * <p>
     * When several files match, the first in the registry's listed order is
     * taken; the listing order carries no documented meaning, so the others
     * are only logged.
     *
     * @return the URL, or empty if the version is not listed or has no
     *         matching file
     */
    public Optional<String> findArtifactUrl(String name, String version, String platformTag)
            throws RegistryException {
        ReleaseMetadata metadata = fetchMetadata(name);
        if (!metadata.hasVersion(version)) {
            LOG.debug("{} {} is not listed in the registry", name, version);
            return Optional.empty();
        }

        List<ReleaseFile> matching = metadata.filesMatching(version, platformTag);
        if (matching.isEmpty()) {
            LOG.debug("{} {} has no file ending in {}", name, version, platformTag);
            return Optional.empty();
        }
        if (matching.size() > 1) {
            LOG.debug("{} {} lists {} files ending in {}, taking the first: {}",
                    name, version, matching.size(), platformTag, matching.get(0).url());
        }
        return Optional.of(matching.get(0).url());
    }

    /**
     * Streams an artifact to {@code target}, creating parent directories.
     */
    public void download(String url, Path target) throws RegistryException {
        LOG.info("Downloading {} → {}", url, target);
        downloader.toFile(url, target);
    }

    String metadataUrl(String name) {
        return baseUrl + "/" + URLEncoder.encode(name, StandardCharsets.UTF_8) + "/json";
    }

    private static String stripTrailingSlash(String url) {
        String result = url.strip();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
