package de.bsommerfeld.fnpack.registry;

import de.bsommerfeld.fnpack.core.error.RegistryException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * HTTP download utility built on {@link HttpClient}.
 *
 * <p>
 * Supports two modes: streaming to file (with atomic rename) and in-memory
 * string download for small JSON payloads. Every non-2xx status and every
 * transport failure becomes a {@link RegistryException}; nothing is retried.
 *
 * <h3>Redirect handling</h3>
 * The client passed in should follow redirects. Registry file URLs commonly
 * redirect from the API host to a CDN.
 */
final class Downloader {

    private final HttpClient http;

    Downloader(HttpClient http) {
        this.http = http;
    }

    /**
     * Downloads a URL to the given target file.
     *
     * <p>
     * The download streams into a uniquely named {@code .tmp} sibling first,
     * then is atomically renamed to the target path. Concurrent downloads of
     * the same cache entry, in one process or several, never share a temp
     * file or expose a half-written one; the last rename wins.
     */
    void toFile(String url, Path target) throws RegistryException {
        HttpResponse<InputStream> response = send(url, HttpResponse.BodyHandlers.ofInputStream());
        Path temp = null;
        try (InputStream in = response.body()) {
            Path directory = Files.createDirectories(target.toAbsolutePath().getParent());
            temp = Files.createTempFile(directory, target.getFileName() + ".", ".tmp");
            Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            RegistryException failure = new RegistryException("Download failed: " + url, e);
            try {
                if (temp != null)
                    Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    /**
     * Downloads a URL as a UTF-8 string. Used for release metadata only.
     */
    String toString(String url) throws RegistryException {
        return send(url, HttpResponse.BodyHandlers.ofString()).body();
    }

    private <T> HttpResponse<T> send(String url, HttpResponse.BodyHandler<T> handler) throws RegistryException {
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url)).GET().build();
            HttpResponse<T> response = http.send(request, handler);
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                closeBody(response);
            }
            validateStatus(response.statusCode(), url);
            return response;
        } catch (IOException | IllegalArgumentException e) {
            throw new RegistryException("Request failed: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException("Request interrupted: " + url, e);
        }
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    static void validateStatus(int status, String url) throws RegistryException {
        if (status < 200 || status >= 300) {
            throw new RegistryException("HTTP " + status + " for " + url, status);
        }
    }

    private static void closeBody(HttpResponse<?> response) throws IOException {
        if (response.body() instanceof InputStream in) {
            in.close();
        }
    }
}
