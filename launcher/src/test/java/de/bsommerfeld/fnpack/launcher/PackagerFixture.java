package de.bsommerfeld.fnpack.launcher;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * A site-packages directory holding {@code myfunc 0.1} (requires six) and
 * {@code six 1.11.0}, a pip cache with a six wheel, and a config file
 * pointing at both. Nothing in it needs an interpreter: all modules ship
 * precompiled.
 */
final class PackagerFixture {

    static final String WHEEL_TAG = "cp36-cp36m-manylinux1_x86_64.whl";

    final Path root;
    final Path site;
    final Path pipCache;
    final Path configFile;

    PackagerFixture(Path root) throws IOException {
        this.root = root;
        this.site = root.resolve("site-packages");
        this.pipCache = root.resolve("pip");
        this.configFile = root.resolve("config.json");

        write(site.resolve("myfunc-0.1.dist-info/METADATA"), "Name: myfunc\nVersion: 0.1\nRequires-Dist: six\n");
        write(site.resolve("myfunc-0.1.dist-info/top_level.txt"), "myfunc\n");
        write(site.resolve("myfunc/__init__.pyc"), "bytecode");
        write(site.resolve("six-1.11.0.dist-info/METADATA"), "Name: six\nVersion: 1.11.0\n");

        Files.createDirectories(pipCache.resolve("wheels/aa"));
        try (OutputStream out = Files.newOutputStream(pipCache.resolve("wheels/aa/six-1.11.0-" + WHEEL_TAG));
                ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry("six.pyc"));
            zip.write("six bytecode".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("target-runtime", "python3.6");
        config.put("python-executable", root.resolve("no-python").toString());
        config.put("site-packages", List.of(site.toString()));
        config.put("wheel-cache-dir", pipCache.toString());
        config.put("private-cache-dir", root.resolve("private").toString());
        config.put("registry-url", "http://127.0.0.1:9/pypi");
        new ObjectMapper().writeValue(configFile.toFile(), config);
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
