package de.bsommerfeld.fnpack.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link PackagerConfig} from a JSON file.
 *
 * <p>
 * A missing file is created with the defaults so users have a template to
 * edit. After loading, the system properties {@value #RUNTIME_PROPERTY} and
 * {@value #REGISTRY_PROPERTY} override the matching file values.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String RUNTIME_PROPERTY = "fnpack.runtime";
    public static final String REGISTRY_PROPERTY = "fnpack.registry";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ConfigLoader() {
    }

    /**
     * Reads the config at {@code path}, writing defaults first when it does
     * not exist.
     *
     * @throws IOException if the file cannot be read, written, or parsed
     */
    public static PackagerConfig load(Path path) throws IOException {
        PackagerConfig config;
        if (Files.exists(path)) {
            LOG.info("Loading configuration from: {}", path.toAbsolutePath());
            config = MAPPER.readValue(path.toFile(), PackagerConfig.class);
        } else {
            LOG.info("No configuration at {}, writing defaults", path.toAbsolutePath());
            config = new PackagerConfig();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(config));
        }
        applySystemOverrides(config);
        return config;
    }

    static void applySystemOverrides(PackagerConfig config) {
        String runtime = System.getProperty(RUNTIME_PROPERTY);
        if (runtime != null && !runtime.isBlank()) {
            config.setTargetRuntime(runtime);
        }
        String registry = System.getProperty(REGISTRY_PROPERTY);
        if (registry != null && !registry.isBlank()) {
            config.setRegistryUrl(registry);
        }
    }

    public static String toJson(PackagerConfig config) throws JsonProcessingException {
        return MAPPER.writeValueAsString(config);
    }
}
