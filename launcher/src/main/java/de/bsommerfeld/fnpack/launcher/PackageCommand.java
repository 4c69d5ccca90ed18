package de.bsommerfeld.fnpack.launcher;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.fnpack.core.config.ConfigLoader;
import de.bsommerfeld.fnpack.core.config.PackagerConfig;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import de.bsommerfeld.fnpack.core.error.PackagingException;
import de.bsommerfeld.fnpack.core.util.StorageUtils;
import de.bsommerfeld.fnpack.packager.FunctionPackager;
import de.bsommerfeld.fnpack.packager.PackagingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Packages one installed distribution into a function archive.
 *
 * <pre>
 * fnpack &lt;package&gt; &lt;destination&gt; (--entry &lt;text&gt; | --entry-file &lt;path&gt;)
 *        [--config &lt;path&gt;] [--runtime &lt;id&gt;]
 * </pre>
 *
 * Returns {@link PackagerMain#EXIT_OK} once the archive is written and
 * {@link PackagerMain#EXIT_FAILURE} when packaging fails; the cause is
 * logged.
 */
@Command(name = "fnpack",
        mixinStandardHelpOptions = true,
        version = "fnpack 1.0.0",
        description = "Builds a deployable function archive from an installed Python project")
final class PackageCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(PackageCommand.class);

    @Parameters(index = "0", paramLabel = "<package>",
            description = "Name of the installed root distribution")
    private String packageName;

    @Parameters(index = "1", paramLabel = "<destination>",
            description = "Archive destination, a path or file: URI")
    private String destination;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private EntrySource entrySource;

    @Option(names = "--config", paramLabel = "<path>",
            description = "Configuration file (default: the per-user fnpack config)")
    private Path configFile;

    @Option(names = "--runtime", paramLabel = "<id>", converter = RuntimeConverter.class,
            description = "Target runtime, e.g. python3.6 (default: configured runtime)")
    private TargetRuntime runtime;

    static final class EntrySource {

        @Option(names = "--entry", paramLabel = "<text>", required = true,
                description = "Handler shim source, written as index.py")
        private String text;

        @Option(names = "--entry-file", paramLabel = "<path>", required = true,
                description = "File holding the handler shim source")
        private Path file;
    }

    static final class RuntimeConverter implements ITypeConverter<TargetRuntime> {

        @Override
        public TargetRuntime convert(String value) {
            return TargetRuntime.of(value);
        }
    }

    @Override
    public Integer call() {
        try {
            PackagerConfig config = loadConfig();
            Injector injector = Guice.createInjector(new PackagerModule(config));
            FunctionPackager packager = injector.getInstance(FunctionPackager.class);

            PackagingResult result = packager.pack(packageName, entryText(), destination);

            LOG.info("Packaged {} distributions ({} files) into {}", result.assembly().sources().size(),
                    result.archivedFiles(), result.destination());
            if (!result.assembly().compilation().failures().isEmpty()) {
                LOG.warn("{} sources shipped uncompiled", result.assembly().compilation().failures().size());
            }
            return PackagerMain.EXIT_OK;
        } catch (PackagingException e) {
            LOG.error("Packaging failed: {}", e.getMessage(), e);
        } catch (IOException e) {
            LOG.error("I/O failure while packaging", e);
        } catch (CreationException | ProvisionException | IllegalArgumentException e) {
            LOG.error("Failed to set up packaging", e);
        }
        return PackagerMain.EXIT_FAILURE;
    }

    PackagerConfig loadConfig() throws IOException {
        Path file = configFile != null ? configFile : StorageUtils.getConfigFile();
        PackagerConfig config = ConfigLoader.load(file);
        if (runtime != null)
            config.setTargetRuntime(runtime.id());
        return config;
    }

    /** The shim text, read from {@code --entry-file} when not given inline. */
    String entryText() throws IOException {
        return entrySource.text != null
                ? entrySource.text
                : Files.readString(entrySource.file, StandardCharsets.UTF_8);
    }

    String packageName() {
        return packageName;
    }

    String destination() {
        return destination;
    }

    Path configFile() {
        return configFile;
    }

    TargetRuntime runtime() {
        return runtime;
    }
}
