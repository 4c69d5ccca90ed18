package de.bsommerfeld.fnpack.packager.build;

import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.IgnorePatternSet;
import de.bsommerfeld.fnpack.core.error.NoSuitableArtifactException;
import de.bsommerfeld.fnpack.packager.acquire.AcquisitionChain;
import de.bsommerfeld.fnpack.packager.acquire.AcquisitionStrategy;
import de.bsommerfeld.fnpack.packager.extract.ArchiveExtractor;
import de.bsommerfeld.fnpack.packager.local.LocalUnpacker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static de.bsommerfeld.fnpack.packager.ArchiveFixtures.write;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BuildTreeAssemblerTest {

    @TempDir
    Path tmp;

    @Mock
    AcquisitionChain chain;

    @Mock
    BytecodeCompiler compiler;

    @Mock
    AcquisitionStrategy wheelStrategy;

    private Path site;
    private Path staging;
    private Distribution root;
    private BuildTreeAssembler assembler;

    @BeforeEach
    void setUp() throws Exception {
        site = Files.createDirectories(tmp.resolve("site"));
        staging = Files.createDirectories(tmp.resolve("staging"));
        write(site.resolve("myfunc/__init__.py"), "def handler(event, context): pass\n");
        write(site.resolve("myfunc-0.1.dist-info/top_level.txt"), "myfunc\n");
        root = new Distribution("myfunc", "0.1", site, List.of("six"));

        LocalUnpacker unpacker = new LocalUnpacker(new ArchiveExtractor(IgnorePatternSet.defaults()));
        assembler = new BuildTreeAssembler(chain, unpacker, compiler, new SourcePruner());
    }

    @Test
    void populate_shouldAcquireDependenciesCompileAndWriteShim() throws Exception {
        Distribution six = new Distribution("six", "1.11.0", site, List.of());
        when(wheelStrategy.name()).thenReturn("cached-wheel");
        doAnswer(invocation -> {
            write(staging.resolve("six.py"), "six");
            return wheelStrategy;
        }).when(chain).acquire(staging, six);
        when(compiler.compile(any())).thenAnswer(invocation -> {
            List<Path> sources = invocation.getArgument(0);
            for (Path source : sources) {
                Files.writeString(source.resolveSibling(source.getFileName() + "c"), "bytecode");
            }
            return new CompilationReport(sources, List.of());
        });

        String entry = "from myfunc import handler\n";
        AssemblyReport report = assembler.populate(staging, root, List.of(six), entry);

        assertEquals("cached-wheel", report.sources().get("six"));
        assertEquals("local-install", report.sources().get("myfunc"));
        assertEquals(2, report.compilation().compiled().size());
        assertTrue(Files.exists(staging.resolve("myfunc/__init__.pyc")));
        assertFalse(Files.exists(staging.resolve("myfunc/__init__.py")));
        assertFalse(Files.exists(staging.resolve("six.py")));
        assertEquals(entry, Files.readString(staging.resolve("index.py")));
    }

    @Test
    void populate_shouldKeepSourcesThatFailedToCompile() throws Exception {
        when(compiler.compile(any())).thenAnswer(invocation -> {
            List<Path> sources = invocation.getArgument(0);
            return new CompilationReport(List.of(),
                    List.of(new CompilationReport.Failure(sources.get(0), "invalid syntax")));
        });

        AssemblyReport report = assembler.populate(staging, root, List.of(), "shim");

        assertEquals(1, report.compilation().failures().size());
        assertTrue(Files.exists(staging.resolve("myfunc/__init__.py")));
        verifyNoInteractions(chain);
    }

    @Test
    void populate_shouldCompileEverySourceInTree() throws Exception {
        when(compiler.compile(any())).thenReturn(CompilationReport.empty());

        assembler.populate(staging, root, List.of(), "shim");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Path>> sources = ArgumentCaptor.forClass(List.class);
        verify(compiler).compile(sources.capture());
        assertEquals(List.of(staging.resolve("myfunc/__init__.py")), sources.getValue());
    }

    @Test
    void populate_shouldStopWhenDependencyCannotBeAcquired() throws Exception {
        Distribution ghost = new Distribution("ghost", "0.1", null, List.of());
        when(chain.acquire(staging, ghost))
                .thenThrow(new NoSuitableArtifactException("ghost", "0.1", List.of("nothing"), null));

        assertThrows(NoSuitableArtifactException.class,
                () -> assembler.populate(staging, root, List.of(ghost), "shim"));
        verifyNoInteractions(compiler);
        assertFalse(Files.exists(staging.resolve("index.py")));
    }
}
