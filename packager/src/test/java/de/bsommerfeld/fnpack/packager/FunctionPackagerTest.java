package de.bsommerfeld.fnpack.packager;

import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.error.NoSuitableArtifactException;
import de.bsommerfeld.fnpack.core.error.OutputNotSupportedException;
import de.bsommerfeld.fnpack.core.error.UnresolvedDependencyException;
import de.bsommerfeld.fnpack.index.DependencyResolver;
import de.bsommerfeld.fnpack.index.InMemoryPackageIndex;
import de.bsommerfeld.fnpack.packager.archive.ArchiveWriter;
import de.bsommerfeld.fnpack.packager.build.AssemblyReport;
import de.bsommerfeld.fnpack.packager.build.BuildTreeAssembler;
import de.bsommerfeld.fnpack.packager.build.CompilationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static de.bsommerfeld.fnpack.packager.ArchiveFixtures.entryNames;
import static de.bsommerfeld.fnpack.packager.ArchiveFixtures.write;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FunctionPackagerTest {

    @TempDir
    Path tmp;

    @Mock
    BuildTreeAssembler assembler;

    private FunctionPackager packager;
    private final AtomicReference<Path> staging = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        InMemoryPackageIndex index = new InMemoryPackageIndex(List.of(
                new Distribution("myfunc", "0.1", tmp, List.of("six")),
                new Distribution("six", "1.11.0", tmp, List.of())));
        packager = new FunctionPackager(new DependencyResolver(index), assembler, new ArchiveWriter(true));
    }

    @Test
    void pack_shouldDeliverArchiveAndCleanUp() throws Exception {
        when(assembler.populate(any(), any(), any(), anyString())).thenAnswer(invocation -> {
            Path tree = invocation.getArgument(0);
            staging.set(tree);
            write(tree.resolve("index.py"), invocation.getArgument(3));
            write(tree.resolve("myfunc/__init__.pyc"), "bytecode");
            return new AssemblyReport(Map.of(), CompilationReport.empty(), 0);
        });
        Path destination = tmp.resolve("dist/function.zip");

        PackagingResult result = packager.pack("MyFunc", "shim", destination.toString());

        assertEquals(2, result.archivedFiles());
        assertEquals(List.of("index.py", "myfunc/__init__.pyc"), entryNames(destination));
        assertFalse(Files.exists(staging.get()));
    }

    @Test
    void pack_shouldHandRootAndOtherDependenciesSeparately() throws Exception {
        when(assembler.populate(any(), any(), any(), anyString()))
                .thenReturn(new AssemblyReport(Map.of(), CompilationReport.empty(), 0));

        packager.pack("myfunc", "shim", tmp.resolve("f.zip").toString());

        verify(assembler).populate(any(), eq(new Distribution("myfunc", "0.1", tmp, List.of())),
                argThat((Collection<Distribution> deps) -> deps.size() == 1
                        && deps.iterator().next().key().equals("six")),
                eq("shim"));
    }

    @Test
    void pack_shouldLeaveDestinationUntouchedOnFailure() throws Exception {
        when(assembler.populate(any(), any(), any(), anyString())).thenAnswer(invocation -> {
            staging.set(invocation.getArgument(0));
            throw new NoSuitableArtifactException("six", "1.11.0", List.of("nothing"), null);
        });
        Path destination = tmp.resolve("function.zip");

        assertThrows(NoSuitableArtifactException.class,
                () -> packager.pack("myfunc", "shim", destination.toString()));
        assertFalse(Files.exists(destination));
        assertFalse(Files.exists(staging.get()));
    }

    @Test
    void pack_shouldFailForUnknownRoot() {
        UnresolvedDependencyException e = assertThrows(UnresolvedDependencyException.class,
                () -> packager.pack("unknown", "shim", tmp.resolve("f.zip").toString()));
        assertNull(e.requiredBy());
        verifyNoInteractions(assembler);
    }

    @Test
    void pack_shouldRejectRemoteDestinationBeforeWork() {
        assertThrows(OutputNotSupportedException.class,
                () -> packager.pack("myfunc", "shim", "s3://bucket/function.zip"));
        verifyNoInteractions(assembler);
    }

    @Test
    void pack_shouldRejectMalformedFileUriBeforeWork() {
        assertThrows(OutputNotSupportedException.class,
                () -> packager.pack("myfunc", "shim", "file://function.zip"));
        verifyNoInteractions(assembler);
    }
}
