package de.bsommerfeld.fnpack.packager.build;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static de.bsommerfeld.fnpack.packager.ArchiveFixtures.write;
import static org.junit.jupiter.api.Assertions.*;

class SourcePrunerTest {

    @TempDir
    Path tree;

    @Test
    void prune_shouldRemoveCompiledSourcesAndCaches() throws Exception {
        write(tree.resolve("pkg/mod.py"), "src");
        write(tree.resolve("pkg/mod.pyc"), "bytecode");
        write(tree.resolve("pkg/broken.py"), "syntax error");
        write(tree.resolve("pkg/__pycache__/mod.cpython-36.pyc"), "cached");
        write(tree.resolve("pkg/sub/__pycache__/x.pyc"), "cached");
        write(tree.resolve("pkg/data.txt"), "data");

        int removed = new SourcePruner().prune(tree);

        assertEquals(1, removed);
        assertFalse(Files.exists(tree.resolve("pkg/mod.py")));
        assertTrue(Files.exists(tree.resolve("pkg/mod.pyc")));
        assertTrue(Files.exists(tree.resolve("pkg/broken.py")));
        assertTrue(Files.exists(tree.resolve("pkg/data.txt")));
        assertFalse(Files.exists(tree.resolve("pkg/__pycache__")));
        assertFalse(Files.exists(tree.resolve("pkg/sub/__pycache__")));
    }

    @Test
    void prune_shouldLeaveSourceOnlyTreesAlone() throws Exception {
        write(tree.resolve("a.py"), "a");

        assertEquals(0, new SourcePruner().prune(tree));
        assertTrue(Files.exists(tree.resolve("a.py")));
    }
}
