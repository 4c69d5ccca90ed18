package de.bsommerfeld.fnpack.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IgnorePatternSetTest {

    private final IgnorePatternSet defaults = IgnorePatternSet.defaults();

    // -- defaults --

    @Test
    void matches_shouldIgnoreTopLevelCacheDirectory() {
        assertTrue(defaults.matches("__pycache__"));
        assertTrue(defaults.matches("__pycache__/mod.cpython-36.pyc"));
    }

    @Test
    void matches_shouldIgnoreNestedCacheDirectory() {
        assertTrue(defaults.matches("pkg/sub/__pycache__/mod.cpython-36.pyc"));
        assertTrue(defaults.matches("pkg/__pycache__"));
    }

    @Test
    void matches_shouldIgnoreGitMetadata() {
        assertTrue(defaults.matches(".git"));
        assertTrue(defaults.matches(".git/HEAD"));
        assertTrue(defaults.matches("vendored/.git/objects/ab/cdef"));
    }

    @Test
    void matches_shouldKeepRegularFiles() {
        assertFalse(defaults.matches("pkg/__init__.py"));
        assertFalse(defaults.matches("pkg/mod.pyc"));
        assertFalse(defaults.matches("pkg/.gitignore"));
        assertFalse(defaults.matches("pkg/git/config.py"));
    }

    @Test
    void matches_shouldNormalizeBackslashesAndLeadingSlashes() {
        assertTrue(defaults.matches("pkg\\__pycache__\\mod.pyc"));
        assertTrue(defaults.matches("/__pycache__/mod.pyc"));
    }

    @Test
    void matches_shouldRejectEmptyPath() {
        assertFalse(defaults.matches(""));
        assertFalse(defaults.matches("/"));
    }

    // -- custom globs --

    @Test
    void matches_shouldSupportWildcardsAndClasses() {
        var set = IgnorePatternSet.of(List.of("*.dist-info", "test?", "[!a]*.txt"));

        assertTrue(set.matches("foo-1.0.dist-info/RECORD"));
        assertTrue(set.matches("pkg/test1/case.py"));
        assertTrue(set.matches("notes.txt"));
        assertFalse(set.matches("about.txt"));
    }

    @Test
    void translate_shouldTreatUnterminatedBracketLiterally() {
        var set = IgnorePatternSet.of(List.of("[abc"));

        assertTrue(set.matches("[abc"));
        assertFalse(set.matches("a"));
    }
}
