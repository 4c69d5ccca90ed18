package de.bsommerfeld.fnpack.index;

import de.bsommerfeld.fnpack.core.domain.Distribution;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed {@link PackageIndex} for callers that already know the installed
 * set, e.g. when it was exported from another machine, and for tests.
 */
public final class InMemoryPackageIndex implements PackageIndex {

    private final Map<String, Distribution> byKey = new LinkedHashMap<>();

    public InMemoryPackageIndex(Collection<Distribution> distributions) {
        distributions.forEach(this::register);
    }

    public InMemoryPackageIndex() {
    }

    /** Registers a distribution, replacing any earlier one with the same key. */
    public InMemoryPackageIndex register(Distribution distribution) {
        byKey.put(distribution.key(), distribution);
        return this;
    }

    @Override
    public Optional<Distribution> find(String name) {
        return Optional.ofNullable(byKey.get(Distribution.canonicalize(name)));
    }

    public int size() {
        return byKey.size();
    }
}
