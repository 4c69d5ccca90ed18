package de.bsommerfeld.fnpack.core.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The transitive closure of one root distribution, deduplicated by
 * canonical key.
 *
 * <p>
 * Iteration follows discovery order, but callers must only rely on
 * membership. The first distribution added under a key wins; later
 * additions under the same key are ignored.
 */
public final class DependencySet implements Iterable<Distribution> {

    private final String rootKey;
    private final Map<String, Distribution> byKey = new LinkedHashMap<>();

    public DependencySet(String rootName) {
        this.rootKey = Distribution.canonicalize(rootName);
    }

    /**
     * Adds the distribution unless its key is already present.
     *
     * @return {@code true} if the set changed
     */
    public boolean add(Distribution distribution) {
        return byKey.putIfAbsent(distribution.key(), distribution) == null;
    }

    public boolean contains(String name) {
        return byKey.containsKey(Distribution.canonicalize(name));
    }

    public Optional<Distribution> get(String name) {
        return Optional.ofNullable(byKey.get(Distribution.canonicalize(name)));
    }

    /** The root distribution, present once resolution has started. */
    public Optional<Distribution> root() {
        return Optional.ofNullable(byKey.get(rootKey));
    }

    /**
     * Every member except the root. These are the distributions the
     * acquisition chain installs; the root is always unpacked from its local
     * installation.
     */
    public Collection<Distribution> withoutRoot() {
        return byKey.values().stream()
                .filter(d -> !d.key().equals(rootKey))
                .toList();
    }

    public Collection<Distribution> all() {
        return Collections.unmodifiableCollection(byKey.values());
    }

    public int size() {
        return byKey.size();
    }

    @Override
    public Iterator<Distribution> iterator() {
        return all().iterator();
    }

    @Override
    public String toString() {
        return byKey.values().toString();
    }
}
