package de.bsommerfeld.fnpack.index;

import de.bsommerfeld.fnpack.core.domain.Distribution;

import java.util.Optional;

/**
 * Lookup of installed distributions by name.
 *
 * <p>
 * Implementations fold the name with {@link Distribution#canonicalize} before
 * looking it up, so callers may pass requirement names as written.
 *
 * @see SitePackagesIndex
 * @see InMemoryPackageIndex
 */
public interface PackageIndex {

    Optional<Distribution> find(String name);
}
