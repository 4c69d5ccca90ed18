package de.bsommerfeld.fnpack.packager.build;

import java.util.Map;

/**
 * What went into a staging tree.
 *
 * @param sources        strategy name per installed dependency key
 * @param compilation    compiler outcome
 * @param prunedSources  number of sources removed after compilation
 */
public record AssemblyReport(Map<String, String> sources, CompilationReport compilation, int prunedSources) {

    public AssemblyReport {
        sources = Map.copyOf(sources);
    }
}
