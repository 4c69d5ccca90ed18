package de.bsommerfeld.fnpack.packager;

import de.bsommerfeld.fnpack.packager.build.AssemblyReport;

/**
 * Summary of a finished packaging run.
 *
 * @param destination   where the archive was delivered
 * @param assembly      what went into the archive
 * @param archivedFiles number of files in the archive
 */
public record PackagingResult(String destination, AssemblyReport assembly, int archivedFiles) {
}
