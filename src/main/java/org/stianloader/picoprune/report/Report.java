package org.stianloader.picoprune.report;

import org.jetbrains.annotations.NotNull;

/**
 * An analysis of a repository. Reports never modify the repository or the snapshot they are given.
 */
public interface Report {

    /**
     * Obtains the static information about this report: its name, what it collects and how its findings are ordered.
     *
     * @return The description of this report
     */
    @NotNull
    ReportDescription describe();

    /**
     * Runs the analysis.
     *
     * @param snapshot The state of the repository
     * @return The unsorted findings
     */
    @NotNull
    ReportFindings collect(@NotNull RepositorySnapshot snapshot);
}
