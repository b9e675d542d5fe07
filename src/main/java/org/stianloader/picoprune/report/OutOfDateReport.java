package org.stianloader.picoprune.report;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.usage.UsageItem;

/**
 * Collects production versions of used products that were superseded by newer production versions.
 */
final class OutOfDateReport implements Report {

    @NotNull
    private static final ReportDescription DESCRIPTION = new ReportDescription("Out of Date Items Report",
            "This report collects all items which are in the production catalog, but are not the current release version. "
            + "Items that have dependencies to current releases through either the `requires` or `update_for` keys are excluded. "
            + "Items in non-production catalogs are also excluded from consideration by this report.",
            ReportDescription.keys(ReportDescription.SortKey.ascending("name"), ReportDescription.SortKey.descending("version")),
            ReportDescription.order("name", "version", "path", "size"));

    @Override
    @NotNull
    public ReportDescription describe() {
        return DESCRIPTION;
    }

    @Override
    @NotNull
    public ReportFindings collect(@NotNull RepositorySnapshot snapshot) {
        ReportFindings findings = new ReportFindings();
        for (UsageItem item : UsageSets.outOfDate(snapshot)) {
            UsageSets.addItem(findings, item);
        }
        return findings;
    }
}
