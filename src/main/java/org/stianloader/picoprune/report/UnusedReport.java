package org.stianloader.picoprune.report;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.usage.UsageItem;

/**
 * Collects items that are neither referenced by a manifest nor required by or an update for a used item.
 */
final class UnusedReport implements Report {

    @NotNull
    private static final ReportDescription DESCRIPTION = new ReportDescription("Unused Item Report",
            "This report collects all items in the catalogs which are not used in any manifests, are not required by any items "
            + "that are in use (using the `requires` key), nor are updates for an item in use (using the `update_for` key).",
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
        for (UsageItem item : UsageSets.unused(snapshot)) {
            UsageSets.addItem(findings, item);
        }
        return findings;
    }
}
