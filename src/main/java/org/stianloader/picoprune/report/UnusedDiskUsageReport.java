package org.stianloader.picoprune.report;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.usage.UsageItem;

/**
 * Sums up the installer sizes of unused and out of date items.
 */
final class UnusedDiskUsageReport implements Report {

    static final String KEY = "Unused files account for";

    @NotNull
    private static final ReportDescription DESCRIPTION = new ReportDescription("Unused / Out Of Date Item Disk Usage", "",
            ReportDescription.keys(), ReportDescription.order());

    /**
     * Computes the disk space in gigabytes the given items take up. Items without a known size are ignored.
     *
     * @param items The items
     * @return The size in gigabytes
     */
    static double gigabytes(@NotNull Set<@NotNull UsageItem> items) {
        long kilobytes = 0;
        for (UsageItem item : items) {
            Long size = item.getSize();
            if (size != null) {
                kilobytes += size;
            }
        }
        return kilobytes / (1024D * 1024D);
    }

    @Override
    @NotNull
    public ReportDescription describe() {
        return DESCRIPTION;
    }

    @Override
    @NotNull
    public ReportFindings collect(@NotNull RepositorySnapshot snapshot) {
        // An item may be both unused and out of date, it must not be counted twice
        Set<UsageItem> items = new LinkedHashSet<>(UsageSets.unused(snapshot));
        items.addAll(UsageSets.outOfDate(snapshot));
        double gigabytes = UnusedDiskUsageReport.gigabytes(items);
        return new ReportFindings().addMetadata(KEY, String.format(Locale.ROOT, "%,.2f gigabytes", gigabytes));
    }
}
