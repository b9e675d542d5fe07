package org.stianloader.picoprune.report;

import java.util.EnumMap;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.logging.LoggingAdapter;

/**
 * All reports, in the order they are run and printed.
 */
public enum ReportKind {

    PATH_ISSUES(new InstallerPathReport()),
    MISSING_INSTALLER(new MissingInstallerReport()),
    ORPHANED_INSTALLER(new OrphanedInstallerReport()),
    DESCRIPTOR_ERRORS(new DescriptorErrorsReport()),
    OUT_OF_DATE(new OutOfDateReport()),
    UNUSED(new UnusedReport()),
    UNUSED_DISK_USAGE(new UnusedDiskUsageReport()),
    UNATTENDED_TESTING(new DescriptorConditionReport("Unattended Installs in Testing Report",
            "This report collects all items in the testing catalogs which do not require user-intervention "
            + "(i.e. use the 'unattended_install: True' setting).",
            (policy, descriptor) -> policy.isInTesting(descriptor) && descriptor.isUnattendedInstall())),
    ATTENDED_PRODUCTION(new DescriptorConditionReport("Attended Installs in Production Report",
            "This report collects all items in the production catalog which require user-intervention "
            + "(i.e. do not use the 'unattended_install: True' setting).",
            (policy, descriptor) -> policy.isInProduction(descriptor) && !descriptor.isUnattendedInstall())),
    FORCE_INSTALL_TESTING(new DescriptorConditionReport("Testing Non-Forced Installation Report",
            "This report collects all items in the testing catalogs which do not use the `force_install_after_date` key in their pkginfo.",
            (policy, descriptor) -> policy.isInTesting(descriptor) && descriptor.getForceInstallAfterDate() == null)),
    FORCE_INSTALL_PRODUCTION(new DescriptorConditionReport("Production Forced Installation Report",
            "This report collects all items in the production catalog which use the `force_install_after_date` key in their pkginfo.",
            (policy, descriptor) -> policy.isInProduction(descriptor) && descriptor.getForceInstallAfterDate() != null));

    /**
     * Runs every report against the snapshot and sorts their findings.
     *
     * @param snapshot The state of the repository
     * @return The sorted findings of every report, in run order
     */
    @NotNull
    public static Map<@NotNull ReportKind, @NotNull ReportFindings> runAll(@NotNull RepositorySnapshot snapshot) {
        Map<ReportKind, ReportFindings> results = new EnumMap<>(ReportKind.class);
        for (ReportKind kind : ReportKind.values()) {
            results.put(kind, kind.run(snapshot));
        }
        return results;
    }

    @NotNull
    private final Report report;

    private ReportKind(@NotNull Report report) {
        this.report = report;
    }

    @NotNull
    @Contract(pure = true)
    public ReportDescription describe() {
        return this.report.describe();
    }

    /**
     * Runs this report and sorts the findings by the sort keys of the report.
     *
     * @param snapshot The state of the repository
     * @return The sorted findings
     */
    @NotNull
    public ReportFindings run(@NotNull RepositorySnapshot snapshot) {
        ReportDescription description = this.report.describe();
        LoggingAdapter.getDefaultLogger().debug(ReportKind.class, "Running {}", description.name());
        return this.report.collect(snapshot).sort(description.sortKeys());
    }
}
