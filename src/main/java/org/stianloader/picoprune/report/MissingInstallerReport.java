package org.stianloader.picoprune.report;

import java.nio.file.Files;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Descriptor;

/**
 * Collects descriptors whose {@code installer_item_location} points to a file that does not exist.
 */
final class MissingInstallerReport implements Report {

    @NotNull
    private static final ReportDescription DESCRIPTION = new ReportDescription("Missing Installer Report",
            "This report collects all items which refer to nonexistent installers (`installer_item_location`).",
            ReportDescription.keys(ReportDescription.SortKey.ascending("name")),
            ReportDescription.order("name", "path"));

    @Override
    @NotNull
    public ReportDescription describe() {
        return DESCRIPTION;
    }

    @Override
    @NotNull
    public ReportFindings collect(@NotNull RepositorySnapshot snapshot) {
        ReportFindings findings = new ReportFindings();
        for (Descriptor descriptor : snapshot.getCache().getDescriptors().values()) {
            String installer = descriptor.getInstallerItemLocation();
            if (installer == null) {
                continue;
            }
            Path installerPath = snapshot.getLayout().installerPath(installer);
            if (!Files.exists(installerPath)) {
                findings.addItem("name", descriptor.getName(), "path", descriptor.getPath().toString(), "missing_installer", installerPath.toString());
            }
        }
        return findings;
    }
}
