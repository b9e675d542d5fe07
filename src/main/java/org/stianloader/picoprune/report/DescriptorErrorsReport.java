package org.stianloader.picoprune.report;

import java.nio.file.Path;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

final class DescriptorErrorsReport implements Report {

    @NotNull
    private static final ReportDescription DESCRIPTION = new ReportDescription("Pkginfo Syntax Error Report",
            "This report collects all items which have invalid plist syntax in their pkginfo file.",
            ReportDescription.keys(ReportDescription.SortKey.ascending("path")),
            ReportDescription.order("path"));

    @Override
    @NotNull
    public ReportDescription describe() {
        return DESCRIPTION;
    }

    @Override
    @NotNull
    public ReportFindings collect(@NotNull RepositorySnapshot snapshot) {
        ReportFindings findings = new ReportFindings();
        for (Map.Entry<Path, String> error : snapshot.getCache().getErrors().entrySet()) {
            findings.addItem("path", error.getKey().toString(), "error", error.getValue());
        }
        return findings;
    }
}
