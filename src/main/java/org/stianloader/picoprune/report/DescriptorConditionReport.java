package org.stianloader.picoprune.report;

import java.util.function.BiPredicate;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Descriptor;
import org.stianloader.picoprune.repo.CatalogPolicy;

/**
 * Collects every descriptor that satisfies a condition on its catalogs and install settings.
 */
final class DescriptorConditionReport implements Report {

    @NotNull
    private final BiPredicate<@NotNull CatalogPolicy, @NotNull Descriptor> condition;

    @NotNull
    private final ReportDescription description;

    DescriptorConditionReport(@NotNull String name, @NotNull String description, @NotNull BiPredicate<@NotNull CatalogPolicy, @NotNull Descriptor> condition) {
        this.description = new ReportDescription(name, description,
                ReportDescription.keys(ReportDescription.SortKey.ascending("name"), ReportDescription.SortKey.descending("version")),
                ReportDescription.order("name", "version", "path"));
        this.condition = condition;
    }

    @Override
    @NotNull
    public ReportDescription describe() {
        return this.description;
    }

    @Override
    @NotNull
    public ReportFindings collect(@NotNull RepositorySnapshot snapshot) {
        ReportFindings findings = new ReportFindings();
        CatalogPolicy policy = snapshot.getLayout().getCatalogPolicy();
        for (Descriptor descriptor : snapshot.getCache().getDescriptors().values()) {
            if (this.condition.test(policy, descriptor)) {
                findings.addItem("name", descriptor.getName(), "version", descriptor.getVersion().getOriginText(), "path", descriptor.getPath().toString());
            }
        }
        return findings;
    }
}
