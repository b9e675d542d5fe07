package org.stianloader.picoprune.report;

import java.util.LinkedHashSet;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.usage.UsageItem;
import org.stianloader.picoprune.usage.UsageResolver;

/**
 * Item sets shared by the usage based reports.
 */
final class UsageSets {

    static void addItem(@NotNull ReportFindings findings, @NotNull UsageItem item) {
        findings.addItem("name", item.getName(), "version", item.getVersion().getOriginText(),
                "path", item.getPath().toString(), "size", item.getHumanReadableSize());
    }

    /**
     * Production versions of used products which are older than the current versions.
     */
    @NotNull
    static Set<@NotNull UsageItem> outOfDate(@NotNull RepositorySnapshot snapshot) {
        Set<String> production = snapshot.getLayout().getCatalogPolicy().productionFilter();
        UsageResolver resolver = snapshot.getResolver();
        Set<UsageItem> items = resolver.resolve(snapshot.getManifestReferences(), production, UsageResolver.KEEP_ALL);
        items.removeAll(resolver.resolve(snapshot.getManifestReferences(), production, snapshot.getCurrentVersions()));
        return items;
    }

    /**
     * Items which no manifest uses, directly or indirectly, in any catalog.
     */
    @NotNull
    static Set<@NotNull UsageItem> unused(@NotNull RepositorySnapshot snapshot) {
        UsageResolver resolver = snapshot.getResolver();
        Set<UsageItem> items = new LinkedHashSet<>(resolver.allItems());
        items.removeAll(resolver.resolve(snapshot.getManifestReferences(), null, UsageResolver.KEEP_ALL));
        return items;
    }

    private UsageSets() {
        throw new UnsupportedOperationException();
    }
}
