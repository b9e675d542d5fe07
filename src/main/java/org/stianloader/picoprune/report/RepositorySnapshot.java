package org.stianloader.picoprune.report;

import java.util.Collections;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.repo.DescriptorCache;
import org.stianloader.picoprune.repo.DescriptorStore;
import org.stianloader.picoprune.repo.ManifestStore;
import org.stianloader.picoprune.repo.RepositoryLayout;
import org.stianloader.picoprune.usage.ManifestReferences;
import org.stianloader.picoprune.usage.UsageResolver;

/**
 * Everything {@link Report reports} operate on: the layout, the descriptors, the names referenced by manifests
 * and a resolver over these descriptors.
 */
public final class RepositorySnapshot {

    public static final int DEFAULT_CURRENT_VERSIONS = 1;

    /**
     * Reads the descriptors and manifests of a repository.
     *
     * @param layout The repository
     * @return The snapshot
     */
    @NotNull
    public static RepositorySnapshot load(@NotNull RepositoryLayout layout) {
        return RepositorySnapshot.load(layout, RepositorySnapshot.DEFAULT_CURRENT_VERSIONS);
    }

    /**
     * Reads the descriptors and manifests of a repository.
     *
     * @param layout The repository
     * @param currentVersions The amount of newest versions of a used product that count as current
     * @return The snapshot
     */
    @NotNull
    public static RepositorySnapshot load(@NotNull RepositoryLayout layout, int currentVersions) {
        DescriptorCache cache = new DescriptorStore(layout).load();
        Set<String> references = ManifestReferences.collect(new ManifestStore(layout).load());
        return new RepositorySnapshot(layout, cache, references, currentVersions);
    }

    @NotNull
    private final DescriptorCache cache;
    private final int currentVersions;
    @NotNull
    private final RepositoryLayout layout;
    @NotNull
    private final Set<@NotNull String> manifestReferences;
    @NotNull
    private final UsageResolver resolver;

    public RepositorySnapshot(@NotNull RepositoryLayout layout, @NotNull DescriptorCache cache, @NotNull Set<@NotNull String> manifestReferences, int currentVersions) {
        if (currentVersions < 1) {
            throw new IllegalArgumentException("At least one version of a product must count as current, got " + currentVersions);
        }
        this.layout = layout;
        this.currentVersions = currentVersions;
        this.cache = cache;
        this.manifestReferences = Collections.unmodifiableSet(manifestReferences);
        this.resolver = new UsageResolver(cache);
    }

    @NotNull
    @Contract(pure = true)
    public DescriptorCache getCache() {
        return this.cache;
    }

    /**
     * Obtains how many of the newest production versions of a used product are considered current.
     * Older versions are reported as out of date.
     *
     * @return The amount of current versions, at least 1
     */
    @Contract(pure = true)
    public int getCurrentVersions() {
        return this.currentVersions;
    }

    @NotNull
    @Contract(pure = true)
    public RepositoryLayout getLayout() {
        return this.layout;
    }

    /**
     * Obtains the names referenced by any manifest, which seed the usage closure.
     *
     * @return The referenced names
     */
    @NotNull
    @Contract(pure = true)
    public Set<@NotNull String> getManifestReferences() {
        return this.manifestReferences;
    }

    @NotNull
    @Contract(pure = true)
    public UsageResolver getResolver() {
        return this.resolver;
    }
}
