package org.stianloader.picoprune.usage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoprune.Descriptor;
import org.stianloader.picoprune.Manifest;
import org.stianloader.picoprune.repo.DescriptorCache;
import org.stianloader.picoprune.version.LooseVersion;

/**
 * Computes which descriptors of a repository are in use.
 *
 * <p>A product is used if a manifest references it by name, if a used product {@code requires} it
 * or if it is an {@code update_for} a used product. These relations are followed transitively: the
 * names form the nodes of a directed graph whose edges point from a product to the products it requires
 * and from a product to the products that update it. The used names are everything reachable from
 * the manifest references, computed with a worklist so that long {@code requires} chains
 * do not cause deep recursion.
 *
 * <p>Names that no descriptor carries are kept in the name closure but can never materialize as a
 * {@link UsageItem}. Dangling references are no concern of the resolver.
 */
public class UsageResolver {

    /**
     * Sentinel value for {@link #resolve(Collection, Set, int)} which keeps all versions of a used product.
     */
    public static final int KEEP_ALL = Integer.MAX_VALUE;

    @NotNull
    public static Set<@NotNull UsageItem> resolve(@NotNull DescriptorCache cache, @NotNull Collection<@NotNull Manifest> manifests,
            @Nullable Set<@NotNull String> catalogFilter, int keepCount) {
        return new UsageResolver(cache).resolve(ManifestReferences.collect(manifests), catalogFilter, keepCount);
    }

    // All descriptors of a name, in path order
    @NotNull
    private final Map<@NotNull String, @NotNull List<@NotNull Descriptor>> descriptorsByName = new HashMap<>();

    @NotNull
    private final DescriptorCache cache;

    public UsageResolver(@NotNull DescriptorCache cache) {
        this.cache = cache;
        for (Descriptor descriptor : cache.getDescriptors().values()) {
            this.descriptorsByName.computeIfAbsent(descriptor.getName(), (name) -> new ArrayList<>()).add(descriptor);
        }
    }

    @Contract(pure = true)
    private static boolean acceptsCatalogs(@NotNull Descriptor descriptor, @Nullable Set<@NotNull String> catalogFilter) {
        if (catalogFilter == null) {
            return true;
        }
        for (String catalog : descriptor.getCatalogs()) {
            if (catalogFilter.contains(catalog)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Obtains every descriptor of the repository as a usage item, regardless of whether it is used.
     *
     * @return One item per distinct name and version
     */
    @NotNull
    public Set<@NotNull UsageItem> allItems() {
        Set<UsageItem> items = new LinkedHashSet<>();
        for (Descriptor descriptor : this.cache.getDescriptors().values()) {
            items.add(UsageItem.of(descriptor));
        }
        return items;
    }

    @NotNull
    @Contract(pure = true)
    public DescriptorCache getCache() {
        return this.cache;
    }

    /**
     * Resolves the used items.
     *
     * <p>The closure is computed as by {@link #usedNames(Collection, Set)}. Afterwards, for every used name
     * the descriptors that satisfy the catalog filter are ordered by version, newest first, and only
     * the {@code keepCount} newest versions are kept.
     *
     * @param seeds The names referenced by manifests
     * @param catalogFilter The catalogs descriptors must be member of (any of them) in order to be considered, or null for no restriction
     * @param keepCount The maximum amount of versions to keep per name, {@link #KEEP_ALL} to keep everything
     * @return The used items
     */
    @NotNull
    public Set<@NotNull UsageItem> resolve(@NotNull Collection<@NotNull String> seeds, @Nullable Set<@NotNull String> catalogFilter, int keepCount) {
        if (keepCount < 0) {
            throw new IllegalArgumentException("keepCount may not be negative, but was " + keepCount);
        }

        Set<UsageItem> used = new LinkedHashSet<>();
        for (String name : this.usedNames(seeds, catalogFilter)) {
            List<Descriptor> descriptors = this.descriptorsByName.get(name);
            if (descriptors == null) {
                continue;
            }
            // Newest version first. The first descriptor (in path order) stands in for duplicate versions
            Map<LooseVersion, Descriptor> versions = new TreeMap<>(Collections.reverseOrder());
            for (Descriptor descriptor : descriptors) {
                if (UsageResolver.acceptsCatalogs(descriptor, catalogFilter)) {
                    versions.putIfAbsent(descriptor.getVersion(), descriptor);
                }
            }
            int kept = 0;
            for (Descriptor descriptor : versions.values()) {
                if (kept++ == keepCount) {
                    break;
                }
                used.add(UsageItem.of(descriptor));
            }
        }
        return used;
    }

    /**
     * Computes the closure of used names.
     *
     * <p>Every seed is used. A descriptor of a used name that satisfies the catalog filter makes all names in
     * its {@code requires} array used. A descriptor that satisfies the catalog filter and whose {@code update_for}
     * array contains a used name makes its own name used. This is repeated until no more names are added.
     * The catalog filter never applies to the seeds themselves.
     *
     * @param seeds The names referenced by manifests
     * @param catalogFilter The catalogs descriptors must be member of in order to be expanded, or null for no restriction
     * @return The used names, in the order they were discovered
     */
    @NotNull
    public Set<@NotNull String> usedNames(@NotNull Collection<@NotNull String> seeds, @Nullable Set<@NotNull String> catalogFilter) {
        // Reverse index of update_for: target name -> names of its updates
        Map<String, Set<String>> updatesByTarget = new HashMap<>();
        Map<String, Set<String>> requiresByName = new LinkedHashMap<>();
        for (Descriptor descriptor : this.cache.getDescriptors().values()) {
            if (!UsageResolver.acceptsCatalogs(descriptor, catalogFilter)) {
                continue;
            }
            requiresByName.computeIfAbsent(descriptor.getName(), (name) -> new LinkedHashSet<>()).addAll(descriptor.getRequires());
            for (String target : descriptor.getUpdateFor()) {
                updatesByTarget.computeIfAbsent(target, (name) -> new LinkedHashSet<>()).add(descriptor.getName());
            }
        }

        Set<String> used = new LinkedHashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        for (String seed : seeds) {
            if (used.add(seed)) {
                worklist.add(seed);
            }
        }

        while (!worklist.isEmpty()) {
            String name = worklist.poll();
            for (String required : requiresByName.getOrDefault(name, Collections.emptySet())) {
                if (used.add(required)) {
                    worklist.add(required);
                }
            }
            for (String update : updatesByTarget.getOrDefault(name, Collections.emptySet())) {
                if (used.add(update)) {
                    worklist.add(update);
                }
            }
        }

        return used;
    }
}
