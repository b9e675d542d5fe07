package org.stianloader.picoprune.repo;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoprune.Descriptor;

/**
 * An immutable snapshot of all descriptors of a repository, keyed by their path, together with the
 * files that could not be parsed. Iteration order is the lexical order of the paths.
 */
public final class DescriptorCache {

    @NotNull
    public static final DescriptorCache EMPTY = new DescriptorCache(Collections.emptyMap(), Collections.emptyMap());

    @NotNull
    private final Map<@NotNull Path, @NotNull Descriptor> descriptors;

    @NotNull
    private final Map<@NotNull Path, @NotNull String> errors;

    public DescriptorCache(@NotNull Map<@NotNull Path, @NotNull Descriptor> descriptors, @NotNull Map<@NotNull Path, @NotNull String> errors) {
        this.descriptors = Collections.unmodifiableMap(new TreeMap<>(descriptors));
        this.errors = Collections.unmodifiableMap(new TreeMap<>(errors));
    }

    /**
     * Creates a cache from descriptors alone, keyed by {@link Descriptor#getPath()}.
     *
     * @param descriptors The descriptors
     * @return A cache without errors
     */
    @NotNull
    public static DescriptorCache of(@NotNull Collection<@NotNull Descriptor> descriptors) {
        Map<Path, Descriptor> map = new TreeMap<>();
        for (Descriptor descriptor : descriptors) {
            if (map.put(descriptor.getPath(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate descriptor path " + descriptor.getPath());
            }
        }
        return new DescriptorCache(map, Collections.emptyMap());
    }

    @Contract(pure = true)
    public boolean contains(@NotNull Path path) {
        return this.descriptors.containsKey(path);
    }

    @Nullable
    public Descriptor get(@NotNull Path path) {
        return this.descriptors.get(path);
    }

    @NotNull
    @Contract(pure = true)
    public Map<@NotNull Path, @NotNull Descriptor> getDescriptors() {
        return this.descriptors;
    }

    /**
     * Obtains the files which could not be parsed as descriptors, mapped to the reason why.
     *
     * @return The parse errors
     */
    @NotNull
    @Contract(pure = true)
    public Map<@NotNull Path, @NotNull String> getErrors() {
        return this.errors;
    }

    /**
     * Collects the names of all descriptors in this cache.
     *
     * @return A sorted set of product names
     */
    @NotNull
    public Set<@NotNull String> names() {
        Set<String> names = new TreeSet<>();
        for (Descriptor descriptor : this.descriptors.values()) {
            names.add(descriptor.getName());
        }
        return names;
    }

    public int size() {
        return this.descriptors.size();
    }

    /**
     * Computes the cache as it would look after the given paths were removed. Paths that are
     * not part of this cache, such as installer items, are ignored.
     *
     * @param removals The paths to remove
     * @return A new cache without these paths
     */
    @NotNull
    public DescriptorCache without(@NotNull Collection<@NotNull Path> removals) {
        Map<Path, Descriptor> remaining = new TreeMap<>(this.descriptors);
        remaining.keySet().removeAll(removals);
        return new DescriptorCache(remaining, this.errors);
    }
}
