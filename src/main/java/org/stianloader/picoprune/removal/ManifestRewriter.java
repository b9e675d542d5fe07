package org.stianloader.picoprune.removal;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Manifest;
import org.stianloader.picoprune.Manifest.ReferenceList;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.repo.ManifestStore;

/**
 * Strips product names from the reference arrays of manifests.
 *
 * <p>Only entries that equal a name exactly are removed. An entry that starts with a name but does
 * not end with any of the names is merely reported as an advisory: such entries are likely to be other
 * products sharing a prefix (e.g. "Foo" and "FooBar"), which must be removed manually if at all.
 */
public class ManifestRewriter {

    @NotNull
    private final ManifestStore store;

    public ManifestRewriter(@NotNull ManifestStore store) {
        this.store = store;
    }

    /**
     * Checks whether an entry that is not removed looks like it could be one of the removed names.
     */
    private static boolean isSimilar(@NotNull String entry, @NotNull Set<@NotNull String> names) {
        boolean prefixMatch = false;
        for (String name : names) {
            if (entry.endsWith(name)) {
                return false;
            }
            prefixMatch |= entry.startsWith(name);
        }
        return prefixMatch;
    }

    /**
     * Removes the names from a single manifest in memory.
     *
     * @param manifest The manifest to modify
     * @param names The names to remove
     * @param result The result to report changes and advisories to
     * @return True if the manifest was modified
     */
    boolean strip(@NotNull Manifest manifest, @NotNull Set<@NotNull String> names, @NotNull RemovalResult result) {
        boolean changed = false;
        for (ReferenceList list : manifest.getReferenceLists()) {
            // Collect first, mutate afterwards
            List<Object> removals = new ArrayList<>();
            for (Object entry : list.entries()) {
                if (!(entry instanceof String)) {
                    continue;
                }
                String item = (String) entry;
                if (names.contains(item)) {
                    LoggingAdapter.getDefaultLogger().info(ManifestRewriter.class, "Removing {} from {} of manifest {}", item, list, manifest.getName());
                    result.addManifestChange(manifest.getName(), "Removing " + item + " from " + list);
                    removals.add(item);
                } else if (ManifestRewriter.isSimilar(item, names)) {
                    String advisory = "Found item " + item + " in " + list + " of manifest " + manifest.getName()
                            + " that may match a name to remove, but the length is wrong. Please remove manually if required!";
                    LoggingAdapter.getDefaultLogger().warn(ManifestRewriter.class, advisory);
                    result.addAdvisory(advisory);
                }
            }
            for (Object removal : removals) {
                list.entries().remove(removal);
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Removes the names from every manifest of the store. Manifests are only written if they changed.
     * A manifest that cannot be written is reported as a failure of the result.
     *
     * @param names The names to remove
     * @param result The result to report to
     */
    public void rewrite(@NotNull Set<@NotNull String> names, @NotNull RemovalResult result) {
        if (names.isEmpty()) {
            return;
        }
        result.addStrippedNames(names);
        for (Manifest manifest : this.store.load()) {
            LoggingAdapter.getDefaultLogger().debug(ManifestRewriter.class, "Looking for name removals in {}", manifest.getPath());
            if (!this.strip(manifest, names, result)) {
                continue;
            }
            try {
                this.store.write(manifest);
            } catch (PropertyListException e) {
                LoggingAdapter.getDefaultLogger().error(ManifestRewriter.class, "Unable to write manifest {}", manifest.getPath(), e);
                result.addFailure(manifest.getPath(), e.getMessage());
            }
        }
    }
}
