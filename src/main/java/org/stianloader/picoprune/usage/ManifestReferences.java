package org.stianloader.picoprune.usage;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Manifest;
import org.stianloader.picoprune.Manifest.ReferenceList;

/**
 * Collects the product names manifests refer to. These names seed the usage closure.
 */
public final class ManifestReferences {

    /**
     * Collects every name listed in the {@code managed_installs}, {@code managed_uninstalls},
     * {@code optional_installs} and {@code managed_updates} arrays of the manifests, including those
     * inside of {@code conditional_items}. Non-string entries are ignored.
     *
     * @param manifests The manifests
     * @return The referenced names, sorted
     */
    @NotNull
    public static Set<@NotNull String> collect(@NotNull Collection<@NotNull Manifest> manifests) {
        Set<String> names = new TreeSet<>();
        for (Manifest manifest : manifests) {
            for (ReferenceList list : manifest.getReferenceLists()) {
                for (Object entry : list.entries()) {
                    if (entry instanceof String) {
                        names.add((String) entry);
                    }
                }
            }
        }
        return names;
    }

    private ManifestReferences() {
        throw new UnsupportedOperationException();
    }
}
