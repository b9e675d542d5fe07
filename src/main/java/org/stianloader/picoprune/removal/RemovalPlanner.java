package org.stianloader.picoprune.removal;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Descriptor;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.stianloader.picoprune.repo.DescriptorCache;
import org.stianloader.picoprune.repo.RepositoryLayout;

/**
 * Turns a {@link RemovalSelection} into a concrete {@link RemovalPlan}.
 *
 * <p>Only product names of which no descriptor survives the removal are scheduled for removal from
 * manifests. Removing an old version of a product therefore never touches the manifests.
 */
public class RemovalPlanner {

    @NotNull
    private final RepositoryLayout layout;

    public RemovalPlanner(@NotNull RepositoryLayout layout) {
        this.layout = layout;
    }

    private boolean isSelected(@NotNull Descriptor descriptor, @NotNull RemovalSelection selection, @NotNull Set<Path> listedPaths) {
        String category = descriptor.getCategory();
        if (category == null) {
            if (selection.getCategories().contains(RemovalSelection.NO_CATEGORY)) {
                return true;
            }
        } else if (selection.getCategories().contains(category)) {
            return true;
        }
        return selection.getNames().contains(descriptor.getName()) || listedPaths.contains(descriptor.getPath());
    }

    @NotNull
    public RemovalPlan plan(@NotNull RemovalSelection selection, @NotNull DescriptorCache cache) {
        // Entries of a removal list that are no longer in the cache were already removed by an earlier run
        Set<Path> listedPaths = new HashSet<>();
        for (String listed : selection.getListedPaths()) {
            Path path = Paths.get(listed);
            listedPaths.add((path.isAbsolute() ? path : this.layout.getRoot().resolve(path)).normalize());
        }

        Set<Path> descriptorRemovals = new TreeSet<>();
        Set<Path> installerRemovals = new TreeSet<>();
        Set<String> removedNames = new TreeSet<>();
        for (Descriptor descriptor : cache.getDescriptors().values()) {
            if (!this.isSelected(descriptor, selection, listedPaths)) {
                continue;
            }
            descriptorRemovals.add(descriptor.getPath());
            removedNames.add(descriptor.getName());
            String installer = descriptor.getInstallerItemLocation();
            if (installer != null) {
                installerRemovals.add(this.layout.installerPath(installer));
            }
        }

        // A name only leaves the manifests if no version of it survives
        Set<String> names = new TreeSet<>(removedNames);
        names.removeAll(cache.without(descriptorRemovals).names());

        List<String> warnings = new ArrayList<>();
        for (Descriptor descriptor : cache.getDescriptors().values()) {
            String installer = descriptor.getInstallerItemLocation();
            if (installer == null || descriptorRemovals.contains(descriptor.getPath())) {
                continue;
            }
            Path installerPath = this.layout.installerPath(installer);
            if (installerRemovals.contains(installerPath)) {
                String warning = "Package '" + installerPath + "' is targeted for removal, but has references in pkginfo '"
                        + descriptor.getPath() + "' which is not targeted for removal.";
                LoggingAdapter.getDefaultLogger().warn(RemovalPlanner.class, warning);
                warnings.add(warning);
            }
        }

        LoggingAdapter.getDefaultLogger().debug(RemovalPlanner.class, "Planned removal of {} pkginfo files and {} installer items; {} names leave the manifests",
                descriptorRemovals.size(), installerRemovals.size(), names.size());
        return new RemovalPlan(descriptorRemovals, installerRemovals, names, warnings);
    }
}
