package org.stianloader.picoprune.removal;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The outcome of {@link RemovalPlanner#plan(RemovalSelection, org.stianloader.picoprune.repo.DescriptorCache) planning}
 * a removal: which descriptor files and installer items to remove and which product names disappear from the
 * repository entirely. All sets iterate in lexical order.
 */
public final class RemovalPlan {

    @NotNull
    private final Set<@NotNull Path> descriptors;
    @NotNull
    private final Set<@NotNull Path> installers;
    @NotNull
    private final Set<@NotNull String> names;
    @NotNull
    private final List<@NotNull String> warnings;

    public RemovalPlan(@NotNull Collection<@NotNull Path> descriptors, @NotNull Collection<@NotNull Path> installers,
            @NotNull Collection<@NotNull String> names, @NotNull List<@NotNull String> warnings) {
        this.descriptors = Collections.unmodifiableSet(new TreeSet<>(descriptors));
        this.installers = Collections.unmodifiableSet(new TreeSet<>(installers));
        this.names = Collections.unmodifiableSet(new TreeSet<>(names));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    /**
     * Obtains every file of the plan, descriptors first, then installer items.
     *
     * @return The files to remove or archive
     */
    @NotNull
    public List<@NotNull Path> getAllFiles() {
        List<Path> files = new ArrayList<>(this.descriptors);
        files.addAll(this.installers);
        return files;
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull Path> getDescriptors() {
        return this.descriptors;
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull Path> getInstallers() {
        return this.installers;
    }

    /**
     * Obtains the names that no descriptor will carry once the plan is executed.
     * These names are removed from the manifests.
     *
     * @return The names to strip from manifests
     */
    @NotNull
    @Contract(pure = true)
    public Set<@NotNull String> getNames() {
        return this.names;
    }

    /**
     * Obtains the warnings about installer items which are slated for removal while still being
     * referenced by descriptors that are kept.
     *
     * @return The warnings
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getWarnings() {
        return this.warnings;
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.descriptors.isEmpty() && this.installers.isEmpty();
    }

    @Override
    public String toString() {
        return "RemovalPlan[descriptors=" + this.descriptors.size() + " installers=" + this.installers.size() + " names=" + this.names + "]";
    }
}
