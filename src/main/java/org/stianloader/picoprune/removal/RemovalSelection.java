package org.stianloader.picoprune.removal;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.plist.PropertyLists;

/**
 * Describes which descriptors the user wants to remove. A selection may combine categories, product names
 * and the entries of a removal list; a descriptor is selected if any of them matches.
 *
 * <p>Instances are immutable, the {@code with*} methods return modified copies.
 */
public final class RemovalSelection {

    /**
     * Category value that selects descriptors without a {@code category}.
     */
    @NotNull
    public static final String NO_CATEGORY = "*NO CATEGORY*";

    @NotNull
    public static final RemovalSelection NONE = new RemovalSelection(Collections.emptySet(), Collections.emptySet(), Collections.emptyList());

    /**
     * Reads a removal list. A removal list is a property list with a {@code removals} array whose entries
     * are dictionaries with a {@code path} string: {@code {"removals": [{"path": ...}, ...]}}.
     *
     * @param file The removal list file
     * @return The listed paths, in file order
     * @throws PropertyListException If the file cannot be read or is not structured like a removal list
     */
    @NotNull
    public static List<@NotNull String> readRemovalList(@NotNull Path file) throws PropertyListException {
        Object removals = PropertyLists.readDictionary(file).get("removals");
        if (removals == null) {
            return Collections.emptyList();
        }
        if (!(removals instanceof List)) {
            throw new PropertyListException(file, "\"removals\" must be an array");
        }
        List<String> paths = new ArrayList<>();
        for (Object entry : (List<?>) removals) {
            Object path = entry instanceof Map ? ((Map<?, ?>) entry).get("path") : null;
            if (!(path instanceof String)) {
                throw new PropertyListException(file, "Every removal must be a dictionary with a \"path\" string");
            }
            paths.add((String) path);
        }
        return paths;
    }

    @NotNull
    private final Set<@NotNull String> categories;

    @NotNull
    private final List<@NotNull String> listedPaths;

    @NotNull
    private final Set<@NotNull String> names;

    private RemovalSelection(@NotNull Set<@NotNull String> categories, @NotNull Set<@NotNull String> names, @NotNull List<@NotNull String> listedPaths) {
        this.categories = Collections.unmodifiableSet(categories);
        this.names = Collections.unmodifiableSet(names);
        this.listedPaths = Collections.unmodifiableList(listedPaths);
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull String> getCategories() {
        return this.categories;
    }

    /**
     * Obtains the descriptor paths of the removal list, as written in the list. Relative paths are relative
     * to the repository root.
     *
     * @return The listed paths
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getListedPaths() {
        return this.listedPaths;
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull String> getNames() {
        return this.names;
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.categories.isEmpty() && this.names.isEmpty() && this.listedPaths.isEmpty();
    }

    @NotNull
    @Contract(pure = true)
    public RemovalSelection withCategories(@NotNull Collection<@NotNull String> categories) {
        Set<String> merged = new LinkedHashSet<>(this.categories);
        merged.addAll(categories);
        return new RemovalSelection(merged, this.names, this.listedPaths);
    }

    @NotNull
    @Contract(pure = true)
    public RemovalSelection withListedPaths(@NotNull Collection<@NotNull String> paths) {
        List<String> merged = new ArrayList<>(this.listedPaths);
        merged.addAll(paths);
        return new RemovalSelection(this.categories, this.names, merged);
    }

    @NotNull
    @Contract(pure = true)
    public RemovalSelection withNames(@NotNull Collection<@NotNull String> names) {
        Set<String> merged = new LinkedHashSet<>(this.names);
        merged.addAll(names);
        return new RemovalSelection(this.categories, merged, this.listedPaths);
    }

    @Override
    public String toString() {
        return "RemovalSelection[categories=" + this.categories + " names=" + this.names + " listedPaths=" + this.listedPaths + "]";
    }
}
