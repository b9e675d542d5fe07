package org.stianloader.picoprune.removal;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * What {@link RemovalExecutor#execute(RemovalPlan, RemovalMode)} did. Failures of individual files or manifests
 * do not abort a removal, they are collected here instead.
 */
public final class RemovalResult {

    @NotNull
    private final List<@NotNull String> advisories = new ArrayList<>();
    @NotNull
    private final Map<@NotNull Path, @NotNull String> failures = new LinkedHashMap<>();
    @NotNull
    private final Map<@NotNull String, @NotNull List<@NotNull String>> manifestChanges = new LinkedHashMap<>();
    @NotNull
    private final List<@NotNull Path> processed = new ArrayList<>();
    @NotNull
    private final Set<@NotNull String> strippedNames = new TreeSet<>();

    void addAdvisory(@NotNull String advisory) {
        this.advisories.add(advisory);
    }

    void addFailure(@NotNull Path path, @NotNull String message) {
        this.failures.put(path, message);
    }

    void addManifestChange(@NotNull String manifest, @NotNull String change) {
        this.manifestChanges.computeIfAbsent(manifest, (key) -> new ArrayList<>()).add(change);
    }

    void addProcessed(@NotNull Path path) {
        this.processed.add(path);
    }

    void addStrippedNames(@NotNull Set<@NotNull String> names) {
        this.strippedNames.addAll(names);
    }

    /**
     * Obtains the warnings about manifest entries that look similar to a removed name, but were left untouched.
     *
     * @return The advisories
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getAdvisories() {
        return Collections.unmodifiableList(this.advisories);
    }

    /**
     * Obtains the files and manifests that could not be removed, moved or rewritten, mapped to the reason.
     *
     * @return The failures
     */
    @NotNull
    @Contract(pure = true)
    public Map<@NotNull Path, @NotNull String> getFailures() {
        return Collections.unmodifiableMap(this.failures);
    }

    /**
     * Obtains the rewritten manifests, mapped to descriptions of what was removed from them.
     *
     * @return The manifest changes, keyed by manifest name
     */
    @NotNull
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull List<@NotNull String>> getManifestChanges() {
        return Collections.unmodifiableMap(this.manifestChanges);
    }

    /**
     * Obtains the files which were successfully deleted or archived.
     *
     * @return The processed files
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Path> getProcessed() {
        return Collections.unmodifiableList(this.processed);
    }

    /**
     * Obtains the names that were searched for in the manifests. This may be fewer names than
     * {@link RemovalPlan#getNames()} if descriptors with these names appeared in the meantime.
     *
     * @return The names removed from manifests
     */
    @NotNull
    @Contract(pure = true)
    public Set<@NotNull String> getStrippedNames() {
        return Collections.unmodifiableSet(this.strippedNames);
    }

    @Contract(pure = true)
    public boolean hasFailures() {
        return !this.failures.isEmpty();
    }
}
