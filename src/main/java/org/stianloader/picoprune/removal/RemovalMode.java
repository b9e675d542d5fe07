package org.stianloader.picoprune.removal;

import java.nio.file.Path;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Whether removed files are deleted or moved to an archive.
 */
public final class RemovalMode {

    @NotNull
    public static final RemovalMode DELETE = new RemovalMode(null);

    /**
     * Creates the mode that moves every file below the archive root, keeping its path relative to the repository root.
     *
     * @param archiveRoot The root directory of the archive. It is created if it does not exist.
     * @return The archive mode
     */
    @NotNull
    public static RemovalMode archive(@NotNull Path archiveRoot) {
        return new RemovalMode(Objects.requireNonNull(archiveRoot, "\"archiveRoot\" may not be null"));
    }

    @Nullable
    private final Path archiveRoot;

    private RemovalMode(@Nullable Path archiveRoot) {
        this.archiveRoot = archiveRoot;
    }

    @Nullable
    @Contract(pure = true)
    public Path getArchiveRoot() {
        return this.archiveRoot;
    }

    @Contract(pure = true)
    public boolean isArchive() {
        return this.archiveRoot != null;
    }

    /**
     * Obtains the past participle used when telling the user what happens to the files.
     *
     * @return "archived" or "removed"
     */
    @NotNull
    public String describe() {
        return this.isArchive() ? "archived" : "removed";
    }

    @Override
    public String toString() {
        return this.archiveRoot == null ? "RemovalMode[delete]" : "RemovalMode[archive=" + this.archiveRoot + "]";
    }
}
