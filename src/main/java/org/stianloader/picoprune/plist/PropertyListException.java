package org.stianloader.picoprune.plist;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a property list cannot be read or written.
 */
public class PropertyListException extends Exception {

    private static final long serialVersionUID = 5206129815262826415L;

    @Nullable
    private final Path path;

    public PropertyListException(@Nullable Path path, @NotNull String message) {
        super(path == null ? message : path + ": " + message);
        this.path = path;
    }

    public PropertyListException(@Nullable Path path, @NotNull String message, @NotNull Throwable cause) {
        super(path == null ? message : path + ": " + message, cause);
        this.path = path;
    }

    /**
     * Obtains the file that could not be processed, null if the property list did not come from a file.
     *
     * @return The offending path
     */
    @Nullable
    public Path getPath() {
        return this.path;
    }
}
