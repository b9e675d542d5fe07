package org.stianloader.picoprune.removal;

import java.io.IOException;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a directory of the archive cannot be created. Archiving stops immediately when this happens.
 */
public class ArchiveDestinationException extends IOException {

    private static final long serialVersionUID = -3794551530245311718L;

    @NotNull
    private final Path directory;

    public ArchiveDestinationException(@NotNull Path directory, @NotNull IOException cause) {
        super("Failed to create archive directory " + directory + "!", cause);
        this.directory = directory;
    }

    @NotNull
    public Path getDirectory() {
        return this.directory;
    }
}
