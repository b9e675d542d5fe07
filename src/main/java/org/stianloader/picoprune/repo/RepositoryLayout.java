package org.stianloader.picoprune.repo;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The directory structure of a repository. Every component that touches the repository receives
 * the layout explicitly; picoprune never looks up the repository location on its own.
 *
 * <p>A repository root contains the {@code pkgsinfo} directory with descriptor files, the {@code pkgs}
 * directory with installer items, the {@code manifests} directory and the {@code catalogs} directory.
 * The catalogs are generated by other tools and are neither read nor regenerated by picoprune.
 */
public class RepositoryLayout {

    @NotNull
    public static final String CATALOGS = "catalogs";

    @NotNull
    public static final String MANIFESTS = "manifests";

    @NotNull
    public static final String PKGS = "pkgs";

    @NotNull
    public static final String PKGSINFO = "pkgsinfo";

    /**
     * Whether a file name denotes a file that is not part of the repository content,
     * such as ".DS_Store" or editor swap files.
     *
     * @param fileName The name of the file, without any directories.
     * @return True if the file must be ignored by every directory walk
     */
    @Contract(pure = true)
    public static boolean isIgnored(@NotNull String fileName) {
        return fileName.startsWith(".");
    }

    @NotNull
    private final CatalogPolicy catalogPolicy;

    @NotNull
    private final Path root;

    public RepositoryLayout(@NotNull Path root) {
        this(root, CatalogPolicy.DEFAULT);
    }

    public RepositoryLayout(@NotNull Path root, @NotNull CatalogPolicy catalogPolicy) {
        Objects.requireNonNull(root, "The repository directory defined by \"root\" may not be null!");
        this.catalogPolicy = Objects.requireNonNull(catalogPolicy, "\"catalogPolicy\" may not be null");
        if (!Files.isDirectory(root)) {
            throw new IllegalStateException("The repository at \"" + root.toAbsolutePath() + "\" is not available. Please mount your repository and try again.");
        }
        this.root = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(this.getDescriptorDirectory())) {
            throw new IllegalStateException("The repository at \"" + this.root + "\" has no " + PKGSINFO + " directory. Please mount your repository and try again.");
        }
    }

    /**
     * Computes the location a repository file is moved to when archiving it. The repository root
     * prefix of the item is replaced by the archive root, so the relative directory structure is kept.
     *
     * @param item A file within the repository
     * @param archiveRoot The root directory of the archive
     * @return The mirrored location of the item below the archive root
     */
    @NotNull
    public Path archivePath(@NotNull Path item, @NotNull Path archiveRoot) {
        Path normalized = item.toAbsolutePath().normalize();
        if (!normalized.startsWith(this.root)) {
            throw new IllegalArgumentException("\"" + item + "\" is not located within the repository " + this.root);
        }
        return archiveRoot.toAbsolutePath().normalize().resolve(this.root.relativize(normalized));
    }

    @NotNull
    @Contract(pure = true)
    public CatalogPolicy getCatalogPolicy() {
        return this.catalogPolicy;
    }

    @NotNull
    public Path getDescriptorDirectory() {
        return this.root.resolve(PKGSINFO);
    }

    @NotNull
    public Path getInstallerDirectory() {
        return this.root.resolve(PKGS);
    }

    @NotNull
    public Path getManifestDirectory() {
        return this.root.resolve(MANIFESTS);
    }

    @NotNull
    @Contract(pure = true)
    public Path getRoot() {
        return this.root;
    }

    /**
     * Joins an {@code installer_item_location} value against the installer directory.
     *
     * @param installerItemLocation The location relative to the {@code pkgs} directory
     * @return The absolute path of the installer item
     */
    @NotNull
    public Path installerPath(@NotNull String installerItemLocation) {
        return this.getInstallerDirectory().resolve(installerItemLocation).normalize();
    }

    @Override
    public String toString() {
        return "RepositoryLayout[root=" + this.root + "]";
    }
}
