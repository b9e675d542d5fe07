package org.stianloader.picoprune.removal;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.stianloader.picoprune.repo.DescriptorStore;
import org.stianloader.picoprune.repo.ManifestStore;
import org.stianloader.picoprune.repo.RepositoryLayout;

/**
 * Carries out a {@link RemovalPlan}: deletes or archives its files and then removes the names of products
 * that no longer exist from the manifests.
 *
 * <p>Deleting and moving is best-effort: a file that cannot be processed is logged and recorded in the
 * {@link RemovalResult} while the remaining files are still processed. The only fatal error is the
 * inability to create a directory of the archive.
 *
 * <p>The repository may be modified by others between planning and execution. For this reason the names
 * to remove from the manifests are recomputed against a freshly loaded descriptor cache instead of trusting
 * the cache the plan was made with.
 */
public class RemovalExecutor {

    @NotNull
    private final RepositoryLayout layout;

    public RemovalExecutor(@NotNull RepositoryLayout layout) {
        this.layout = layout;
    }

    private static void createDirectories(@NotNull Path directory) throws ArchiveDestinationException {
        if (Files.isDirectory(directory)) {
            return;
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ArchiveDestinationException(directory, e);
        }
    }

    private static void deleteRecursively(@NotNull Path path) throws IOException {
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            Files.delete(path);
            return;
        }
        // Bundle-style installer items are directories
        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Moves a file or a directory tree. Directories that cannot be renamed, usually because the target is on
     * another file store, are copied and then deleted. An existing target is never replaced.
     *
     * @param source The file or directory to move
     * @param target The new location
     * @throws IOException If the source cannot be moved
     */
    static void move(@NotNull Path source, @NotNull Path target) throws IOException {
        try {
            Files.move(source, target);
        } catch (DirectoryNotEmptyException | AtomicMoveNotSupportedException e) {
            LoggingAdapter.getDefaultLogger().debug(RemovalExecutor.class, "Unable to rename {} to {}, copying instead", source, target);
            RemovalExecutor.transferTree(source, target);
        }
    }

    /**
     * Copies a directory tree and deletes the source once the copy is complete. A partial copy is removed again
     * if copying fails.
     *
     * @param source The directory to move
     * @param target The new location, which may not exist
     * @throws IOException If the tree cannot be copied or the source cannot be deleted
     */
    static void transferTree(@NotNull Path source, @NotNull Path target) throws IOException {
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        try {
            Files.walkFileTree(source, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    Files.copy(dir, RemovalExecutor.relocate(source, dir, target), StandardCopyOption.COPY_ATTRIBUTES);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.copy(file, RemovalExecutor.relocate(source, file, target), StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                try {
                    RemovalExecutor.deleteRecursively(target);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw e;
        }
        RemovalExecutor.deleteRecursively(source);
    }

    @NotNull
    private static Path relocate(@NotNull Path sourceRoot, @NotNull Path file, @NotNull Path targetRoot) {
        Path target = targetRoot;
        for (Path component : sourceRoot.relativize(file)) {
            String name = component.toString();
            if (!name.isEmpty()) {
                target = target.resolve(name);
            }
        }
        return target;
    }

    private void archive(@NotNull RemovalPlan plan, @NotNull Path archiveRoot, @NotNull RemovalResult result) throws ArchiveDestinationException {
        RemovalExecutor.createDirectories(archiveRoot.resolve(RepositoryLayout.PKGS));
        RemovalExecutor.createDirectories(archiveRoot.resolve(RepositoryLayout.PKGSINFO));

        for (Path item : plan.getAllFiles()) {
            Path target;
            try {
                target = this.layout.archivePath(item, archiveRoot);
            } catch (IllegalArgumentException e) {
                LoggingAdapter.getDefaultLogger().error(RemovalExecutor.class, "Unable to archive {}: {}", item, e.getMessage());
                result.addFailure(item, e.getMessage());
                continue;
            }
            Path parent = target.getParent();
            if (parent != null) {
                RemovalExecutor.createDirectories(parent);
            }
            try {
                RemovalExecutor.move(item, target);
                LoggingAdapter.getDefaultLogger().debug(RemovalExecutor.class, "Archived {} to {}", item, target);
                result.addProcessed(item);
            } catch (IOException e) {
                LoggingAdapter.getDefaultLogger().error(RemovalExecutor.class, "Unable to archive {} to {}: {}", item, target, e.toString());
                result.addFailure(item, e.toString());
            }
        }
    }

    private void delete(@NotNull RemovalPlan plan, @NotNull RemovalResult result) {
        for (Path item : plan.getAllFiles()) {
            try {
                RemovalExecutor.deleteRecursively(item);
                LoggingAdapter.getDefaultLogger().debug(RemovalExecutor.class, "Removed {}", item);
                result.addProcessed(item);
            } catch (IOException e) {
                LoggingAdapter.getDefaultLogger().error(RemovalExecutor.class, "Unable to remove {} with error: {}", item, e.toString());
                result.addFailure(item, e.toString());
            }
        }
    }

    /**
     * Executes the plan.
     *
     * @param plan The plan to execute
     * @param mode Whether to delete or to archive the files
     * @return What was done
     * @throws ArchiveDestinationException If a directory of the archive cannot be created. Files processed
     * before the failure stay archived and the manifests are left untouched.
     */
    @NotNull
    public RemovalResult execute(@NotNull RemovalPlan plan, @NotNull RemovalMode mode) throws ArchiveDestinationException {
        RemovalResult result = new RemovalResult();
        Path archiveRoot = mode.getArchiveRoot();
        if (archiveRoot == null) {
            this.delete(plan, result);
        } else {
            this.archive(plan, archiveRoot, result);
        }
        LoggingAdapter.getDefaultLogger().info(RemovalExecutor.class, "{} {} of {} files", mode.describe(), result.getProcessed().size(), plan.getAllFiles().size());

        if (!plan.getNames().isEmpty()) {
            // Catalogs are not rebuilt by us, so the descriptors have to be read again
            Set<String> names = new TreeSet<>(plan.getNames());
            names.removeAll(new DescriptorStore(this.layout).load().names());
            new ManifestRewriter(new ManifestStore(this.layout)).rewrite(names, result);
        }
        return result;
    }
}
