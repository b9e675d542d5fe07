package org.stianloader.picoprune.repo;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Descriptor;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.plist.PropertyLists;

/**
 * Loads the descriptors of a repository into a {@link DescriptorCache}. A file that cannot be parsed
 * is recorded as an error of the cache instead of aborting the load.
 */
public class DescriptorStore {

    @NotNull
    private final RepositoryLayout layout;

    public DescriptorStore(@NotNull RepositoryLayout layout) {
        this.layout = layout;
    }

    /**
     * Collects the non-hidden regular files below a directory. Hidden directories are not descended into.
     * Files and directories that cannot be read are logged and recorded instead of ending the walk.
     */
    static final class FileCollector extends SimpleFileVisitor<Path> {
        @NotNull
        private final Map<@NotNull Path, @NotNull String> failures = new TreeMap<>();
        @NotNull
        private final List<@NotNull Path> files = new ArrayList<>();
        @NotNull
        private final Path root;

        FileCollector(@NotNull Path root) {
            this.root = root;
        }

        @NotNull
        Map<@NotNull Path, @NotNull String> getFailures() {
            return this.failures;
        }

        @NotNull
        List<@NotNull Path> getFiles() {
            List<Path> sorted = new ArrayList<>(this.files);
            sorted.sort(null);
            return sorted;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                this.visitFileFailed(dir, exc);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(this.root) && RepositoryLayout.isIgnored(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && !RepositoryLayout.isIgnored(file.getFileName().toString())) {
                this.files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            Path fileName = file.getFileName();
            if (fileName != null && RepositoryLayout.isIgnored(fileName.toString())) {
                return FileVisitResult.CONTINUE;
            }
            LoggingAdapter.getDefaultLogger().warn(DescriptorStore.class, "Unable to read {}: {}", file, exc.toString());
            this.failures.put(file, "Unable to read: " + exc);
            return FileVisitResult.CONTINUE;
        }
    }

    /**
     * Walks a directory with a {@link FileCollector}.
     *
     * @param directory The directory to walk. A missing directory yields no files.
     * @return The collector after the walk
     */
    @NotNull
    static FileCollector collectFiles(@NotNull Path directory) {
        FileCollector collector = new FileCollector(directory);
        if (!Files.isDirectory(directory)) {
            return collector;
        }
        try {
            Files.walkFileTree(directory, collector);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list the contents of " + directory, e);
        }
        return collector;
    }

    @NotNull
    public DescriptorCache load() {
        Map<Path, Descriptor> descriptors = new TreeMap<>();
        FileCollector collector = DescriptorStore.collectFiles(this.layout.getDescriptorDirectory());
        Map<Path, String> errors = new TreeMap<>(collector.getFailures());
        for (Path file : collector.getFiles()) {
            try {
                descriptors.put(file, Descriptor.fromDictionary(file, PropertyLists.readDictionary(file)));
            } catch (PropertyListException e) {
                LoggingAdapter.getDefaultLogger().warn(DescriptorStore.class, "Unable to parse pkginfo {}", file, e);
                errors.put(file, e.getMessage());
            }
        }
        LoggingAdapter.getDefaultLogger().debug(DescriptorStore.class, "Loaded {} pkginfo files ({} unreadable) from {}", descriptors.size(), errors.size(), this.layout.getDescriptorDirectory());
        return new DescriptorCache(descriptors, errors);
    }
}
