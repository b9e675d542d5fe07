package org.stianloader.picoprune.repo;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Manifest;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.plist.PropertyLists;

/**
 * Reads and writes the manifests of a repository. Unlike descriptors, manifests that cannot be parsed
 * are not tracked: they are logged and skipped.
 */
public class ManifestStore {

    @NotNull
    private final RepositoryLayout layout;

    public ManifestStore(@NotNull RepositoryLayout layout) {
        this.layout = layout;
    }

    @NotNull
    public List<@NotNull Manifest> load() {
        Path directory = this.layout.getManifestDirectory();
        List<Manifest> manifests = new ArrayList<>();
        for (Path file : DescriptorStore.collectFiles(directory).getFiles()) {
            Map<String, Object> dict;
            try {
                dict = PropertyLists.readDictionary(file);
            } catch (PropertyListException e) {
                LoggingAdapter.getDefaultLogger().error(ManifestStore.class, "Error reading manifest {}: {}", file, e.getMessage());
                continue;
            }
            String name = directory.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
            manifests.add(new Manifest(name, file, dict));
        }
        return manifests;
    }

    public void write(@NotNull Manifest manifest) throws PropertyListException {
        PropertyLists.write(manifest.getDictionary(), manifest.getPath());
    }
}
