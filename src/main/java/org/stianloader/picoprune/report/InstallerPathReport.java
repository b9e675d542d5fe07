package org.stianloader.picoprune.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoprune.Descriptor;

/**
 * Collects descriptors whose {@code installer_item_location} only resolves on case-insensitive filesystems.
 *
 * <p>The location is followed one path component at a time, comparing every component against
 * the actual directory listing. The first component that does not match exactly is reported.
 */
final class InstallerPathReport implements Report {

    @NotNull
    private static final ReportDescription DESCRIPTION = new ReportDescription("Case-Sensitive Path Issues Report",
            "This report collects all items whose installer item is referenced incorrectly due to case-sensitivity errors. "
            + "Current macOS default filesystem settings are case-insensitive, yet many admins host their repository with Linux, "
            + "which is by default case-sensitive. This can lead to `installer_item_location` values which work on macOS, "
            + "but do not resolve correctly on case sensitive filesystems.",
            ReportDescription.keys(ReportDescription.SortKey.ascending("name")),
            ReportDescription.order("name", "path"));

    @NotNull
    private static Set<@NotNull String> list(@NotNull Path directory, @NotNull Map<Path, Set<String>> listings) {
        return listings.computeIfAbsent(directory, (dir) -> {
            if (!Files.isDirectory(dir)) {
                return Collections.emptySet();
            }
            Set<String> names = new TreeSet<>();
            try (Stream<Path> children = Files.list(dir)) {
                children.forEach((child) -> names.add(child.getFileName().toString()));
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to list " + dir, e);
            }
            return names;
        });
    }

    @Nullable
    static String getBadPathComponent(@NotNull String installer, @NotNull Path installerDirectory, @NotNull Map<Path, Set<String>> listings) {
        Path directory = installerDirectory;
        for (String component : installer.split("/")) {
            if (component.isEmpty()) {
                continue;
            }
            if (!InstallerPathReport.list(directory, listings).contains(component)) {
                return component;
            }
            directory = directory.resolve(component);
        }
        return null;
    }

    @Override
    @NotNull
    public ReportDescription describe() {
        return DESCRIPTION;
    }

    @Override
    @NotNull
    public ReportFindings collect(@NotNull RepositorySnapshot snapshot) {
        ReportFindings findings = new ReportFindings();
        Map<Path, Set<String>> listings = new HashMap<>();
        Path installerDirectory = snapshot.getLayout().getInstallerDirectory();
        for (Descriptor descriptor : snapshot.getCache().getDescriptors().values()) {
            String installer = descriptor.getInstallerItemLocation();
            if (installer == null) {
                continue;
            }
            String badComponent = InstallerPathReport.getBadPathComponent(installer, installerDirectory, listings);
            if (badComponent != null) {
                findings.addItem("name", descriptor.getName(), "path", descriptor.getPath().toString(), "bad_path_component", badComponent);
            }
        }
        return findings;
    }
}
