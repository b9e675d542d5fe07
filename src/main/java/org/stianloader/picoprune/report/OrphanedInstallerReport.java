package org.stianloader.picoprune.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Descriptor;
import org.stianloader.picoprune.repo.RepositoryLayout;

/**
 * Collects installer items that no descriptor refers to.
 *
 * <p>Bundle-style installers are directories ending with ".pkg" or ".mpkg" (in any case). A bundle is
 * treated as a single installer item: it is reported as a whole if no descriptor refers to it and its
 * contents are never reported on their own.
 */
final class OrphanedInstallerReport implements Report {

    @NotNull
    private static final ReportDescription DESCRIPTION = new ReportDescription("Orphaned Installer Report",
            "This report collects all pkgs present in the repo which are not referenced by any pkginfo files.",
            ReportDescription.keys(ReportDescription.SortKey.ascending("path")),
            ReportDescription.order("path"));

    @Contract(pure = true)
    static boolean isBundle(@NotNull Path directory) {
        Path fileName = directory.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".pkg") || name.endsWith(".mpkg");
    }

    @NotNull
    private static String relativeName(@NotNull Path base, @NotNull Path file) {
        return base.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    @Override
    @NotNull
    public ReportDescription describe() {
        return DESCRIPTION;
    }

    @Override
    @NotNull
    public ReportFindings collect(@NotNull RepositorySnapshot snapshot) {
        Path installerDirectory = snapshot.getLayout().getInstallerDirectory();
        Set<String> referenced = new HashSet<>();
        for (Descriptor descriptor : snapshot.getCache().getDescriptors().values()) {
            String installer = descriptor.getInstallerItemLocation();
            if (installer != null) {
                referenced.add(OrphanedInstallerReport.relativeName(installerDirectory, snapshot.getLayout().installerPath(installer)));
            }
        }

        ReportFindings findings = new ReportFindings();
        if (!Files.isDirectory(installerDirectory)) {
            return findings;
        }
        try {
            Files.walkFileTree(installerDirectory, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(installerDirectory)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (RepositoryLayout.isIgnored(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (OrphanedInstallerReport.isBundle(dir)) {
                        if (!referenced.contains(OrphanedInstallerReport.relativeName(installerDirectory, dir))) {
                            findings.addItem("path", dir.toString());
                        }
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!RepositoryLayout.isIgnored(file.getFileName().toString())
                            && !referenced.contains(OrphanedInstallerReport.relativeName(installerDirectory, file))) {
                        findings.addItem("path", file.toString());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to walk " + installerDirectory, e);
        }
        return findings;
    }
}
