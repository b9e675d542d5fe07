package org.stianloader.picoprune.removal;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class RemovalExecutorMoveTest {

    private static Path bundle(Path dir) throws IOException {
        Path bundle = dir.resolve("Suite.pkg");
        Files.createDirectories(bundle.resolve("Contents/Resources"));
        Files.write(bundle.resolve("Contents/Archive.pax"), "pax".getBytes(StandardCharsets.UTF_8));
        Files.write(bundle.resolve("Contents/Resources/en.lproj"), "en".getBytes(StandardCharsets.UTF_8));
        return bundle;
    }

    @Test
    public void testTransferTree(@TempDir Path dir) throws IOException {
        Path bundle = bundle(dir);
        Path target = dir.resolve("archive/Suite.pkg");
        Files.createDirectories(target.getParent());

        RemovalExecutor.transferTree(bundle, target);
        assertFalse(Files.exists(bundle));
        assertArrayEquals("pax".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(target.resolve("Contents/Archive.pax")));
        assertArrayEquals("en".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(target.resolve("Contents/Resources/en.lproj")));
    }

    @Test
    public void testTransferTreeKeepsExistingTarget(@TempDir Path dir) throws IOException {
        Path bundle = bundle(dir);
        Path target = dir.resolve("archive/Suite.pkg");
        Files.createDirectories(target);

        assertThrows(FileAlreadyExistsException.class, () -> RemovalExecutor.transferTree(bundle, target));
        assertTrue(Files.isRegularFile(bundle.resolve("Contents/Archive.pax")));
        assertFalse(Files.exists(target.resolve("Contents")));
    }

    @Test
    public void testMoveFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("Foo-1.0.dmg");
        Files.write(file, new byte[] {1, 2});
        Path target = dir.resolve("Foo-1.0-archived.dmg");

        RemovalExecutor.move(file, target);
        assertFalse(Files.exists(file));
        assertArrayEquals(new byte[] {1, 2}, Files.readAllBytes(target));
        Files.write(file, new byte[] {3});
        assertThrows(FileAlreadyExistsException.class, () -> RemovalExecutor.move(file, target));
    }
}
