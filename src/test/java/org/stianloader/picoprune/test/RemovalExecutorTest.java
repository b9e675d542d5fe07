package org.stianloader.picoprune.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.plist.PropertyLists;
import org.stianloader.picoprune.removal.ArchiveDestinationException;
import org.stianloader.picoprune.removal.RemovalExecutor;
import org.stianloader.picoprune.removal.RemovalMode;
import org.stianloader.picoprune.removal.RemovalPlan;
import org.stianloader.picoprune.removal.RemovalPlanner;
import org.stianloader.picoprune.removal.RemovalResult;
import org.stianloader.picoprune.removal.RemovalSelection;
import org.stianloader.picoprune.repo.DescriptorStore;

public class RemovalExecutorTest {

    private static RemovalPlan plan(TestRepository repo, String... names) {
        return new RemovalPlanner(repo.layout()).plan(RemovalSelection.NONE.withNames(Arrays.asList(names)), new DescriptorStore(repo.layout()).load());
    }

    @Test
    public void testDeleteAndRewrite(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        Path foo = repo.descriptor("Foo-1.0.plist", "Foo", "1.0", "Foo-1.0.dmg", "production");
        Path fooBar = repo.descriptor("FooBar-1.0.plist", "FooBar", "1.0", "FooBar-1.0.dmg", "production");
        Path manifest = repo.manifest("site_default", TestRepository.dict(
                "catalogs", TestRepository.array("production"),
                "managed_installs", TestRepository.array("Foo", "FooBar", "Other"),
                "optional_installs", TestRepository.array("Foo")));

        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan(repo, "Foo"), RemovalMode.DELETE);
        assertFalse(result.hasFailures());
        assertEquals(Arrays.asList(foo, dir.resolve("pkgs/Foo-1.0.dmg")), result.getProcessed());
        assertFalse(Files.exists(foo));
        assertFalse(Files.exists(dir.resolve("pkgs/Foo-1.0.dmg")));
        assertTrue(Files.exists(fooBar));
        assertTrue(Files.exists(dir.resolve("pkgs/FooBar-1.0.dmg")));

        Map<String, Object> rewritten = PropertyLists.readDictionary(manifest);
        assertEquals(Arrays.asList("FooBar", "Other"), rewritten.get("managed_installs"));
        assertEquals(Collections.emptyList(), rewritten.get("optional_installs"));
        assertEquals(Arrays.asList("production"), rewritten.get("catalogs"));
        assertEquals(Collections.singleton("Foo"), result.getStrippedNames());
        assertEquals(Arrays.asList("Removing Foo from managed_installs", "Removing Foo from optional_installs"), result.getManifestChanges().get("site_default"));

        // FooBar shares the prefix, it is reported but never touched
        assertEquals(1, result.getAdvisories().size());
        assertTrue(result.getAdvisories().get(0).contains("FooBar"), result.getAdvisories().get(0));
    }

    @Test
    public void testUnchangedManifestIsNotWritten(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        repo.descriptor("Foo-1.0.plist", "Foo", "1.0", "Foo-1.0.dmg", "production");
        Path manifest = dir.resolve("manifests/untouched");
        byte[] content = ("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<plist version=\"1.0\"><dict>"
                + "<key>managed_installs</key><array><string>Bar</string></array>"
                + "</dict></plist>\n").getBytes(StandardCharsets.UTF_8);
        Files.write(manifest, content);

        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan(repo, "Foo"), RemovalMode.DELETE);
        assertFalse(result.hasFailures());
        assertTrue(result.getManifestChanges().isEmpty());
        assertArrayEquals(content, Files.readAllBytes(manifest));
    }

    @Test
    public void testConditionalItems(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        repo.descriptor("Foo-1.0.plist", "Foo", "1.0", null, "production");
        Path manifest = repo.manifest("groups/lab", TestRepository.dict(
                "conditional_items", TestRepository.array(TestRepository.dict(
                        "condition", "machine_type == \"laptop\"",
                        "managed_installs", TestRepository.array("Foo", "Bar")))));

        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan(repo, "Foo"), RemovalMode.DELETE);
        assertEquals(Arrays.asList("Removing Foo from conditional managed_installs"), result.getManifestChanges().get("groups/lab"));

        List<?> conditionals = (List<?>) PropertyLists.readDictionary(manifest).get("conditional_items");
        Map<?, ?> conditional = (Map<?, ?>) conditionals.get(0);
        assertEquals(Arrays.asList("Bar"), conditional.get("managed_installs"));
        assertEquals("machine_type == \"laptop\"", conditional.get("condition"));
    }

    @Test
    public void testDeleteIsBestEffort(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        Path foo = repo.descriptor("Foo-1.0.plist", "Foo", "1.0", null, "production");
        Path missing = dir.resolve("pkgsinfo/Missing-1.0.plist");
        Path bundle = repo.installer("Suite.pkg/Contents/Archive.pax");

        RemovalPlan plan = new RemovalPlan(Arrays.asList(foo, missing), Arrays.asList(dir.resolve("pkgs/Suite.pkg")), Collections.emptySet(), Collections.emptyList());
        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan, RemovalMode.DELETE);

        assertTrue(result.hasFailures());
        assertEquals(Collections.singleton(missing), result.getFailures().keySet());
        assertEquals(Arrays.asList(foo, dir.resolve("pkgs/Suite.pkg")), result.getProcessed());
        assertFalse(Files.exists(foo));
        assertFalse(Files.exists(bundle));
        assertFalse(Files.exists(dir.resolve("pkgs/Suite.pkg")));
    }

    @Test
    public void testArchive(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir.resolve("repo"));
        Path foo = repo.descriptor("apps/Foo-1.0.plist", "Foo", "1.0", "apps/Foo-1.0.dmg", "production");
        repo.manifest("site_default", TestRepository.dict("managed_installs", TestRepository.array("Foo")));
        Path archive = dir.resolve("archive");

        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan(repo, "Foo"), RemovalMode.archive(archive));
        assertFalse(result.hasFailures());
        assertEquals(2, result.getProcessed().size());
        assertFalse(Files.exists(foo));
        assertFalse(Files.exists(repo.root().resolve("pkgs/apps/Foo-1.0.dmg")));
        assertTrue(Files.isRegularFile(archive.resolve("pkgsinfo/apps/Foo-1.0.plist")));
        assertTrue(Files.isRegularFile(archive.resolve("pkgs/apps/Foo-1.0.dmg")));
        assertEquals("Foo", PropertyLists.readDictionary(archive.resolve("pkgsinfo/apps/Foo-1.0.plist")).get("name"));
        assertEquals(Collections.emptyList(), PropertyLists.readDictionary(repo.root().resolve("manifests/site_default")).get("managed_installs"));
    }

    @Test
    public void testArchiveCreatesLayoutForEmptyPlans(@TempDir Path dir) throws IOException {
        TestRepository repo = new TestRepository(dir.resolve("repo"));
        Path archive = dir.resolve("archive");
        RemovalPlan plan = new RemovalPlan(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
        new RemovalExecutor(repo.layout()).execute(plan, RemovalMode.archive(archive));
        assertTrue(Files.isDirectory(archive.resolve("pkgs")));
        assertTrue(Files.isDirectory(archive.resolve("pkgsinfo")));
    }

    @Test
    public void testArchiveDestinationFailure(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir.resolve("repo"));
        Path foo = repo.descriptor("Foo-1.0.plist", "Foo", "1.0", "Foo-1.0.dmg", "production");
        Path manifest = repo.manifest("site_default", TestRepository.dict("managed_installs", TestRepository.array("Foo")));
        byte[] manifestContent = Files.readAllBytes(manifest);
        // A regular file where the archive directory should be
        Path archive = dir.resolve("archive");
        Files.write(archive, new byte[0]);

        ArchiveDestinationException e = assertThrows(ArchiveDestinationException.class,
                () -> new RemovalExecutor(repo.layout()).execute(plan(repo, "Foo"), RemovalMode.archive(archive)));
        assertTrue(e.getDirectory().startsWith(archive), e.getDirectory().toString());
        assertTrue(Files.exists(foo));
        assertArrayEquals(manifestContent, Files.readAllBytes(manifest));
    }

    @Test
    public void testArchiveKeepsExistingTargets(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir.resolve("repo"));
        Path foo = repo.descriptor("Foo-1.0.plist", "Foo", "1.0", null, "production");
        Path archive = dir.resolve("archive");
        Files.createDirectories(archive.resolve("pkgsinfo"));
        Files.write(archive.resolve("pkgsinfo/Foo-1.0.plist"), new byte[] {1});

        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan(repo, "Foo"), RemovalMode.archive(archive));
        assertEquals(Collections.singleton(foo), result.getFailures().keySet());
        assertTrue(Files.exists(foo));
        assertArrayEquals(new byte[] {1}, Files.readAllBytes(archive.resolve("pkgsinfo/Foo-1.0.plist")));
    }

    @Test
    public void testNamesAreRecomputed(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        repo.descriptor("Foo-1.0.plist", "Foo", "1.0", null, "production");
        Path manifest = repo.manifest("site_default", TestRepository.dict("managed_installs", TestRepository.array("Foo")));
        RemovalPlan plan = plan(repo, "Foo");
        assertEquals(Collections.singleton("Foo"), plan.getNames());

        // Another version is added between planning and execution
        repo.descriptor("Foo-2.0.plist", "Foo", "2.0", null, "production");
        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan, RemovalMode.DELETE);
        assertTrue(result.getStrippedNames().isEmpty());
        assertEquals(Arrays.asList("Foo"), PropertyLists.readDictionary(manifest).get("managed_installs"));
    }

    @Test
    public void testLooselyTypedVersionKeepsName(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        Path foo1 = repo.descriptor("Foo-1.0.plist", "Foo", "1.0", null, "production");
        Path foo2 = repo.descriptor("Foo-2.0.plist", TestRepository.dict("name", "Foo", "version", "2.0", "installer_item_size", "1024", "catalogs", TestRepository.array("production")));
        Path manifest = repo.manifest("site_default", TestRepository.dict("managed_installs", TestRepository.array("Foo")));

        RemovalPlan plan = new RemovalPlanner(repo.layout()).plan(RemovalSelection.NONE.withListedPaths(Arrays.asList("pkgsinfo/Foo-1.0.plist")),
                new DescriptorStore(repo.layout()).load());
        assertEquals(Collections.singleton(foo1), plan.getDescriptors());
        assertTrue(plan.getNames().isEmpty());

        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan, RemovalMode.DELETE);
        assertFalse(result.hasFailures());
        assertFalse(Files.exists(foo1));
        assertTrue(Files.exists(foo2));
        assertEquals(Arrays.asList("Foo"), PropertyLists.readDictionary(manifest).get("managed_installs"));
    }

    @Test
    public void testArchiveBundle(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir.resolve("repo"));
        repo.installer("Suite.pkg/Contents/Archive.pax");
        repo.installer("Suite.pkg/Contents/Info.plist");
        Path foo = repo.descriptor("Suite-1.0.plist", "Suite", "1.0", "Suite.pkg", "production");
        Path archive = dir.resolve("archive");

        RemovalPlan plan = plan(repo, "Suite");
        assertEquals(Collections.singleton(repo.root().resolve("pkgs/Suite.pkg")), plan.getInstallers());
        RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan, RemovalMode.archive(archive));
        assertFalse(result.hasFailures(), result.getFailures().toString());
        assertFalse(Files.exists(foo));
        assertFalse(Files.exists(repo.root().resolve("pkgs/Suite.pkg")));
        assertArrayEquals("Suite.pkg/Contents/Archive.pax".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(archive.resolve("pkgs/Suite.pkg/Contents/Archive.pax")));
        assertTrue(Files.isRegularFile(archive.resolve("pkgs/Suite.pkg/Contents/Info.plist")));
    }

    @Test
    public void testArchiveBundleToOtherFileStore(@TempDir Path dir) throws IOException, PropertyListException {
        Path shm = Paths.get("/dev/shm");
        Assumptions.assumeTrue(Files.isDirectory(shm) && Files.isWritable(shm));
        Assumptions.assumeFalse(Files.getFileStore(shm).equals(Files.getFileStore(dir)));

        TestRepository repo = new TestRepository(dir.resolve("repo"));
        repo.installer("Suite.pkg/Contents/Archive.pax");
        repo.descriptor("Suite-1.0.plist", "Suite", "1.0", "Suite.pkg", "production");
        Path archive = Files.createTempDirectory(shm, "picoprune-archive");
        try {
            RemovalResult result = new RemovalExecutor(repo.layout()).execute(plan(repo, "Suite"), RemovalMode.archive(archive));
            assertFalse(result.hasFailures(), result.getFailures().toString());
            assertFalse(Files.exists(repo.root().resolve("pkgs/Suite.pkg")));
            assertTrue(Files.isRegularFile(archive.resolve("pkgs/Suite.pkg/Contents/Archive.pax")));
        } finally {
            try (Stream<Path> files = Files.walk(archive)) {
                files.sorted(Comparator.reverseOrder()).forEach((file) -> file.toFile().delete());
            }
        }
    }
}
