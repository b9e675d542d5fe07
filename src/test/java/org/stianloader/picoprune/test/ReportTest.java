package org.stianloader.picoprune.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.plist.PropertyLists;
import org.stianloader.picoprune.report.ReportFindings;
import org.stianloader.picoprune.report.ReportKind;
import org.stianloader.picoprune.report.ReportPrinter;
import org.stianloader.picoprune.report.RepositorySnapshot;

public class ReportTest {

    private static List<Object> column(ReportFindings findings, String key) {
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> item : findings.getItems()) {
            values.add(item.get(key));
        }
        return values;
    }

    @Test
    public void testOrphanedInstallers(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        repo.descriptor("Foo-1.0.plist", "Foo", "1.0", "apps/Foo.dmg", "production");
        repo.installer("orphan.dmg");
        repo.installer("flat/Orphan.pkg");
        repo.installer("Unused.pkg/Contents/Archive.pax");
        repo.installer("Used.PKG/Contents/Archive.pax");
        repo.descriptor("Bar-1.0.plist", "Bar", "1.0", "Used.PKG", "production");
        Files.write(dir.resolve("pkgs/.DS_Store"), new byte[0]);
        repo.installer(".hidden/secret.dmg");

        ReportFindings findings = ReportKind.ORPHANED_INSTALLER.run(RepositorySnapshot.load(repo.layout()));
        assertEquals(Arrays.asList(dir.resolve("pkgs/Unused.pkg").toString(), dir.resolve("pkgs/flat/Orphan.pkg").toString(), dir.resolve("pkgs/orphan.dmg").toString()),
                column(findings, "path"));
    }

    @Test
    public void testInstallerOrphanedAfterDescriptorRemoval(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        Path p1 = repo.descriptor("vendor/P1-1.0.plist", "P1", "1.0", "vendor/tool.pkg", "production");
        repo.descriptor("P2-1.0.plist", "P2", "1.0", "other.dmg", "production");

        assertTrue(ReportKind.ORPHANED_INSTALLER.run(RepositorySnapshot.load(repo.layout())).isEmpty());

        Files.delete(p1);
        ReportFindings findings = ReportKind.ORPHANED_INSTALLER.run(RepositorySnapshot.load(repo.layout()));
        assertEquals(Arrays.asList(repo.root().resolve("pkgs/vendor/tool.pkg").toString()), column(findings, "path"));
    }

    @Test
    public void testInstallerLocations(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        repo.descriptor("Foo-1.0.plist", "Foo", "1.0", "apps/Foo.dmg", "production");
        repo.installer("Tools/Baz.dmg");
        Path baz = repo.descriptor("Baz-1.0.plist", TestRepository.dict("name", "Baz", "version", "1.0", "installer_item_location", "tools/Baz.dmg"));
        Path qux = repo.descriptor("Qux-1.0.plist", TestRepository.dict("name", "Qux", "version", "1.0", "installer_item_location", "Qux.dmg"));
        RepositorySnapshot snapshot = RepositorySnapshot.load(repo.layout());

        ReportFindings pathIssues = ReportKind.PATH_ISSUES.run(snapshot);
        assertEquals(2, pathIssues.getItems().size());
        Map<String, Object> issue = pathIssues.getItems().get(0);
        assertEquals("Baz", issue.get("name"));
        assertEquals(baz.toString(), issue.get("path"));
        assertEquals("tools", issue.get("bad_path_component"));
        assertEquals("Qux.dmg", pathIssues.getItems().get(1).get("bad_path_component"));

        ReportFindings missing = ReportKind.MISSING_INSTALLER.run(snapshot);
        assertEquals(Arrays.asList("Baz", "Qux"), column(missing, "name"));
        assertEquals(qux.toString(), missing.getItems().get(1).get("path"));
        assertEquals(dir.resolve("pkgs/Qux.dmg").toString(), missing.getItems().get(1).get("missing_installer"));
    }

    @Test
    public void testDescriptorErrors(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        repo.descriptor("Foo-1.0.plist", "Foo", "1.0", null, "production");
        Path broken = dir.resolve("pkgsinfo/broken.plist");
        Files.write(broken, "<plist>".getBytes(StandardCharsets.UTF_8));

        ReportFindings findings = ReportKind.DESCRIPTOR_ERRORS.run(RepositorySnapshot.load(repo.layout()));
        assertEquals(Arrays.asList(broken.toString()), column(findings, "path"));
        assertInstanceOf(String.class, findings.getItems().get(0).get("error"));
    }

    private static TestRepository usageRepository(Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        repo.descriptor("Foo-1.0.plist", TestRepository.dict("name", "Foo", "version", "1.0", "installer_item_size", 1048576L, "catalogs", TestRepository.array("production")));
        repo.descriptor("Foo-2.0.plist", TestRepository.dict("name", "Foo", "version", "2.0", "installer_item_size", 524288L, "catalogs", TestRepository.array("production")));
        repo.descriptor("Foo-3.0.plist", TestRepository.dict("name", "Foo", "version", "3.0", "installer_item_size", 1L, "catalogs", TestRepository.array("production")));
        repo.descriptor("Foo-4.0.plist", TestRepository.dict("name", "Foo", "version", "4.0", "requires", TestRepository.array("Lib"), "catalogs", TestRepository.array("testing")));
        repo.descriptor("Lib-1.0.plist", TestRepository.dict("name", "Lib", "version", "1.0", "catalogs", TestRepository.array("testing")));
        repo.descriptor("Bar-1.0.plist", TestRepository.dict("name", "Bar", "version", "1.0", "installer_item_size", 524288L, "catalogs", TestRepository.array("production")));
        repo.manifest("site_default", TestRepository.dict("managed_installs", TestRepository.array("Foo")));
        return repo;
    }

    @Test
    public void testOutOfDate(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = usageRepository(dir);
        ReportFindings findings = ReportKind.OUT_OF_DATE.run(RepositorySnapshot.load(repo.layout()));
        assertEquals(Arrays.asList("2.0", "1.0"), column(findings, "version"));
        assertEquals(Arrays.asList("Foo", "Foo"), column(findings, "name"));
        assertEquals("1.0 GB", findings.getItems().get(1).get("size"));

        findings = ReportKind.OUT_OF_DATE.run(RepositorySnapshot.load(repo.layout(), 2));
        assertEquals(Arrays.asList("1.0"), column(findings, "version"));
        assertThrows(IllegalArgumentException.class, () -> RepositorySnapshot.load(repo.layout(), 0));
    }

    @Test
    public void testUnused(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = usageRepository(dir);
        RepositorySnapshot snapshot = RepositorySnapshot.load(repo.layout());
        ReportFindings findings = ReportKind.UNUSED.run(snapshot);
        assertEquals(Arrays.asList("Bar"), column(findings, "name"));

        ReportFindings diskUsage = ReportKind.UNUSED_DISK_USAGE.run(snapshot);
        assertTrue(diskUsage.getItems().isEmpty());
        assertEquals(Collections.singletonList(Collections.singletonMap("Unused files account for", "2.00 gigabytes")), diskUsage.getMetadata());
    }

    @Test
    public void testConditionReports(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = new TestRepository(dir);
        Instant date = Instant.parse("2030-01-01T00:00:00Z");
        repo.descriptor("T1.plist", TestRepository.dict("name", "T1", "version", "1.0", "unattended_install", true, "catalogs", TestRepository.array("testing")));
        repo.descriptor("T2.plist", TestRepository.dict("name", "T2", "version", "1.0", "force_install_after_date", date, "catalogs", TestRepository.array("testing")));
        repo.descriptor("P1.plist", TestRepository.dict("name", "P1", "version", "1.0", "catalogs", TestRepository.array("production")));
        repo.descriptor("P2.plist", TestRepository.dict("name", "P2", "version", "1.0", "unattended_install", true, "force_install_after_date", date, "catalogs", TestRepository.array("production")));
        repo.descriptor("None.plist", TestRepository.dict("name", "None", "version", "1.0"));
        RepositorySnapshot snapshot = RepositorySnapshot.load(repo.layout());

        assertEquals(Arrays.asList("T1"), column(ReportKind.UNATTENDED_TESTING.run(snapshot), "name"));
        assertEquals(Arrays.asList("P1"), column(ReportKind.ATTENDED_PRODUCTION.run(snapshot), "name"));
        assertEquals(Arrays.asList("T1"), column(ReportKind.FORCE_INSTALL_TESTING.run(snapshot), "name"));
        assertEquals(Arrays.asList("P2"), column(ReportKind.FORCE_INSTALL_PRODUCTION.run(snapshot), "name"));
        assertEquals(Arrays.asList("name", "version", "path"), new ArrayList<>(ReportKind.FORCE_INSTALL_PRODUCTION.run(snapshot).getItems().get(0).keySet()));
    }

    @Test
    public void testTextOutput(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = usageRepository(dir);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        ReportPrinter.printAll(out, ReportKind.runAll(RepositorySnapshot.load(repo.layout())));
        String text = new String(bytes.toByteArray(), StandardCharsets.UTF_8);

        for (ReportKind kind : ReportKind.values()) {
            assertTrue(text.contains(kind.describe().name()), kind.name());
        }
        assertTrue(text.contains("\tNo items."), text);
        assertTrue(text.contains("\tUnused files account for: 2.00 gigabytes"), text);
        assertTrue(text.contains("\tItems:\n\t--------------------\n\tname: Bar\n\tversion: 1.0\n"), text);
        for (String line : text.split("\n")) {
            if (line.startsWith("\tThis report")) {
                assertTrue(line.length() <= 73, line);
            }
        }
        assertFalse(text.indexOf(ReportKind.PATH_ISSUES.describe().name()) > text.indexOf(ReportKind.UNUSED.describe().name()));
    }

    @Test
    public void testPropertyListOutput(@TempDir Path dir) throws IOException, PropertyListException {
        TestRepository repo = usageRepository(dir);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ReportPrinter.writePropertyList(bytes, ReportKind.runAll(RepositorySnapshot.load(repo.layout())));

        Map<?, ?> dict = (Map<?, ?>) PropertyLists.read(new ByteArrayInputStream(bytes.toByteArray()), null);
        assertEquals(ReportKind.values().length, dict.size());
        Map<?, ?> unused = (Map<?, ?>) dict.get("Unused Item Report");
        List<?> items = (List<?>) unused.get("items");
        assertEquals(1, items.size());
        assertEquals("Bar", ((Map<?, ?>) items.get(0)).get("name"));
        assertEquals(Collections.emptyList(), unused.get("metadata"));
    }
}
