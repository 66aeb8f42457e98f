package com.fcube.plugin.install;

import com.fcube.plugin.GeneratedFile;
import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.TestPlugins;
import com.fcube.plugin.errors.FileConflictException;
import com.fcube.plugin.errors.MissingDependencyException;
import com.fcube.plugin.errors.PartialWriteException;
import com.fcube.plugin.errors.PluginErrorKind;
import com.fcube.plugin.errors.PluginException;
import com.fcube.plugin.errors.PluginNotFoundException;
import com.fcube.plugin.plan.FileAction;
import com.fcube.plugin.plan.FilePlanEntry;
import com.fcube.plugin.plan.InstallPlanner;
import com.fcube.plugin.registry.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InstallerTest {

    private static final InstallOptions DRY_RUN = InstallOptions.builder().dryRun(true).build();
    private static final InstallOptions FORCE = InstallOptions.builder().force(true).build();

    @TempDir
    Path projectRoot;

    private Path appDir;
    private PluginRegistry registry;
    private Installer installer;

    @BeforeEach
    void setUp() throws Exception {
        appDir = Files.createDirectory(projectRoot.resolve("app"));
        registry = new PluginRegistry();
        registry.register(TestPlugins.referral());
        installer = new Installer(registry);
    }

    @Test
    void install_writesEveryPlannedFile() throws Exception {
        InstallOutcome outcome = installer.install("referral", appDir, InstallOptions.defaults());

        assertFalse(outcome.isDryRun());
        assertEquals(InstallMode.APPLY, outcome.mode());
        assertEquals(940, outcome.plan().totalBytes());
        assertTrue(outcome.plan().entries().stream().allMatch(e -> e.action() == FileAction.CREATE));
        assertEquals(List.of(appDir.resolve("referral/__init__.py").toAbsolutePath().normalize(),
                appDir.resolve("referral/models.py").toAbsolutePath().normalize()), outcome.writtenPaths());
        assertEquals(TestPlugins.REFERRAL_INIT, Files.readString(appDir.resolve("referral/__init__.py")));
        assertEquals(TestPlugins.REFERRAL_MODELS, Files.readString(appDir.resolve("referral/models.py")));
        assertTrue(outcome.configRequired());
        assertEquals("Add referral_code to the User model.", outcome.postInstallNotes());
    }

    @Test
    void dryRun_leavesFilesystemUnchanged() throws Exception {
        Files.writeString(appDir.resolve("main.py"), "app = None\n");
        Map<String, String> before = TestPlugins.snapshot(projectRoot);

        InstallOutcome outcome = installer.install("referral", appDir, DRY_RUN);

        assertEquals(before, TestPlugins.snapshot(projectRoot));
        assertTrue(outcome.isDryRun());
        assertTrue(outcome.writtenPaths().isEmpty());
        assertEquals(2, outcome.plan().fileCount());
    }

    @Test
    void dryRun_previewsOverwritesWithoutFailing() throws Exception {
        Files.createDirectories(appDir.resolve("referral"));
        Files.writeString(appDir.resolve("referral/models.py"), "old");

        InstallOutcome outcome = installer.install("referral", appDir, DRY_RUN);

        assertEquals(List.of(FileAction.CREATE, FileAction.OVERWRITE),
                outcome.plan().entries().stream().map(FilePlanEntry::action).toList());
        assertEquals("old", Files.readString(appDir.resolve("referral/models.py")));
    }

    @Test
    void dryRunPlan_matchesRealInstallPlan() {
        InstallOutcome preview = installer.install("referral", appDir, DRY_RUN);
        InstallOutcome applied = installer.install("referral", appDir, InstallOptions.defaults());

        assertEquals(preview.plan(), applied.plan());
    }

    @Test
    void conflicts_abortBeforeAnyWriteAndListEveryPath() throws Exception {
        Files.createDirectories(appDir.resolve("referral"));
        Files.writeString(appDir.resolve("referral/__init__.py"), "mine");
        Files.writeString(appDir.resolve("referral/models.py"), "mine too");

        FileConflictException e = assertThrows(FileConflictException.class,
                () -> installer.install("referral", appDir, InstallOptions.defaults()));

        assertEquals(PluginErrorKind.FILE_CONFLICT, e.getKind());
        assertEquals(List.of(appDir.resolve("referral/__init__.py").toAbsolutePath().normalize(),
                appDir.resolve("referral/models.py").toAbsolutePath().normalize()), e.getConflicts());
        assertEquals("mine", Files.readString(appDir.resolve("referral/__init__.py")));
        assertEquals("mine too", Files.readString(appDir.resolve("referral/models.py")));
    }

    @Test
    void singleConflict_blocksNewFilesToo() throws Exception {
        Files.createDirectories(appDir.resolve("referral"));
        Files.writeString(appDir.resolve("referral/models.py"), "mine");

        assertThrows(FileConflictException.class,
                () -> installer.install("referral", appDir, InstallOptions.defaults()));

        assertFalse(Files.exists(appDir.resolve("referral/__init__.py")));
    }

    @Test
    void force_overwritesExistingFiles() throws Exception {
        Files.createDirectories(appDir.resolve("referral"));
        Files.writeString(appDir.resolve("referral/models.py"), "mine");

        InstallOutcome outcome = installer.install("referral", appDir, FORCE);

        assertEquals(2, outcome.writtenPaths().size());
        assertEquals(TestPlugins.REFERRAL_MODELS, Files.readString(appDir.resolve("referral/models.py")));
        assertEquals(FileAction.OVERWRITE, outcome.plan().entries().get(1).action());
    }

    @Test
    void missingDependency_failsBeforeGeneratorRuns() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry = new PluginRegistry();
        registry.register(TestPlugins.valid("shop")
                .dependencies(List.of("user", "billing"))
                .contentGenerator(TestPlugins.counting(calls, GeneratedFile.of("shop/__init__.py", "")))
                .build());
        installer = new Installer(registry);
        Files.createDirectory(appDir.resolve("billing"));

        MissingDependencyException e = assertThrows(MissingDependencyException.class,
                () -> installer.install("shop", appDir, DRY_RUN));

        assertEquals(List.of("user"), e.getMissing());
        assertEquals(0, calls.get());
        assertFalse(Files.exists(appDir.resolve("shop")));

        Files.createDirectory(appDir.resolve("user"));
        installer.install("shop", appDir, InstallOptions.defaults());
        assertEquals(1, calls.get());
        assertTrue(Files.exists(appDir.resolve("shop/__init__.py")));
    }

    @Test
    void customPresenceProbe_isConsulted() {
        registry = new PluginRegistry();
        registry.register(TestPlugins.valid("shop").dependencies(List.of("user")).build());
        installer = new Installer(registry, (dep, dir) -> true,
                new InstallPlanner(), new PlanWriter());

        assertDoesNotThrow(() -> installer.install("shop", appDir, DRY_RUN));
    }

    @Test
    void unknownPlugin_isNotFound() {
        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> installer.install("referal", appDir, InstallOptions.defaults()));
        assertEquals(List.of("referral"), e.getSuggestions());
    }

    @Test
    void missingTargetDirectory_isReported() {
        PluginException e = assertThrows(PluginException.class,
                () -> installer.install("referral", projectRoot.resolve("missing"), InstallOptions.defaults()));
        assertEquals(PluginErrorKind.TARGET_DIRECTORY_NOT_FOUND, e.getKind());
    }

    @Test
    void failedWrite_reportsFilesAlreadyWritten() throws Exception {
        registry = new PluginRegistry();
        registry.register(TestPlugins.valid("partial")
                .filesGenerated(List.of("app/a.txt", "app/blocker/b.txt"))
                .contentGenerator(TestPlugins.generating(
                        GeneratedFile.of("a.txt", "first"),
                        GeneratedFile.of("blocker/b.txt", "second")))
                .build());
        installer = new Installer(registry);
        Files.writeString(appDir.resolve("blocker"), "a regular file");

        PartialWriteException e = assertThrows(PartialWriteException.class,
                () -> installer.install("partial", appDir, InstallOptions.defaults()));

        assertEquals(PluginErrorKind.PARTIAL_WRITE, e.getKind());
        assertEquals(List.of(appDir.resolve("a.txt").toAbsolutePath().normalize()), e.getWritten());
        assertEquals(appDir.resolve("blocker/b.txt").toAbsolutePath().normalize(), e.getFailedPath());
        assertEquals("first", Files.readString(appDir.resolve("a.txt")));
    }

    @Test
    void generatorRunsOncePerInstall() {
        AtomicInteger calls = new AtomicInteger();
        registry = new PluginRegistry();
        registry.register(TestPlugins.valid("once")
                .contentGenerator(TestPlugins.counting(calls, GeneratedFile.of("once/__init__.py", "")))
                .build());
        installer = new Installer(registry);

        installer.install("once", appDir, InstallOptions.defaults());

        assertEquals(1, calls.get());
    }

    @Test
    void registryEntry_isUnchangedByInstall() {
        PluginMetadata before = registry.get("referral");
        installer.install("referral", appDir, InstallOptions.defaults());
        assertSame(before, registry.get("referral"));
    }
}
