package com.fcube.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FcubeApplicationTest {

    @TempDir
    Path projectRoot;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(List<String> args, Map<String, String> env) {
        return FcubeApplication.run(args, projectRoot, env,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noCommand_isUsageError() {
        assertEquals(2, run(List.of(), Map.of()));
        assertTrue(stderr().contains("Usage: fcube <command>"));
        assertEquals("", stdout());
    }

    @Test
    void unknownCommand_isUsageError() {
        assertEquals(2, run(List.of("startproject"), Map.of()));
        assertTrue(stderr().contains("unknown command: startproject"));
    }

    @Test
    void help_exitsZero() {
        assertEquals(0, run(List.of("--help"), Map.of()));
        assertTrue(stdout().contains("addplugin"));
    }

    @Test
    void addpluginList_printsToStdout() {
        assertEquals(0, run(List.of("addplugin", "--list"), Map.of()));
        assertTrue(stdout().contains("referral"));
        assertEquals("", stderr());
    }

    @Test
    void install_usesConfiguredAppDir() throws Exception {
        Files.createDirectories(projectRoot.resolve("backend"));
        Files.writeString(projectRoot.resolve("fcube.json"), "{\"appDir\": \"${APP_DIR:-backend}\"}");

        assertEquals(0, run(List.of("addplugin", "deploy_vps"), Map.of()), stderr());
        assertTrue(Files.exists(projectRoot.resolve("deploy-vps/README.md")));
    }

    @Test
    void appDirEnvironmentOverride_isHonoured() {
        assertEquals(1, run(List.of("addplugin", "deploy_vps"), Map.of("FCUBE_APP_DIR", "missing")));
        assertTrue(stderr().startsWith("TargetDirectoryNotFoundError: "));
    }

    @Test
    void engineFailure_exitsOne() {
        assertEquals(1, run(List.of("addplugin", "nope"), Map.of()));
        assertTrue(stderr().startsWith("PluginNotFoundError: "));
    }
}
