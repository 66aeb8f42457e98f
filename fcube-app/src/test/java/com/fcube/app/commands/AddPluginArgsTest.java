package com.fcube.app.commands;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AddPluginArgsTest {

    @Test
    void noArguments_listsPlugins() {
        AddPluginArgs args = AddPluginArgs.parse(List.of());
        assertNull(args.pluginName());
        assertTrue(args.isListing());
    }

    @Test
    void pluginWithFlags() {
        AddPluginArgs args = AddPluginArgs.parse(List.of("referral", "--dry-run", "-f", "-d", "src/app"));

        assertEquals("referral", args.pluginName());
        assertTrue(args.dryRun());
        assertTrue(args.force());
        assertEquals("src/app", args.dir());
        assertFalse(args.isListing());
    }

    @Test
    void longFormsAndEqualsSyntax() {
        AddPluginArgs args = AddPluginArgs.parse(List.of("--force", "--dir=backend", "deploy_vps"));

        assertEquals("deploy_vps", args.pluginName());
        assertTrue(args.force());
        assertEquals("backend", args.dir());
    }

    @Test
    void listFlag_winsOverPluginName() {
        AddPluginArgs args = AddPluginArgs.parse(List.of("referral", "-l"));
        assertTrue(args.isListing());
    }

    @Test
    void jsonWithListOrDryRun_isAccepted() {
        assertTrue(AddPluginArgs.parse(List.of("--list", "--json")).json());
        assertTrue(AddPluginArgs.parse(List.of("referral", "--dry-run", "--json")).json());
    }

    @Test
    void jsonForRealInstall_isUsageError() {
        var e = assertThrows(AddPluginArgs.UsageException.class,
                () -> AddPluginArgs.parse(List.of("referral", "--json")));
        assertTrue(e.getMessage().contains("--json"));
    }

    @Test
    void unknownOption_isUsageError() {
        var e = assertThrows(AddPluginArgs.UsageException.class,
                () -> AddPluginArgs.parse(List.of("referral", "--yes")));
        assertEquals("unknown option: --yes", e.getMessage());
    }

    @Test
    void missingDirValue_isUsageError() {
        assertThrows(AddPluginArgs.UsageException.class, () -> AddPluginArgs.parse(List.of("referral", "--dir")));
        assertThrows(AddPluginArgs.UsageException.class, () -> AddPluginArgs.parse(List.of("referral", "--dir=")));
    }

    @Test
    void secondPositional_isUsageError() {
        assertThrows(AddPluginArgs.UsageException.class,
                () -> AddPluginArgs.parse(List.of("referral", "deploy_vps")));
    }

    @Test
    void help() {
        assertTrue(AddPluginArgs.parse(List.of("-h")).help());
        assertTrue(AddPluginArgs.parse(List.of("referral", "--help")).help());
    }
}
