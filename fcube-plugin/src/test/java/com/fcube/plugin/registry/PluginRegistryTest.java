package com.fcube.plugin.registry;

import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.TestPlugins;
import com.fcube.plugin.errors.DuplicatePluginException;
import com.fcube.plugin.errors.PluginErrorKind;
import com.fcube.plugin.errors.PluginNotFoundException;
import com.fcube.plugin.errors.PluginValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    private PluginRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
    }

    @Test
    void registeredPlugin_isReturnedByGet() {
        PluginMetadata referral = TestPlugins.referral();
        registry.register(referral);

        PluginMetadata stored = registry.get("referral");
        assertEquals(referral.getName(), stored.getName());
        assertEquals(referral.getVersion(), stored.getVersion());
        assertEquals(referral.getFilesGenerated(), stored.getFilesGenerated());
        assertSame(referral.getContentGenerator(), stored.getContentGenerator());
        assertTrue(registry.contains("referral"));
        assertTrue(registry.find("referral").isPresent());
    }

    @Test
    void storedLists_areDetachedFromCallerLists() {
        List<String> files = new ArrayList<>(List.of("app/a/__init__.py"));
        registry.register(TestPlugins.valid("a").filesGenerated(files).build());

        files.add("app/a/extra.py");

        assertEquals(List.of("app/a/__init__.py"), registry.get("a").getFilesGenerated());
        assertThrows(UnsupportedOperationException.class,
                () -> registry.get("a").getFilesGenerated().add("x"));
    }

    @Test
    void invalidMetadata_isNotInserted() {
        PluginMetadata invalid = TestPlugins.valid("ok").version("1.0").build();

        PluginValidationException e = assertThrows(PluginValidationException.class,
                () -> registry.register(invalid));

        assertEquals(PluginErrorKind.INVALID_VERSION, e.getKind());
        assertEquals(0, registry.size());
        assertFalse(registry.contains("ok"));
    }

    @Test
    void duplicateName_keepsFirstEntry() {
        registry.register(TestPlugins.valid("dup").description("first").build());

        DuplicatePluginException e = assertThrows(DuplicatePluginException.class,
                () -> registry.register(TestPlugins.valid("dup").description("second").build()));

        assertEquals("dup", e.getPluginName());
        assertEquals(PluginErrorKind.DUPLICATE_PLUGIN, e.getKind());
        assertEquals("first", registry.get("dup").getDescription());
        assertEquals(1, registry.size());
    }

    @Test
    void list_isSortedByName() {
        registry.register(TestPlugins.valid("zeta").build());
        registry.register(TestPlugins.valid("alpha").build());
        registry.register(TestPlugins.valid("mid").build());

        assertEquals(List.of("alpha", "mid", "zeta"),
                registry.list().stream().map(PluginMetadata::getName).toList());
        assertEquals(List.of("alpha", "mid", "zeta"), registry.names());
    }

    @Test
    void frozenRegistry_rejectsRegistration() {
        registry.register(TestPlugins.valid("a").build());
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register(TestPlugins.valid("b").build()));
        assertEquals(List.of("a"), registry.names());
    }

    @Test
    void unknownName_throwsWithSuggestionsAndKnownNames() {
        registry.register(TestPlugins.referral());
        registry.register(TestPlugins.valid("deploy_vps").build());

        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> registry.get("referal"));

        assertEquals(PluginErrorKind.PLUGIN_NOT_FOUND, e.getKind());
        assertEquals("referal", e.getPluginName());
        assertEquals(List.of("referral"), e.getSuggestions());
        assertEquals(List.of("deploy_vps", "referral"), e.getKnownNames());
        assertTrue(e.getMessage().contains("did you mean: referral"));
    }

    @Test
    void lookup_isCaseSensitive() {
        registry.register(TestPlugins.referral());

        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> registry.get("Referral"));
        assertEquals(List.of("referral"), e.getSuggestions());
    }

    @Test
    void suggest_matchesPrefixesAndSmallEdits() {
        registry.register(TestPlugins.valid("deploy_vps").build());
        registry.register(TestPlugins.referral());

        assertEquals(List.of("deploy_vps"), registry.suggest("deploy"));
        assertEquals(List.of("referral"), registry.suggest("refferal"));
        assertEquals(List.of(), registry.suggest("payments"));
        assertEquals(List.of(), registry.suggest(""));
        assertEquals(List.of(), registry.suggest(null));
    }

    @Test
    void nullName_isNotFound() {
        assertThrows(PluginNotFoundException.class, () -> registry.get(null));
        assertFalse(registry.find(null).isPresent());
    }

    @Test
    void editDistanceWithin_respectsLimit() {
        assertEquals(OptionalInt.of(0), PluginRegistry.editDistanceWithin("abc", "abc", 2));
        assertEquals(OptionalInt.of(1), PluginRegistry.editDistanceWithin("referral", "referal", 2));
        assertEquals(OptionalInt.of(1), PluginRegistry.editDistanceWithin("kitten", "sitten", 2));
        assertEquals(OptionalInt.of(2), PluginRegistry.editDistanceWithin("user", "usr_", 2));
        assertEquals(OptionalInt.empty(), PluginRegistry.editDistanceWithin("kitten", "sitting", 2));
        assertEquals(OptionalInt.empty(), PluginRegistry.editDistanceWithin("", "abc", 2));
    }
}
