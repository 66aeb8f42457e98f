package com.fcube.plugin;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Plugin fixtures shared by the engine tests.
 */
public final class TestPlugins {

    private TestPlugins() {
    }

    /** Valid metadata whose generator emits {@code <name>/__init__.py}. */
    public static PluginMetadata.PluginMetadataBuilder valid(String name) {
        return PluginMetadata.builder()
                .name(name)
                .description("Test plugin " + name)
                .version("1.0.0")
                .dependencies(List.of())
                .filesGenerated(List.of("app/" + name + "/__init__.py"))
                .configRequired(false)
                .postInstallNotes("Wire " + name + " into your app.")
                .contentGenerator(generating(
                        GeneratedFile.of(name + "/__init__.py", "# " + name + "\n")));
    }

    public static ContentGenerator generating(GeneratedFile... files) {
        List<GeneratedFile> list = List.of(files);
        return targetDir -> list;
    }

    /** Generator that counts its invocations. */
    public static ContentGenerator counting(AtomicInteger calls, GeneratedFile... files) {
        List<GeneratedFile> list = List.of(files);
        return targetDir -> {
            calls.incrementAndGet();
            return list;
        };
    }

    /** ASCII text of exactly {@code bytes} bytes starting with {@code head}. */
    public static String sized(String head, int bytes) {
        StringBuilder sb = new StringBuilder(head);
        while (sb.length() < bytes - 1) {
            sb.append('#');
        }
        sb.setLength(bytes - 1);
        return sb.append('\n').toString();
    }

    public static final String REFERRAL_INIT = sized("\"\"\"Referral plugin.\"\"\"\n", 40);
    public static final String REFERRAL_MODELS = sized("from sqlalchemy.orm import Mapped\n", 900);

    /** The two-file {@code referral} plugin used for end-to-end scenarios. */
    public static PluginMetadata referral() {
        return PluginMetadata.builder()
                .name("referral")
                .description("User referral system")
                .version("1.0.0")
                .filesGenerated(List.of("app/referral/__init__.py", "app/referral/models.py"))
                .configRequired(true)
                .postInstallNotes("Add referral_code to the User model.")
                .contentGenerator(generating(
                        GeneratedFile.of("referral/__init__.py", REFERRAL_INIT),
                        GeneratedFile.of("referral/models.py", REFERRAL_MODELS)))
                .build();
    }

    /** Every regular file under {@code dir} with its content, keyed by relative path. */
    public static Map<String, String> snapshot(Path dir) {
        Map<String, String> files = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.toList()) {
                String key = dir.relativize(p).toString().replace('\\', '/');
                files.put(key, Files.isRegularFile(p) ? Files.readString(p) : "<dir>");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return files;
    }
}
