package com.fcube.plugin.registry;

import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.errors.DuplicatePluginException;
import com.fcube.plugin.errors.PluginNotFoundException;
import com.fcube.plugin.validation.MetadataValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of installable plugins keyed by name.
 *
 * <p>
 * Append-only: entries are validated on insert, never replaced or removed.
 * After {@link #freeze()} the table is read-only and safe to share between
 * threads.
 * </p>
 */
@Slf4j
public class PluginRegistry {

    private static final int MAX_SUGGESTION_DISTANCE = 2;

    private final Map<String, PluginMetadata> plugins = new ConcurrentHashMap<>();
    private volatile boolean frozen = false;

    /**
     * Validate and insert a plugin.
     *
     * @throws com.fcube.plugin.errors.PluginValidationException if the metadata is invalid
     * @throws DuplicatePluginException                           if the name is taken
     * @throws IllegalStateException                              after {@link #freeze()}
     */
    public void register(PluginMetadata metadata) {
        if (frozen) {
            throw new IllegalStateException("plugin registry is frozen");
        }
        MetadataValidator.requireValid(metadata);

        PluginMetadata stored = metadata.immutableCopy();
        PluginMetadata existing = plugins.putIfAbsent(stored.getName(), stored);
        if (existing != null) {
            throw new DuplicatePluginException(stored.getName());
        }
        log.debug("Registered plugin: {} v{}", stored.getName(), stored.getVersion());
    }

    /**
     * Stop accepting registrations.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * All plugins sorted by name.
     */
    public List<PluginMetadata> list() {
        return plugins.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .toList();
    }

    public List<String> names() {
        return plugins.keySet().stream().sorted().toList();
    }

    /**
     * Exact-match lookup.
     *
     * @throws PluginNotFoundException naming the key, close matches and all known names
     */
    public PluginMetadata get(String name) {
        PluginMetadata metadata = name == null ? null : plugins.get(name);
        if (metadata == null) {
            throw new PluginNotFoundException(String.valueOf(name), suggest(name), names());
        }
        return metadata;
    }

    public Optional<PluginMetadata> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(plugins.get(name));
    }

    public boolean contains(String name) {
        return name != null && plugins.containsKey(name);
    }

    public int size() {
        return plugins.size();
    }

    /**
     * Known names close to {@code name}: same name ignoring case, a shared
     * prefix, or within a small edit distance.
     */
    List<String> suggest(String name) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        String needle = name.toLowerCase(Locale.ROOT);
        List<String> matches = new ArrayList<>();
        for (String candidate : names()) {
            String hay = candidate.toLowerCase(Locale.ROOT);
            if (hay.startsWith(needle) || needle.startsWith(hay)
                    || editDistanceWithin(needle, hay, MAX_SUGGESTION_DISTANCE).isPresent()) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    /**
     * Edit distance between {@code a} and {@code b}, or empty once it must exceed {@code limit}.
     * Keeps a single row of the distance table.
     */
    static OptionalInt editDistanceWithin(String a, String b, int limit) {
        if (Math.abs(a.length() - b.length()) > limit) {
            return OptionalInt.empty();
        }
        int[] row = new int[b.length() + 1];
        for (int j = 0; j < row.length; j++) {
            row[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            int diagonal = row[0];
            row[0] = i;
            int best = row[0];
            for (int j = 1; j < row.length; j++) {
                int above = row[j];
                int substitution = diagonal + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                row[j] = Math.min(substitution, Math.min(above, row[j - 1]) + 1);
                diagonal = above;
                best = Math.min(best, row[j]);
            }
            if (best > limit) {
                return OptionalInt.empty();
            }
        }
        int distance = row[b.length()];
        return distance <= limit ? OptionalInt.of(distance) : OptionalInt.empty();
    }
}
