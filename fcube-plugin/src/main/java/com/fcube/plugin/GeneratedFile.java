package com.fcube.plugin;

import java.nio.file.Path;

/**
 * One file produced by a {@link ContentGenerator}: path plus full text.
 */
public record GeneratedFile(Path path, String content) {

    public static GeneratedFile of(Path path, String content) {
        return new GeneratedFile(path, content);
    }

    public static GeneratedFile of(String path, String content) {
        return new GeneratedFile(Path.of(path), content);
    }
}
