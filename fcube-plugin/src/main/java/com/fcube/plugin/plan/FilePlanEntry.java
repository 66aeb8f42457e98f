package com.fcube.plugin.plan;

import java.nio.file.Path;

/**
 * One planned file write.
 *
 * @param path          absolute, normalized destination
 * @param relativePath  destination relative to the project root, {@code /}-separated
 * @param content       full file text
 * @param sizeBytes     UTF-8 length of {@code content}
 * @param existsAlready whether something existed at {@code path} when planned
 * @param action        {@link FileAction#OVERWRITE} iff {@code existsAlready}
 */
public record FilePlanEntry(
        Path path,
        String relativePath,
        String content,
        long sizeBytes,
        boolean existsAlready,
        FileAction action) {

    public boolean isOverwrite() {
        return action == FileAction.OVERWRITE;
    }
}
