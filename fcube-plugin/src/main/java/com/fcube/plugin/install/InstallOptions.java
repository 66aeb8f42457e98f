package com.fcube.plugin.install;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class InstallOptions {

    /** Overwrite existing files instead of failing. */
    boolean force;

    /** Plan and preview only; nothing is written. */
    boolean dryRun;

    /**
     * Directory generated paths must stay inside; null means the parent of
     * the target directory.
     */
    Path projectRoot;

    public static InstallOptions defaults() {
        return InstallOptions.builder().build();
    }
}
