package com.fcube.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Project-level FCube settings, read from {@code fcube.json} in the project
 * root. Every field has a default so a missing file is a valid configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FcubeConfig {

    public static final String DEFAULT_APP_DIR = "app";

    /** Directory (relative to the project root) plugins install into. */
    @Builder.Default
    private String appDir = DEFAULT_APP_DIR;

    @Builder.Default
    private LockConfig lock = new LockConfig();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LockConfig {
        public static final long DEFAULT_TIMEOUT_MS = 5000;

        @Builder.Default
        private boolean enabled = true;

        @Builder.Default
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
    }
}
