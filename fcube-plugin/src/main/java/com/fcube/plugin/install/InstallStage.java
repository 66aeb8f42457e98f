package com.fcube.plugin.install;

/**
 * Stages of one install invocation. Not persisted.
 */
public enum InstallStage {
    LOOKUP,
    DEP_CHECK,
    PLAN,
    PREVIEW,
    APPLY,
    DONE,
    FAILED
}
