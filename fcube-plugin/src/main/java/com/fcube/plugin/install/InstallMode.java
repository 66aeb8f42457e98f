package com.fcube.plugin.install;

public enum InstallMode {
    PREVIEW,
    APPLY
}
