package com.fcube.plugin.errors;

/**
 * Kinds of plugin engine failures. The label is the name shown to users.
 */
public enum PluginErrorKind {

    // Validation / registration
    INVALID_NAME("InvalidNameError"),
    MISSING_DESCRIPTION("MissingDescriptionError"),
    INVALID_VERSION("InvalidVersionError"),
    INSTALLER_NOT_CALLABLE("InstallerNotCallableError"),
    MISSING_POST_INSTALL_NOTES("MissingPostInstallNotesError"),
    EMPTY_FILE_LIST("EmptyFileListError"),
    INVALID_DEPENDENCY("InvalidDependencyError"),
    DUPLICATE_PLUGIN("DuplicatePluginError"),

    // Install
    PLUGIN_NOT_FOUND("PluginNotFoundError"),
    TARGET_DIRECTORY_NOT_FOUND("TargetDirectoryNotFoundError"),
    MISSING_DEPENDENCY("MissingDependencyError"),
    GENERATOR_FAILED("GeneratorFailedError"),
    UNSAFE_PATH("UnsafePathError"),
    FILE_CONFLICT("FileConflictError"),
    PARTIAL_WRITE("PartialWriteError");

    private final String label;

    PluginErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isValidation() {
        return ordinal() <= INVALID_DEPENDENCY.ordinal();
    }
}
