package com.fcube.plugin.validation;

import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.errors.PluginErrorKind;
import com.fcube.plugin.errors.PluginValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Structural checks on {@link PluginMetadata}.
 *
 * <p>
 * Every check runs regardless of earlier failures so a plugin author sees
 * all problems at once. Pure: no I/O and the content generator is never
 * invoked.
 * </p>
 */
public final class MetadataValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern VERSION_PART = Pattern.compile("[0-9]+");

    private MetadataValidator() {
    }

    public record Violation(PluginErrorKind kind, String message) {
    }

    public sealed interface ValidationResult {
        record Ok() implements ValidationResult {
        }

        record Fail(List<Violation> violations) implements ValidationResult {
        }

        default boolean isOk() {
            return this instanceof Ok;
        }

        default List<Violation> violations() {
            return this instanceof Fail f ? f.violations() : List.of();
        }
    }

    /**
     * Validate metadata, collecting every violation.
     *
     * @throws NullPointerException if {@code metadata} is null
     */
    public static ValidationResult validate(PluginMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        List<Violation> violations = new ArrayList<>();

        String name = metadata.getName();
        if (!isIdentifier(name)) {
            violations.add(new Violation(PluginErrorKind.INVALID_NAME,
                    "name must be a non-empty identifier of letters, digits and underscores"
                            + " not starting with a digit, got " + quote(name)));
        }

        if (isBlank(metadata.getDescription())) {
            violations.add(new Violation(PluginErrorKind.MISSING_DESCRIPTION,
                    "description is required"));
        }

        if (!isSemanticVersion(metadata.getVersion())) {
            violations.add(new Violation(PluginErrorKind.INVALID_VERSION,
                    "version must be MAJOR.MINOR.PATCH, got " + quote(metadata.getVersion())));
        }

        if (metadata.getContentGenerator() == null) {
            violations.add(new Violation(PluginErrorKind.INSTALLER_NOT_CALLABLE,
                    "content generator is required"));
        }

        if (isBlank(metadata.getPostInstallNotes())) {
            violations.add(new Violation(PluginErrorKind.MISSING_POST_INSTALL_NOTES,
                    "post-install notes are required"));
        }

        List<String> files = metadata.getFilesGenerated();
        if (files == null || files.isEmpty()) {
            violations.add(new Violation(PluginErrorKind.EMPTY_FILE_LIST,
                    "files generated must list at least one file"));
        } else if (files.stream().anyMatch(MetadataValidator::isBlank)) {
            violations.add(new Violation(PluginErrorKind.EMPTY_FILE_LIST,
                    "files generated must not contain blank paths"));
        }

        List<String> dependencies = metadata.getDependencies();
        if (dependencies != null) {
            for (String dependency : dependencies) {
                if (!isIdentifier(dependency)) {
                    violations.add(new Violation(PluginErrorKind.INVALID_DEPENDENCY,
                            "dependency must be an identifier, got " + quote(dependency)));
                }
            }
        }

        return violations.isEmpty() ? new ValidationResult.Ok()
                : new ValidationResult.Fail(List.copyOf(violations));
    }

    /**
     * Validate and throw on failure.
     *
     * @throws PluginValidationException carrying every violation
     */
    public static void requireValid(PluginMetadata metadata) {
        ValidationResult result = validate(metadata);
        if (result instanceof ValidationResult.Fail fail) {
            throw new PluginValidationException(metadata.getName(), fail.violations());
        }
    }

    static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    static boolean isSemanticVersion(String version) {
        if (version == null) {
            return false;
        }
        String[] parts = version.split("\\.", -1);
        if (parts.length != 3) {
            return false;
        }
        for (String part : parts) {
            if (!VERSION_PART.matcher(part).matches()) {
                return false;
            }
            // Components must fit an int
            try {
                Integer.parseInt(part);
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String quote(String value) {
        return value == null ? "null" : "'" + value + "'";
    }
}
