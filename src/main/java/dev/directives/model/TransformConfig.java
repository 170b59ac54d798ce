package dev.directives.model;

import java.util.Objects;

/**
 * Per-invocation configuration.
 *
 * @param filename        project-relative path of the module, used for the metadata keys and, when no
 *                        module specifier is given, for the module path inside identities
 * @param moduleSpecifier package-style module path ({@code name@version}) overriding the path-derived one
 */
public record TransformConfig(
    CompilationMode mode,
    String filename,
    String moduleSpecifier // nullable
) {

    public TransformConfig {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(filename, "filename");
        if (filename.isBlank()) {
            throw new IllegalArgumentException("filename must not be blank");
        }
        if (moduleSpecifier != null && moduleSpecifier.isBlank()) {
            moduleSpecifier = null;
        }
    }

    public static TransformConfig of(CompilationMode mode, String filename) {
        return new TransformConfig(mode, filename, null);
    }

    public TransformConfig withMode(CompilationMode newMode) {
        return new TransformConfig(newMode, filename, moduleSpecifier);
    }

    public TransformConfig withModuleSpecifier(String specifier) {
        return new TransformConfig(mode, filename, specifier);
    }

    /** The filename with path separators normalised to forward slashes. */
    public String normalizedFilename() {
        return filename.replace('\\', '/');
    }
}
