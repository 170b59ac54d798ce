package dev.directives.engine;

import dev.directives.model.IdentityKind;
import dev.directives.model.TransformConfig;

import java.util.List;

/**
 * Builds the {@code "{kind}//{modulePath}//{name}"} identity strings that address steps, workflows
 * and classes across processes.
 */
public final class IdentityGenerator {

    public static final String SEPARATOR = "//";

    /** Names with this prefix are runtime built-ins and keep one identity across packages. */
    public static final String BUILTIN_PREFIX = "__builtin";

    public static final String BUILTIN_MODULE_PATH = "builtin";

    // Longest match first: ".d.ts" must win over ".ts".
    private static final List<String> EXTENSIONS = List.of(
        ".d.ts", ".d.mts", ".d.cts", ".tsx", ".jsx", ".mts", ".cts", ".ts", ".js", ".mjs", ".cjs");

    private final String modulePath;

    private IdentityGenerator(String modulePath) {
        this.modulePath = modulePath;
    }

    public static IdentityGenerator forModule(TransformConfig config) {
        return new IdentityGenerator(modulePath(config.moduleSpecifier(), config.normalizedFilename()));
    }

    public static IdentityGenerator forModulePath(String modulePath) {
        return new IdentityGenerator(modulePath);
    }

    public String modulePath() {
        return modulePath;
    }

    public String step(String qualifiedName) {
        return identity(IdentityKind.STEP, modulePath, qualifiedName);
    }

    public String workflow(String qualifiedName) {
        return identity(IdentityKind.WORKFLOW, modulePath, qualifiedName);
    }

    public String classId(String className) {
        return identity(IdentityKind.CLASS, modulePath, className);
    }

    public static String identity(IdentityKind kind, String modulePath, String name) {
        String path = name.startsWith(BUILTIN_PREFIX) ? BUILTIN_MODULE_PATH : modulePath;
        return kind.prefix() + SEPARATOR + path + SEPARATOR + name;
    }

    /**
     * The explicit module specifier when there is one, otherwise {@code "./"} followed by the
     * filename without its extension.
     */
    public static String modulePath(String moduleSpecifier, String filename) {
        if (moduleSpecifier != null && !moduleSpecifier.isBlank()) {
            return moduleSpecifier;
        }
        String path = filename.replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return "./" + stripExtension(path);
    }

    public static String stripExtension(String path) {
        for (String extension : EXTENSIONS) {
            if (path.endsWith(extension) && path.length() > extension.length()) {
                return path.substring(0, path.length() - extension.length());
            }
        }
        return path;
    }
}
