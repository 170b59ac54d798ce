package dev.directives.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives the {@code name@version} module specifier for files that belong to a package: anything
 * under {@code node_modules}, or inside a workspace package whose nearest {@code package.json} is not
 * the project root's. Application files get no specifier and fall back to their relative path.
 */
public final class ModuleSpecifierResolver {

    private static final Logger log = LoggerFactory.getLogger(ModuleSpecifierResolver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String PACKAGE_JSON = "package.json";

    /** Nearest directory holding a usable package.json, keyed by each directory searched. */
    private final Map<Path, Optional<PackageInfo>> cache = new ConcurrentHashMap<>();
    private final Path projectRoot;

    record PackageInfo(Path directory, String name, String version) {
        String specifier() {
            return name + "@" + version;
        }
    }

    public ModuleSpecifierResolver(Path projectRoot) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    public Optional<String> resolve(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        boolean inNodeModules = isInNodeModules(absolute);
        Optional<PackageInfo> pkg = findPackage(absolute.getParent());
        if (pkg.isEmpty()) {
            return Optional.empty();
        }
        if (!inNodeModules && pkg.get().directory().equals(projectRoot)) {
            return Optional.empty();
        }
        if (!inNodeModules && !pkg.get().directory().startsWith(projectRoot)) {
            return Optional.empty();
        }
        log.debug("Resolved module specifier {} for {}", pkg.get().specifier(), absolute);
        return Optional.of(pkg.get().specifier());
    }

    /** Forgets every package.json lookup, for when files changed on disk. */
    public void clearCache() {
        cache.clear();
    }

    static boolean isInNodeModules(Path path) {
        for (Path segment : path) {
            if (segment.toString().equals("node_modules")) {
                return true;
            }
        }
        return false;
    }

    private Optional<PackageInfo> findPackage(Path directory) {
        if (directory == null) {
            return Optional.empty();
        }
        Optional<PackageInfo> cached = cache.get(directory);
        if (cached != null) {
            return cached;
        }
        Optional<PackageInfo> found = readPackage(directory);
        if (found.isEmpty()) {
            found = findPackage(directory.getParent());
        }
        cache.put(directory, found);
        return found;
    }

    private static Optional<PackageInfo> readPackage(Path directory) {
        Path manifest = directory.resolve(PACKAGE_JSON);
        if (!Files.isRegularFile(manifest)) {
            return Optional.empty();
        }
        try {
            JsonNode root = MAPPER.readTree(manifest.toFile());
            if (root != null && root.hasNonNull("name") && root.hasNonNull("version")) {
                return Optional.of(new PackageInfo(directory, root.get("name").asText(),
                    root.get("version").asText()));
            }
        } catch (IOException e) {
            log.debug("Skipping unreadable {}: {}", manifest, e.getMessage());
        }
        return Optional.empty();
    }
}
