package dev.directives.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.directives.model.CompilationMode;
import dev.directives.model.TransformConfig;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads a {@link TransformConfig} from JSON:
 * <pre>{ "mode": "workflow", "filename": "src/jobs.ts", "moduleSpecifier": "jobs@1.2.0" }</pre>
 */
public final class TransformConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TransformConfigLoader() {}

    public static TransformConfig loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseConfig(root);
    }

    public static TransformConfig loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseConfig(root);
    }

    private static TransformConfig parseConfig(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Transform config must be a JSON object");
        }
        if (!root.hasNonNull("mode")) {
            throw new IllegalArgumentException("Transform config is missing 'mode'");
        }
        if (!root.hasNonNull("filename")) {
            throw new IllegalArgumentException("Transform config is missing 'filename'");
        }
        CompilationMode mode = CompilationMode.parse(root.get("mode").asText());
        String filename = root.get("filename").asText();
        String moduleSpecifier = root.hasNonNull("moduleSpecifier") ? root.get("moduleSpecifier").asText() : null;
        return new TransformConfig(mode, filename, moduleSpecifier);
    }
}
