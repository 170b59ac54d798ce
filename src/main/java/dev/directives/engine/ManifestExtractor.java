package dev.directives.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.directives.model.ModuleManifest;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the metadata comment back out of transformed code, the way a bundler collects ids across
 * modules.
 */
public final class ManifestExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String OPEN = "/**" + RuntimeContract.METADATA_PREFIX;
    private static final String CLOSE = "*/";

    private ManifestExtractor() {}

    /** The manifest embedded in {@code code}, or empty when the module carries none. */
    public static Optional<ModuleManifest> extract(String code) throws IOException {
        int start = code.indexOf(OPEN);
        if (start < 0) {
            return Optional.empty();
        }
        int jsonStart = start + OPEN.length();
        int end = code.indexOf(CLOSE, jsonStart);
        if (end < 0) {
            throw new IllegalArgumentException("Unterminated metadata comment at offset " + start);
        }
        return Optional.of(fromJson(MAPPER.readTree(code.substring(jsonStart, end))));
    }

    public static ModuleManifest fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Metadata must be a JSON object");
        }
        var builder = ModuleManifest.builder();
        read(root, MetadataEmitter.WORKFLOWS, MetadataEmitter.WORKFLOW_ID,
            (file, key, id) -> builder.workflow(file, key, id));
        read(root, MetadataEmitter.STEPS, MetadataEmitter.STEP_ID, (file, key, id) -> builder.step(file, key, id));
        read(root, MetadataEmitter.CLASSES, MetadataEmitter.CLASS_ID,
            (file, key, id) -> builder.classEntry(file, key, id));
        return builder.build();
    }

    @FunctionalInterface
    private interface EntrySink {
        void accept(String file, String key, String id);
    }

    private static void read(JsonNode root, String section, String idField, EntrySink sink) {
        JsonNode files = root.get(section);
        if (files == null) {
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = files.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> file = it.next();
            for (Iterator<Map.Entry<String, JsonNode>> entries = file.getValue().fields(); entries.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = entries.next();
                JsonNode id = entry.getValue().get(idField);
                if (id == null || !id.isTextual()) {
                    throw new IllegalArgumentException("Entry '" + entry.getKey() + "' in " + section + " of "
                        + file.getKey() + " has no " + idField);
                }
                sink.accept(file.getKey(), entry.getKey(), id.asText());
            }
        }
    }
}
