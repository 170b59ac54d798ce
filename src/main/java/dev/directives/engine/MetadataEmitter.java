package dev.directives.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.directives.ast.FunctionNode;
import dev.directives.ast.Span;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.MetadataComment;
import dev.directives.model.ClassSerializationEntry;
import dev.directives.model.CompilationMode;
import dev.directives.model.ModuleManifest;
import dev.directives.model.StepFunction;
import dev.directives.model.WorkflowFunction;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Builds the identity manifest of a transformed module and embeds it as a block comment holding
 * {@code __internal_workflows} followed by the JSON, which bundlers read back.
 */
public final class MetadataEmitter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String WORKFLOWS = "workflows";
    static final String STEPS = "steps";
    static final String CLASSES = "classes";
    static final String WORKFLOW_ID = "workflowId";
    static final String STEP_ID = "stepId";
    static final String CLASS_ID = "classId";

    private MetadataEmitter() {}

    /** Entries for every function that survives the rewrite in {@code mode}. */
    public static ModuleManifest manifest(ModuleFacts facts, String filename, CompilationMode mode) {
        var builder = ModuleManifest.builder();
        for (FunctionNode function : facts.liveWorkflows(mode)) {
            WorkflowFunction workflow = facts.workflow(function);
            builder.workflow(filename, workflow.exportKey(), workflow.id());
        }
        for (FunctionNode function : facts.liveSteps(mode)) {
            StepFunction step = facts.step(function);
            builder.step(filename, step.qualifiedName(), step.id());
        }
        for (ClassSerializationEntry entry : facts.classes()) {
            builder.classEntry(filename, entry.className(), entry.id());
        }
        return builder.build();
    }

    /** Top-level keys only appear when they have entries. */
    public static ObjectNode toJsonTree(ModuleManifest manifest) {
        ObjectNode root = MAPPER.createObjectNode();
        section(root, WORKFLOWS, WORKFLOW_ID, manifest.workflows());
        section(root, STEPS, STEP_ID, manifest.steps());
        section(root, CLASSES, CLASS_ID, manifest.classes());
        return root;
    }

    public static String render(ModuleManifest manifest) {
        try {
            // "*/" would end the comment early.
            return MAPPER.writeValueAsString(toJsonTree(manifest)).replace("*/", "*\\/");
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** The body with the metadata comment placed right after its leading imports. */
    public static List<Statement> insert(List<Statement> body, ModuleManifest manifest) {
        if (manifest.isEmpty()) {
            return body;
        }
        var comment = new MetadataComment(RuntimeContract.METADATA_PREFIX + render(manifest), Span.SYNTHETIC);
        int position = HoistingPass.leadingImports(body);
        var out = new ArrayList<Statement>(body.size() + 1);
        out.addAll(body.subList(0, position));
        out.add(comment);
        out.addAll(body.subList(position, body.size()));
        return out;
    }

    private static void section(ObjectNode root, String name, String idField,
                                SortedMap<String, SortedMap<String, String>> byFile) {
        if (byFile.isEmpty()) {
            return;
        }
        ObjectNode files = root.putObject(name);
        for (Map.Entry<String, SortedMap<String, String>> file : byFile.entrySet()) {
            ObjectNode entries = files.putObject(file.getKey());
            file.getValue().forEach((key, id) -> entries.putObject(key).put(idField, id));
        }
    }
}
