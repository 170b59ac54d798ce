package dev.directives.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Identity map of one or more modules: per file, the workflow ids by export name, the step ids by
 * qualified name and the class ids by class name. All maps are sorted so that serialized output is
 * deterministic.
 */
public record ModuleManifest(
    SortedMap<String, SortedMap<String, String>> workflows,
    SortedMap<String, SortedMap<String, String>> steps,
    SortedMap<String, SortedMap<String, String>> classes
) {

    private static final ModuleManifest EMPTY = new ModuleManifest(new TreeMap<>(), new TreeMap<>(), new TreeMap<>());

    public ModuleManifest {
        workflows = frozenCopy(workflows);
        steps = frozenCopy(steps);
        classes = frozenCopy(classes);
    }

    public static ModuleManifest empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return workflows.isEmpty() && steps.isEmpty() && classes.isEmpty();
    }

    /** Union of both manifests; on a clash within one file the entry from {@code other} wins. */
    public ModuleManifest merge(ModuleManifest other) {
        var builder = builder();
        builder.addAll(this);
        builder.addAll(other);
        return builder.build();
    }

    public int workflowCount() {
        return count(workflows);
    }

    public int stepCount() {
        return count(steps);
    }

    public int classCount() {
        return count(classes);
    }

    private static int count(Map<String, SortedMap<String, String>> byFile) {
        return byFile.values().stream().mapToInt(Map::size).sum();
    }

    private static SortedMap<String, SortedMap<String, String>> frozenCopy(
        Map<String, ? extends Map<String, String>> source
    ) {
        var copy = new TreeMap<String, SortedMap<String, String>>();
        source.forEach((file, entries) -> {
            if (!entries.isEmpty()) {
                copy.put(file, Collections.unmodifiableSortedMap(new TreeMap<>(entries)));
            }
        });
        return Collections.unmodifiableSortedMap(copy);
    }

    public static final class Builder {

        private final SortedMap<String, SortedMap<String, String>> workflows = new TreeMap<>();
        private final SortedMap<String, SortedMap<String, String>> steps = new TreeMap<>();
        private final SortedMap<String, SortedMap<String, String>> classes = new TreeMap<>();

        private Builder() {}

        public Builder workflow(String file, String exportName, String workflowId) {
            workflows.computeIfAbsent(file, f -> new TreeMap<>()).put(exportName, workflowId);
            return this;
        }

        public Builder step(String file, String qualifiedName, String stepId) {
            steps.computeIfAbsent(file, f -> new TreeMap<>()).put(qualifiedName, stepId);
            return this;
        }

        public Builder classEntry(String file, String className, String classId) {
            classes.computeIfAbsent(file, f -> new TreeMap<>()).put(className, classId);
            return this;
        }

        public Builder addAll(ModuleManifest manifest) {
            manifest.workflows().forEach((file, entries) -> entries.forEach((k, v) -> workflow(file, k, v)));
            manifest.steps().forEach((file, entries) -> entries.forEach((k, v) -> step(file, k, v)));
            manifest.classes().forEach((file, entries) -> entries.forEach((k, v) -> classEntry(file, k, v)));
            return this;
        }

        public ModuleManifest build() {
            return new ModuleManifest(workflows, steps, classes);
        }
    }
}
