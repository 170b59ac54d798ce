package dev.directives.model;

import org.junit.jupiter.api.Test;

import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModuleManifestTest {

    @Test
    void mergesAcrossFiles() {
        var first = ModuleManifest.builder().step("a.js", "load", "step//./a//load").build();
        var second = ModuleManifest.builder()
            .workflow("b.js", "run", "workflow//./b//run")
            .step("b.js", "save", "step//./b//save")
            .build();

        ModuleManifest merged = first.merge(second);

        assertThat(merged.steps()).containsOnlyKeys("a.js", "b.js");
        assertThat(merged.stepCount()).isEqualTo(2);
        assertThat(merged.workflowCount()).isEqualTo(1);
        assertThat(merged.classCount()).isZero();
    }

    @Test
    void laterEntriesWinOnClash() {
        var first = ModuleManifest.builder().step("a.js", "load", "old").build();
        var second = ModuleManifest.builder().step("a.js", "load", "new").build();

        assertThat(first.merge(second).steps().get("a.js")).containsEntry("load", "new");
    }

    @Test
    void dropsEmptyFiles() {
        SortedMap<String, SortedMap<String, String>> steps = new TreeMap<>();
        steps.put("a.js", new TreeMap<>());

        var manifest = new ModuleManifest(new TreeMap<>(), steps, new TreeMap<>());

        assertThat(manifest.isEmpty()).isTrue();
    }

    @Test
    void isImmutable() {
        var manifest = ModuleManifest.builder().classEntry("a.js", "Point", "class//./a//Point").build();

        assertThatThrownBy(() -> manifest.classes().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
