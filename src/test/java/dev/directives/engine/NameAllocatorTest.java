package dev.directives.engine;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NameAllocatorTest {

    @Test
    void suffixesTakenNames() {
        var allocator = new NameAllocator(Set.of("run$scale"));

        assertThat(allocator.allocate("run$scale")).isEqualTo("run$scale$1");
        assertThat(allocator.allocate("run$scale")).isEqualTo("run$scale$2");
        assertThat(allocator.allocate("other")).isEqualTo("other");
    }

    @Test
    void sanitizesIllegalCharacters() {
        assertThat(NameAllocator.sanitize("run/scale")).isEqualTo("run_scale");
        assertThat(NameAllocator.sanitize("1st")).isEqualTo("_1st");
        assertThat(NameAllocator.sanitize("")).isEqualTo("_");
    }
}
