package com.umlcodegen.core.renderer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GeneratedFile}.
 */
class GeneratedFileTest {

    @Test
    void constructor_withValidInputs_createsFile() {
        GeneratedFile file = new GeneratedFile("java/model.java", "public class User {\n}\n", "java");

        assertThat(file.relativePath()).isEqualTo("java/model.java");
        assertThat(file.content()).isEqualTo("public class User {\n}\n");
        assertThat(file.language()).isEqualTo("java");
    }

    @Test
    void constructor_withNullRelativePath_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile(null, "content", "java"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("relativePath must not be null");
    }

    @Test
    void constructor_withNullContent_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile("python/model.py", null, "python"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("content must not be null");
    }

    @Test
    void constructor_withNullLanguage_acceptsNull() {
        GeneratedFile file = new GeneratedFile("model.rb", "class User\nend\n", null);

        assertThat(file.language()).isNull();
    }

    @Test
    void equals_withSameValues_returnsTrue() {
        GeneratedFile file1 = new GeneratedFile("path", "content", "kotlin");
        GeneratedFile file2 = new GeneratedFile("path", "content", "kotlin");

        assertThat(file1).isEqualTo(file2);
        assertThat(file1.hashCode()).isEqualTo(file2.hashCode());
    }
}
