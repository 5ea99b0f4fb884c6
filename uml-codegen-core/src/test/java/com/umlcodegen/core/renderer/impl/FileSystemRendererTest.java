package com.umlcodegen.core.renderer.impl;

import com.umlcodegen.core.renderer.GeneratedFile;
import com.umlcodegen.core.renderer.GeneratedOutput;
import com.umlcodegen.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private FileSystemRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withSingleFile_writesFileToOutputDirectory() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("model.java", "public class User {\n}\n", "java")));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        Path written = tempDir.resolve("model.java");
        assertThat(written).exists();
        assertThat(Files.readString(written)).isEqualTo("public class User {\n}\n");
    }

    @Test
    void render_withLanguageDirectories_createsDirectoryStructure() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("java/model.java", "class A {}", "java"),
            new GeneratedFile("python/model.py", "class A:\n    pass\n", "python")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(tempDir.resolve("java")).isDirectory();
        assertThat(Files.readString(tempDir.resolve("python/model.py"))).isEqualTo("class A:\n    pass\n");
    }

    @Test
    void render_withExistingFile_overwritesByDefault() throws IOException {
        Path existing = tempDir.resolve("model.rb");
        Files.writeString(existing, "old");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("model.rb", "new", "ruby")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(existing)).isEqualTo("new");
    }

    @Test
    void render_withOverwriteDisabled_keepsExistingFile() throws IOException {
        Path existing = tempDir.resolve("model.rb");
        Files.writeString(existing, "hand edited");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("model.rb", "regenerated", "ruby"),
            new GeneratedFile("model.kt", "open class A", "kotlin")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of("filesystem.overwrite", "false")));

        assertThat(Files.readString(existing)).isEqualTo("hand edited");
        assertThat(tempDir.resolve("model.kt")).exists();
    }

    @Test
    void render_withNonExistentOutputDirectory_createsDirectory() {
        Path newDir = tempDir.resolve("generated/nested");

        renderer.render(new GeneratedOutput(List.of()), new RenderContext(newDir.toString(), Map.of()));

        assertThat(newDir).isDirectory();
    }

    @Test
    void render_withPathEscapingOutputDirectory_throwsException() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("../outside.java", "x", "java")));
        RenderContext context = new RenderContext(tempDir.resolve("out").toString(), Map.of());

        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolve("outside.java")).doesNotExist();
    }

    @Test
    void render_withOutputDirectoryBlockedByFile_throwsException() throws IOException {
        Path blocker = tempDir.resolve("blocked");
        Files.writeString(blocker, "not a directory");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("model.ts", "x", "typescript")));

        assertThatThrownBy(() -> renderer.render(output, new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }

    @Test
    void render_withEmptyContent_writesEmptyFile() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("empty.js", "", "javascript")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("empty.js"))).isEmpty();
    }
}
