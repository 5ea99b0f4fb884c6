package com.umlcodegen.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void call_withoutType_listsLanguages() {
        int exitCode = new CommandLine(new ListCommand()).execute();

        assertThat(exitCode).isZero();
        String output = out.toString(StandardCharsets.UTF_8);
        assertThat(output).startsWith("Supported Languages:");
        assertThat(output).contains(
            "  • C# (ID: csharp)",
            "  • Java (ID: java)",
            "  • JavaScript (ID: javascript)",
            "  • Kotlin (ID: kotlin)",
            "  • Python (ID: python)",
            "  • Ruby (ID: ruby)",
            "  • TypeScript (ID: typescript)",
            "    File Extension: .kt");
        assertThat(output.indexOf("(ID: csharp)")).isLessThan(output.indexOf("(ID: typescript)"));
    }

    @Test
    void call_withLanguages_reportsPackageSupport() {
        new CommandLine(new ListCommand()).execute("languages");

        String output = out.toString(StandardCharsets.UTF_8);
        String javascript = output.substring(output.indexOf("(ID: javascript)"), output.indexOf("(ID: kotlin)"));
        assertThat(javascript).contains("Packages: no");
        assertThat(output.substring(output.indexOf("(ID: java)"))).contains("Packages: yes");
    }

    @Test
    void call_withRenderers_listsRenderers() {
        int exitCode = new CommandLine(new ListCommand()).execute("renderers");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("Available Renderers:", "  • console", "  • filesystem");
    }

    @Test
    void call_withUnknownType_fails() {
        int exitCode = new CommandLine(new ListCommand()).execute("widgets");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("✗ Unknown type: widgets");
    }
}
