package org.zeno.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the native primitives called by generated programs.
 */
public class ZenoRuntimeTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    @Test
    @Tag("unit")
    void printlnJoinsArgumentsWithSpaces() {
        ZenoRuntime.println("total:", 3L, 2.0, 0.5, true);
        ZenoRuntime.print("no newline");

        assertThat(output()).isEqualTo("total: 3 2 0.5 true" + System.lineSeparator() + "no newline");
    }

    @Test
    @Tag("unit")
    void printsJsonValuesAsJson() {
        ZenoRuntime.println(JsonCodec.parse("{\"a\": [1, 2]}"));

        assertThat(output()).isEqualTo("{\"a\":[1,2]}" + System.lineSeparator());
    }

    @Test
    @Tag("unit")
    void truthinessFollowsValueKind() {
        assertThat(ZenoRuntime.truthy(JsonCodec.parse("0"))).isFalse();
        assertThat(ZenoRuntime.truthy(JsonCodec.parse("\"\""))).isFalse();
        assertThat(ZenoRuntime.truthy(JsonCodec.parse("[]"))).isFalse();
        assertThat(ZenoRuntime.truthy(JsonCodec.parse("null"))).isFalse();
        assertThat(ZenoRuntime.truthy(JsonCodec.parse("{\"k\": 1}"))).isTrue();
        assertThat(ZenoRuntime.truthy(7L)).isTrue();
    }

    @Test
    @Tag("unit")
    void panicRaisesException() {
        assertThatThrownBy(() -> ZenoRuntime.panic("boom"))
                .isInstanceOf(ZenoPanicException.class)
                .hasMessage("boom");
    }

    @Test
    @Tag("integration")
    void writesReadsAndRemovesFiles() {
        String path = tempDir.resolve("data.txt").toString();

        ZenoRuntime.writeFile(path, "héllo");

        assertThat(ZenoRuntime.readFile(path)).isEqualTo("héllo");
        ZenoRuntime.remove(path);
        assertThat(Files.exists(Path.of(path))).isFalse();
        assertThatThrownBy(() -> ZenoRuntime.readFile(path))
                .isInstanceOf(ZenoPanicException.class)
                .hasMessageContaining("failed to read file");
    }

    @Test
    @Tag("unit")
    void stringifiesArbitraryValues() {
        assertThat(ZenoRuntime.stringifyJson("text")).isEqualTo("\"text\"");
        assertThat(ZenoRuntime.stringifyJson(JsonCodec.parse("[1.5, null]"))).isEqualTo("[1.5,null]");
        assertThat(ZenoRuntime.getCurrentDirectory()).isNotBlank();
    }
}
