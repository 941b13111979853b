package org.zeno.compiler.config;

import com.typesafe.config.Config;
import org.zeno.compiler.api.CompilerOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests configuration layering and the mapping to {@link CompilerOptions}.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void referenceConfigMatchesDefaults() {
        Config config = ConfigLoader.loadDefaults();

        assertThat(CompilerOptions.fromConfig(config)).isEqualTo(CompilerOptions.defaults());
    }

    @Test
    @Tag("unit")
    void userFileOverridesReference() throws IOException {
        Path file = tempDir.resolve("zeno.conf");
        Files.writeString(file, String.join("\n",
                "zeno.compiler.class-name = App",
                "zeno.compiler.emit-secondary-diagnostics = true",
                "zeno.lint.rules = [unused-import]"));

        CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.resolve(file.toFile()));

        assertThat(options.className()).isEqualTo("App");
        assertThat(options.emitSecondaryDiagnostics()).isTrue();
        assertThat(options.lintRules()).containsExactly("unused-import");
        assertThat(options.packageName()).isEmpty();
        assertThat(options.sourceExtension()).isEqualTo(".zeno");
    }

    @Test
    @Tag("unit")
    void missingExplicitFileIsRejected() {
        File missing = tempDir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.conf");
    }
}
