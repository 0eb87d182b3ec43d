package nl.nfi.cfglab.common.ini;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IniConfigTest {

    @TempDir
    Path tempWorkDir;

    @Test
    void readsSectionsKeysAndLists() throws IOException {
        final IniConfig config = IniConfig.loadFrom(write("""
            ; a comment
            [GRAMMAR]
            productions = expressions.txt
            context_free = false
            terminals = ["+", "*", "i"]

            # another comment
            [OTHER]
            key=value = with equals
            """));

        assertThat(config.hasSection("GRAMMAR")).isTrue();
        assertThat(config.getString("GRAMMAR", "productions")).isEqualTo("expressions.txt");
        assertThat(config.getBoolean("GRAMMAR", "context_free", true)).isFalse();
        assertThat(config.getBoolean("GRAMMAR", "missing", true)).isTrue();
        assertThat(config.getStringList("GRAMMAR", "terminals")).containsExactly("+", "*", "i");
        assertThat(config.getString("OTHER", "key")).isEqualTo("value = with equals");
        assertThat(config.getString("OTHER", "missing", "default")).isEqualTo("default");

        final IniSection section = config.getSection("GRAMMAR");
        assertThat(section.hasKey("terminals")).isTrue();
        assertThat(section.getString("productions")).isEqualTo("expressions.txt");
    }

    @Test
    void rejectsMissingSectionsAndKeys() throws IOException {
        final IniConfig config = IniConfig.loadFrom(write("[GRAMMAR]\nproductions = g.txt\n"));

        assertThatThrownBy(() -> config.getSection("MISSING"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("MISSING");
        assertThatThrownBy(() -> config.getString("GRAMMAR", "inputs"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("GRAMMAR -> inputs");
    }

    @Test
    void rejectsListThatIsNoJsonArray() throws IOException {
        final IniConfig config = IniConfig.loadFrom(write("[GRAMMAR]\nterminals = a, b\n"));

        assertThatThrownBy(() -> config.getStringList("GRAMMAR", "terminals"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a JSON array");
    }

    @Test
    void rejectsEntryOutsideOfSection() throws IOException {
        final Path path = write("productions = g.txt\n");

        assertThatThrownBy(() -> IniConfig.loadFrom(path))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("outside of a section");
    }

    private Path write(final String content) throws IOException {
        final Path path = tempWorkDir.resolve("config.ini");
        Files.writeString(path, content, UTF_8);
        return path;
    }
}
