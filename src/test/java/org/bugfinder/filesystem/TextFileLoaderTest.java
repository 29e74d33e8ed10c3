package org.bugfinder.filesystem;

import org.bugfinder.search.InvalidLandscapeException;
import org.bugfinder.search.InvalidPatternException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextFileLoaderTest {

    @TempDir
    Path root;

    private PatternFinderProperties properties;
    private SecurePathResolver resolver;
    private TextFileLoader loader;

    @BeforeEach
    void setUp() {
        properties = new PatternFinderProperties();
        properties.setRoots(List.of(root.toString()));
        resolver = new SecurePathResolver(properties);
        loader = new TextFileLoader(properties);
    }

    @Test
    void loadPatternLines_stripsTrailingBlanksAndKeepsIndent() throws IOException {
        Files.writeString(root.resolve("bug.txt"), "| |  \r\n###O \r\n| |\r\n", StandardCharsets.UTF_8);

        List<String> lines = loader.loadPatternLines(resolver.resolve(null, "bug.txt"));

        assertThat(lines).containsExactly("| |", "###O", "| |");
    }

    @Test
    void loadLandscapeLines_keepsLinesVerbatimAndDropsBom() throws IOException {
        Files.writeString(root.resolve("landscape.txt"), "\uFEFF ab \n\ncd", StandardCharsets.UTF_8);

        List<String> lines = loader.loadLandscapeLines(resolver.resolve(null, "landscape.txt"));

        assertThat(lines).containsExactly(" ab ", "", "cd");
    }

    @Test
    void missingFiles_reportedAsDomainErrors() {
        assertThatThrownBy(() -> loader.loadPatternLines(resolver.resolve(null, "none.txt")))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("none.txt");
        assertThatThrownBy(() -> loader.loadLandscapeLines(resolver.resolve(null, "none.txt")))
                .isInstanceOf(InvalidLandscapeException.class);
    }

    @Test
    void directoryIsNotReadable() throws IOException {
        Files.createDirectories(root.resolve("dir"));

        assertThatThrownBy(() -> loader.loadLandscapeLines(resolver.resolve(null, "dir")))
                .isInstanceOf(InvalidLandscapeException.class)
                .hasMessageContaining("不是普通文件");
    }

    @Test
    void oversizedOrMalformedInputIsRejected() throws IOException {
        properties.setLandscapeMaxBytes(DataSize.ofBytes(4));
        Files.writeString(root.resolve("big.txt"), "12345", StandardCharsets.UTF_8);
        Files.write(root.resolve("bad.txt"), new byte[]{'a', (byte) 0xC3, (byte) 0x28});

        assertThatThrownBy(() -> loader.loadLandscapeLines(resolver.resolve(null, "big.txt")))
                .isInstanceOf(InvalidLandscapeException.class)
                .hasMessageContaining("过大");
        assertThatThrownBy(() -> loader.loadPatternLines(resolver.resolve(null, "bad.txt")))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("UTF-8");
    }

    @Test
    void loadPatternLines_enforcesLineLimit() throws IOException {
        properties.setPatternMaxLines(2);
        Files.writeString(root.resolve("tall.txt"), "a\nb\nc\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> loader.loadPatternLines(resolver.resolve(null, "tall.txt")))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("行数过多");
    }
}
