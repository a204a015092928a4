package com.autodoc.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @Test
    void matches_recursivePrefixAlsoMatchesRootFiles() {
        assertThat(FileUtils.matches("**/*.py", "app.py")).isTrue();
        assertThat(FileUtils.matches("**/*.py", "pkg/sub/mod.py")).isTrue();
        assertThat(FileUtils.matches("**/*.py", "README.md")).isFalse();
    }

    @Test
    void matches_singleStarDoesNotCrossDirectories() {
        assertThat(FileUtils.matches("*.py", "app.py")).isTrue();
        assertThat(FileUtils.matches("*.py", "pkg/mod.py")).isFalse();
        assertThat(FileUtils.matches("src/**", "src/a/b.py")).isTrue();
    }

    @Test
    void matchesAny_withNoPatterns_isFalse() {
        assertThat(FileUtils.matchesAny(List.of(), "app.py")).isFalse();
        assertThat(FileUtils.matchesAny(List.of("tests/**", "*.py"), "app.py")).isTrue();
    }

    @Test
    void getExtension_isLowerCaseWithoutDot() {
        assertThat(FileUtils.getExtension("pkg/Tool.PYW")).isEqualTo("pyw");
        assertThat(FileUtils.getExtension("Makefile")).isEmpty();
        assertThat(FileUtils.getExtension(".gitignore")).isEmpty();
        assertThat(FileUtils.getExtension("my.dir/file")).isEmpty();
    }

    @Test
    void stripExtension_onlyTouchesLastSegment() {
        assertThat(FileUtils.stripExtension("pkg/mod.py")).isEqualTo("pkg/mod");
        assertThat(FileUtils.stripExtension("my.dir/file")).isEqualTo("my.dir/file");
        assertThat(FileUtils.stripExtension("pkg\\__init__.py")).isEqualTo("pkg/__init__");
    }

    @Test
    void fileName_returnsLastSegment() {
        assertThat(FileUtils.fileName("a/b/c.py")).isEqualTo("c.py");
        assertThat(FileUtils.fileName("c.py")).isEqualTo("c.py");
    }

    @Test
    void relativePath_usesForwardSlashes() {
        Path root = Path.of("project");

        assertThat(FileUtils.relativePath(root, root.resolve("pkg").resolve("mod.py"))).isEqualTo("pkg/mod.py");
    }
}
