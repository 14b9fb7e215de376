package com.crossbot.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DotEnvTest {

    @Test
    void parsesKeyValueLines(@TempDir Path dir) throws Exception {
        Path f = dir.resolve(".env");
        Files.writeString(f, String.join("\n",
                "# comment",
                "",
                "A=1",
                "export B = two ",
                "C='three'",
                "D=\"x=y\"",
                "not a pair",
                "=orphan"));

        Map<String, String> env = DotEnv.loadIfExists(f);

        assertThat(env).containsExactly(
                Map.entry("A", "1"),
                Map.entry("B", "two"),
                Map.entry("C", "three"),
                Map.entry("D", "x=y"));
    }

    @Test
    void missingFileIsEmpty(@TempDir Path dir) throws Exception {
        assertThat(DotEnv.loadIfExists(dir.resolve("nope"))).isEmpty();
        assertThat(DotEnv.loadIfExists(null)).isEmpty();
    }

    @Test
    void mismatchedQuotesAreKept() {
        assertThat(DotEnv.unquote("\"abc'")).isEqualTo("\"abc'");
        assertThat(DotEnv.unquote("\"")).isEqualTo("\"");
    }
}
