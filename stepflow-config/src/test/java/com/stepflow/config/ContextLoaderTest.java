package com.stepflow.config;

import com.stepflow.core.Context;
import com.stepflow.core.Secret;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ContextLoaderTest {

    @TempDir
    Path dir;

    @Test
    void laterSourcesWinKeyByKey() throws Exception {
        Path json = Files.writeString(dir.resolve("base.json"),
            "{\"source\": {\"path\": \"/a.csv\", \"header\": true}, \"retries\": 1}");
        Path yaml = Files.writeString(dir.resolve("site.yaml"), """
            source:
              path: /b.csv
            target:
              path: /out
            """);
        Path toml = Files.writeString(dir.resolve("local.toml"), """
            retries = 3
            [target]
            format = "jsonl"
            """);

        Context ctx = ContextLoader.builder()
            .json(json)
            .yaml(yaml)
            .toml(toml)
            .overrides(Map.of("target.path", "/override"))
            .build()
            .load();

        assertEquals("/b.csv", ctx.getString("source.path"));
        assertTrue(ctx.getBoolean("source.header"));
        assertEquals(3, ctx.getInt("retries"));
        assertEquals("jsonl", ctx.getString("target.format"));
        assertEquals("/override", ctx.getString("target.path"));
    }

    @Test
    void formatIsChosenByExtension() throws Exception {
        Path toml = Files.writeString(dir.resolve("cfg.toml"), """
            names = ["a", "b"]
            [db]
            password = "hunter2"
            since = 2024-01-01
            """);

        Context ctx = ContextLoader.load(toml);

        assertEquals(List.of("a", "b"), ctx.getList("names"));
        assertEquals("hunter2", ctx.resolve("db.password", Secret.class).reveal());
        assertEquals("2024-01-01", ctx.getString("db.since"));
    }

    @Test
    void environmentVariablesBecomeNestedPaths() throws Exception {
        Map<String, String> env = Map.of(
            "ETL_SOURCE__PATH", "/env.csv",
            "ETL_LIMITS__MAX_ROWS", "10",
            "ETL___BROKEN", "x",
            "OTHER_SOURCE__PATH", "/ignored");

        Context ctx = ContextLoader.builder().environment("etl", env).build().load();

        assertEquals("/env.csv", ctx.getString("source.path"));
        assertEquals(10, ctx.getInt("limits.max_rows"));
        assertEquals(2, ctx.flatten().size());
    }

    @Test
    void systemPropertiesUnderThePrefixAreIncluded() throws Exception {
        System.setProperty("stepflowtest.target.path", "/sys");
        try {
            Context ctx = ContextLoader.builder().systemProperties("stepflowtest").build().load();
            assertEquals(Map.of("target.path", "/sys"), ctx.flatten());
        } finally {
            System.clearProperty("stepflowtest.target.path");
        }
    }

    @Test
    void classpathResourceIsLoaded() throws Exception {
        Context ctx = ContextLoader.builder().resource("stepflow-test.yaml").build().load();

        assertEquals("/data/in.csv", ctx.getString("source.path"));
        assertEquals(500L, ctx.getLong("limits.rows"));
    }

    @Test
    void missingResourceNamesTheSource() throws Exception {
        ContextLoader loader = ContextLoader.builder().resource("absent.yaml").build();

        ContextLoadException e = assertThrows(ContextLoadException.class, loader::load);
        assertEquals("classpath:absent.yaml", e.source());
    }

    @Test
    void malformedContentNamesTheFile() throws Exception {
        Path broken = Files.writeString(dir.resolve("broken.json"), "{\"a\": ");

        ContextLoadException e = assertThrows(ContextLoadException.class, () -> ContextLoader.load(broken));

        assertEquals(broken.toString(), e.source());
        assertTrue(e.getMessage().startsWith(broken.toString()), e.getMessage());
    }

    @Test
    void malformedTomlIsReported() throws Exception {
        Path broken = Files.writeString(dir.resolve("broken.toml"), "a = = 1");

        assertThrows(ContextLoadException.class, () -> ContextLoader.load(broken));
    }

    @Test
    void missingFileAndUnknownExtensionAreLoadErrors() {
        assertThrows(ContextLoadException.class, () -> ContextLoader.load(dir.resolve("nope.yaml")));
        assertThrows(ContextLoadException.class, () -> ContextLoader.load(dir.resolve("config.ini")));
    }

    @Test
    void invalidKeysAreLoadErrors() throws Exception {
        Path bad = Files.writeString(dir.resolve("bad.json"), "{\"a..b\": 1}");

        assertThrows(ContextLoadException.class, () -> ContextLoader.load(bad));
    }

    @Test
    void noSourcesGiveAnEmptyContext() throws Exception {
        assertTrue(ContextLoader.builder().build().load().isEmpty());
    }

    @Test
    void emptyAndCommentOnlyFilesGiveAnEmptyContext() throws Exception {
        Path comments = Files.writeString(dir.resolve("placeholder.yaml"), """
            # nothing configured for this environment yet
            """);
        Path empty = Files.writeString(dir.resolve("empty.json"), "");
        Path base = Files.writeString(dir.resolve("base.yaml"), "retries: 2\n");

        assertTrue(ContextLoader.load(comments).isEmpty());
        assertTrue(ContextLoader.load(empty).isEmpty());
        Context merged = ContextLoader.builder().file(base).file(comments).file(empty).build().load();
        assertEquals(2, merged.getInt("retries"));
    }

    @Test
    void nonMappingDocumentIsALoadError() throws Exception {
        Path list = Files.writeString(dir.resolve("list.yaml"), "- a\n- b\n");

        assertThrows(ContextLoadException.class, () -> ContextLoader.load(list));
    }
}
