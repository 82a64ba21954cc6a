package com.treeql;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TreeQLTest extends TreeQLLoggingConfig {

    private static final String DOCUMENT = "{\"name\": \"menu\", \"items\": [{\"id\": 1, \"price\": 5}, {\"id\": 2, \"price\": 12}]}";

    private ByteArrayOutputStream output;

    private int run(String input, String... args) {
        output = new ByteArrayOutputStream();
        TreeQL app = new TreeQL(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
        return TreeQL.commandLine(app).execute(args);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    public void testSelect() {
        assertEquals(0, run(DOCUMENT, "select", "{\"items\": {\"*\": {\"?\": {\"price\": {\">\": 10}}, \"id\": true}}}", "-c"));
        assertEquals("{\"items\":[{\"id\":2}]}", printed());
    }

    @Test
    public void testSelectNothingPrintsNull() {
        assertEquals(0, run(DOCUMENT, "select", "false"));
        assertEquals("null", printed());
    }

    @Test
    public void testUpdatePrintsDocument() {
        assertEquals(0, run(DOCUMENT, "update", "{\"items\": {\"-1\": {\"price\": 10}}}", "-c", "-S"));
        assertEquals("{\"items\":[{\"id\":1,\"price\":5},{\"id\":2,\"price\":10}],\"name\":\"menu\"}", printed());
    }

    @Test
    public void testUpdatePrintsChanges() {
        assertEquals(0, run(DOCUMENT, "update", "{\"name\": \"lunch\"}", "--changes", "-c"));
        assertEquals("{\"name\":\"lunch\",\"#\":{\"name\":{\"original\":\"menu\"}}}", printed());

        assertEquals(0, run(DOCUMENT, "update", "{\"name\": \"menu\"}", "--changes", "-c"));
        assertEquals("{}", printed());
    }

    @Test
    public void testProjectRawOutput() {
        assertEquals(0, run(DOCUMENT, "project", "name", "-r"));
        assertEquals("menu", printed());

        assertEquals(0, run(DOCUMENT, "project", "items.id", "-c"));
        assertEquals("[1,2]", printed());
    }

    @Test
    public void testMatchIgnoresModeCase() {
        assertEquals(0, run(DOCUMENT, "MATCH", "{\"items\": {\"|\": {\"price\": {\">=\": 12}}}}"));
        assertEquals("true", printed());

        assertEquals(0, run(DOCUMENT, "Match", "{\"name\": {\"~\": \"^x\"}}"));
        assertEquals("false", printed());
    }

    @Test
    public void testPrettyByDefault() {
        assertEquals(0, run("{\"a\": [1]}", "select", "true"));
        assertEquals("{\n  \"a\": [\n    1\n  ]\n}", printed());
    }

    @Test
    public void testErrorsExitWithOne() {
        assertEquals(1, run(DOCUMENT, "update", "{\"name\": {\"first\": \"x\"}}"));
        assertEquals(1, run(DOCUMENT, "select", "{\"name\": 1}"));
        assertEquals(1, run("not json", "select", "true"));
        assertEquals("", printed());
    }

    @Test
    public void testReadsInputFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("input.json");
        Files.writeString(file, DOCUMENT);

        assertEquals(0, run("", "project", "items.{id}", file.toString(), "-c"));
        assertEquals("[{\"id\":1},{\"id\":2}]", printed());
    }
}
