package com.visprog.tools;

import com.visprog.common.IEnvGetter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BlueprintCheckAppTest {

    private static final IEnvGetter NO_ENV = name -> null;

    private static final String VALID = """
            {
              "nodes": [
                { "id": "s", "type": "Start" },
                { "id": "set", "type": "SetVariable", "properties": { "variableId": "x", "inputValue": 3, "inputValueIsOverride": true },
                  "inputs": [ { "id": "exec-in", "dataType": "execution" } ] },
                { "id": "e", "type": "End" }
              ],
              "edges": [
                { "sourceNode": "s", "targetNode": "set", "kind": "execution" },
                { "sourceNode": "set", "targetNode": "e", "kind": "execution" }
              ],
              "variables": [ { "id": "x", "name": "x", "dataType": "int32", "defaultValue": 0 } ]
            }
            """;

    private static final String INVALID = """
            { "nodes": [ { "id": "f", "type": "Function" }, { "id": "e", "type": "End" } ],
              "edges": [ { "sourceNode": "f", "targetNode": "e" } ],
              "variables": [ { "id": "x", "dataType": "int32", "defaultValue": 4 } ] }
            """;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private static Path write(Path dir, String name, String json) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, json);
        return file;
    }

    @Test
    void validGraph_exitsZeroAndPrintsReport(@TempDir Path dir) throws IOException {
        int code = BlueprintCheckApp.run(new String[]{write(dir, "ok.json", VALID).toString()}, out, err, NO_ENV);

        assertEquals(BlueprintCheckApp.EXIT_OK, code, output());
        assertTrue(output().contains("\"status\" : \"resolved\""), output());
        assertTrue(output().contains("\"sourceNodeId\" : \"set\""), output());
        assertTrue(output().startsWith("{"), output());
        assertEquals("", errors());
    }

    @Test
    void invalidGraph_exitsOne(@TempDir Path dir) throws IOException {
        int code = BlueprintCheckApp.run(new String[]{write(dir, "bad.json", INVALID).toString()}, out, err, NO_ENV);

        assertEquals(BlueprintCheckApp.EXIT_INVALID, code, output());
        assertTrue(output().contains("MISSING_ENTRY"), output());
        assertTrue(output().contains("\"status\" : \"unknown\""), output());
    }

    @Test
    void unreadableSnapshot_exitsTwo(@TempDir Path dir) throws IOException {
        int code = BlueprintCheckApp.run(new String[]{write(dir, "junk.json", "{ nope").toString()}, out, err, NO_ENV);

        assertEquals(BlueprintCheckApp.EXIT_UNREADABLE, code);
        assertTrue(errors().startsWith("junk.json: "), errors());
        assertEquals("", output());
    }

    @Test
    void missingArgument_printsUsage() {
        assertEquals(BlueprintCheckApp.EXIT_UNREADABLE, BlueprintCheckApp.run(new String[0], out, err, NO_ENV));
        assertTrue(errors().startsWith("Usage"), errors());
        assertEquals("", output());
    }

    @Test
    void environmentIsHonoured(@TempDir Path dir) throws IOException {
        IEnvGetter env = Map.of("BLUEPRINT_RESOLVE_ONLY_WHEN_VALID", "true")::get;

        BlueprintCheckApp.run(new String[]{write(dir, "bad.json", INVALID).toString()}, out, err, env);

        assertTrue(output().contains("\"variables\" : { }"), output());
    }
}
