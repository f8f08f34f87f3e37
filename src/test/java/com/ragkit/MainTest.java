package com.ragkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configPath;

    @BeforeEach
    void writeConfig() throws Exception {
        configPath = tempDir.resolve("ragkit.yml");
        Files.writeString(configPath, """
                store:
                  provider: local
                  allowReset: false
                  local:
                    directory: %s
                embedding:
                  dimension: 64
                ingest:
                  ledgerPath: %s
                  chunkSize: 200
                """.formatted(
                tempDir.resolve("db").toString().replace('\\', '/'),
                tempDir.resolve("ledger.json").toString().replace('\\', '/')));
    }

    private String run(int expectedExit, String... args) {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new Main());
        commandLine.setOut(new PrintWriter(out));
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configPath.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        assertEquals(expectedExit, commandLine.execute(withConfig));
        return out.toString();
    }

    @Test
    void shouldParseOptions() {
        Main main = new Main();
        new CommandLine(main).parseArgs("--mode", "query", "--query", "capital", "--top-k", "2", "--citations",
                "--where", "lang=fr", "--where", "doc_id=abc");

        assertEquals(Main.Mode.query, main.mode);
        assertEquals(Integer.valueOf(2), main.topK);
        assertTrue(main.citations);
        assertEquals(Map.of("lang", "fr", "doc_id", "abc"), main.where);
    }

    @Test
    void shouldAddQueryAndCountThroughCli() throws Exception {
        Path file = tempDir.resolve("germany.txt");
        Files.writeString(file, "Berlin is the capital of Germany.");

        String added = run(0, "--mode", "add", "--text", "Paris is the capital of France.", "--file", file.toString());
        assertTrue(added.contains("ADDED"));

        assertEquals("2", run(0, "--mode", "count").strip());

        String answer = run(0, "--mode", "query", "--query", "What is the capital of France?", "--top-k", "1", "--citations");
        assertTrue(answer.startsWith("[1] Paris is the capital of France."));
        assertTrue(answer.contains("source=Paris is the capital of France."));

        String again = run(0, "--mode", "add", "--text", "Paris is the capital of France.");
        assertTrue(again.contains("UNCHANGED"));

        String sources = run(0, "--mode", "sources");
        assertEquals(2, sources.strip().split("\\R").length);
    }

    @Test
    void shouldDeleteBySourceAndFilter() throws Exception {
        run(0, "--mode", "add", "--text", "one source", "--text", "another source");

        run(0, "--mode", "delete", "--text", "one source");
        assertEquals("1", run(0, "--mode", "count").strip());

        run(0, "--mode", "delete", "--where", "data_type=text");
        assertEquals("0", run(0, "--mode", "count").strip());
    }

    @Test
    void shouldBindIntegerWhereValuesAsNumbers() {
        Main main = new Main();
        new CommandLine(main).parseArgs("--where", "chunk_index=0", "--where", "lang=fr", "--where", "zip=01234");

        assertEquals(Map.of("chunk_index", 0L, "lang", "fr", "zip", "01234"), main.whereFilter());
    }

    @Test
    void shouldDeleteByNumericChunkIndex() {
        run(0, "--mode", "add", "--text", "first text", "--text", "second text");

        run(0, "--mode", "delete", "--where", "chunk_index=0");

        assertEquals("0", run(0, "--mode", "count").strip());
    }

    @Test
    void shouldRefuseResetWhenDisabled() {
        run(0, "--mode", "add", "--text", "keep me");

        run(1, "--mode", "reset");

        assertEquals("1", run(0, "--mode", "count").strip());
    }

    @Test
    void shouldRequireInputsForMode() {
        run(2, "--mode", "query");
        run(2, "--mode", "add");
        run(2, "--mode", "delete");
    }
}
