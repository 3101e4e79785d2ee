package com.raditha.neardup.io;

import com.raditha.neardup.model.MalformedInputException;
import com.raditha.neardup.model.TokenSequence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class JsonlSequenceReaderTest {

    @TempDir
    Path tempDir;

    private JsonlSequenceReader reader;

    @BeforeEach
    void setUp() {
        reader = new JsonlSequenceReader();
    }

    @Test
    void testReadsTokenIdsAndGeneratesIds() throws IOException {
        Path file = tempDir.resolve("query.jsonl");
        Files.writeString(file, """
                {"token_ids": [1, 2, 3], "text": "ignored"}

                {"token_ids": [4, 5], "id": "second"}
                """);

        LoadedSequences loaded = reader.read(file);

        assertEquals(2, loaded.size());
        assertEquals("query.jsonl:1", loaded.records().get(0).id());
        assertEquals(TokenSequence.of(1, 2, 3), loaded.records().get(0).tokens());
        assertEquals("second", loaded.records().get(1).id());
        assertTrue(loaded.skipped().isEmpty());
        assertEquals(file.toString(), loaded.source());
    }

    @Test
    void testMalformedLinesAreSkipped() throws IOException {
        Path file = tempDir.resolve("mixed.jsonl");
        Files.writeString(file, String.join("\n",
                "{\"token_ids\": [1, 2]}",
                "not json",
                "{\"token_ids\": \"1 2 3\"}",
                "{\"token_ids\": [1, -2]}",
                "{\"token_ids\": [1, 2.5]}",
                "{\"other\": [1]}",
                "[1, 2, 3]",
                "{\"token_ids\": []}"));

        LoadedSequences loaded = reader.read(file);

        assertEquals(2, loaded.size());
        assertEquals(6, loaded.skipped().size());
        assertEquals("mixed.jsonl:2", loaded.skipped().get(0).id());
        assertEquals("mixed.jsonl:4", loaded.skipped().get(2).id());
        assertTrue(loaded.records().get(1).tokens().isEmpty());
    }

    @Test
    void testReadsGzip() throws IOException {
        Path file = tempDir.resolve("train-00001.jsonl.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write("{\"token_ids\": [7, 8, 9]}\n{\"token_ids\": [10]}\n".getBytes(StandardCharsets.UTF_8));
        }

        LoadedSequences loaded = reader.read(file);

        assertEquals(2, loaded.size());
        assertEquals(TokenSequence.of(7, 8, 9), loaded.records().get(0).tokens());
        assertEquals("train-00001.jsonl.gz:2", loaded.records().get(1).id());
    }

    @Test
    void testCorruptGzipIsResourceError() throws IOException {
        Path file = tempDir.resolve("broken.jsonl.gz");
        Files.writeString(file, "definitely not gzip");

        assertThrows(ResourceException.class, () -> reader.read(file));
    }

    @Test
    void testMissingFileIsResourceError() {
        assertThrows(ResourceException.class, () -> reader.read(tempDir.resolve("missing.jsonl")));
    }

    @Test
    void testParseLine() {
        assertEquals(TokenSequence.of(3, 4), reader.parseLine("{\"token_ids\":[3,4]}", "x:1").tokens());
        assertEquals("42", reader.parseLine("{\"id\": 42, \"token_ids\":[3]}", "x:1").id());
        assertThrows(MalformedInputException.class, () -> reader.parseLine("{\"token_ids\": null}", "x:1"));
    }
}
