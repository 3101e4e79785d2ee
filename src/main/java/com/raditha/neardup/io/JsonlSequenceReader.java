package com.raditha.neardup.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.neardup.model.MalformedInputException;
import com.raditha.neardup.model.SequenceRecord;
import com.raditha.neardup.model.TokenSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Reads token sequences from line-delimited JSON.
 * <p>
 * Every non-blank line must be an object with a {@code token_ids} array of non-negative
 * integers; other fields are ignored. The identifier is taken from the {@code id} field
 * when present, otherwise it is {@code <file name>:<line number>}. Files ending in
 * {@code .gz} are decompressed on the fly.
 * <p>
 * Malformed lines are reported as {@link SkippedInput} and do not stop the read.
 */
public class JsonlSequenceReader {

    private static final Logger logger = LoggerFactory.getLogger(JsonlSequenceReader.class);

    public static final String TOKEN_FIELD = "token_ids";
    public static final String ID_FIELD = "id";

    private final ObjectMapper mapper;

    public JsonlSequenceReader() {
        this(new ObjectMapper());
    }

    public JsonlSequenceReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Read every record of a JSONL (or JSONL.gz) file.
     *
     * @throws ResourceException if the file cannot be opened, read or decompressed
     */
    public LoadedSequences read(Path file) {
        String fileName = file.getFileName().toString();
        try (InputStream raw = Files.newInputStream(file);
                InputStream in = fileName.endsWith(".gz") ? new GZIPInputStream(raw) : raw;
                Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            LoadedSequences loaded = read(reader, file.toString(), fileName);
            logger.debug("Read {} sequences from {} ({} skipped)",
                    loaded.size(), file, loaded.skipped().size());
            return loaded;
        } catch (IOException e) {
            throw new ResourceException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Read records from an open reader.
     *
     * @param source   Name recorded in the result
     * @param idPrefix Prefix of generated identifiers
     */
    public LoadedSequences read(Reader reader, String source, String idPrefix) throws IOException {
        List<SequenceRecord> records = new ArrayList<>();
        List<SkippedInput> skipped = new ArrayList<>();

        BufferedReader lines = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String fallbackId = idPrefix + ":" + lineNumber;
            try {
                records.add(parseLine(line, fallbackId));
            } catch (MalformedInputException e) {
                logger.warn("Skipping {}: {}", fallbackId, e.getMessage());
                skipped.add(new SkippedInput(fallbackId, e.getMessage()));
            }
        }
        return new LoadedSequences(source, records, skipped);
    }

    /**
     * Parse one JSON object into a record.
     *
     * @throws MalformedInputException if the line is not valid JSON or has no usable
     *                                 {@code token_ids}
     */
    public SequenceRecord parseLine(String line, String fallbackId) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedInputException("expected a JSON object");
        }

        JsonNode tokens = node.get(TOKEN_FIELD);
        if (tokens == null || !tokens.isArray()) {
            throw new MalformedInputException("'" + TOKEN_FIELD + "' must be an array");
        }

        int[] ids = new int[tokens.size()];
        for (int k = 0; k < ids.length; k++) {
            JsonNode element = tokens.get(k);
            if (!element.isIntegralNumber() || !element.canConvertToInt()) {
                throw new MalformedInputException(
                        "'" + TOKEN_FIELD + "' element " + k + " is not an integer token id: " + element);
            }
            ids[k] = element.intValue();
        }

        JsonNode idNode = node.get(ID_FIELD);
        String id = idNode != null && idNode.isValueNode() && !idNode.asText().isBlank()
                ? idNode.asText()
                : fallbackId;
        return new SequenceRecord(id, TokenSequence.of(ids));
    }
}
