package com.raditha.neardup.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the files of a corpus directory.
 * <p>
 * Shard files are named like {@code train-00042.jsonl}: the file index is the text after
 * the first {@code -} up to the next {@code -} or {@code .}. A window
 * {@code [startFileIdx, endFileIdx]} keeps files whose index lies in
 * {@code [startFileIdx * 1000, endFileIdx * 1000]}.
 */
public class CorpusFiles {

    private static final Logger logger = LoggerFactory.getLogger(CorpusFiles.class);

    public static final long INDEX_SCALE = 1000L;

    private CorpusFiles() {
    }

    /**
     * All regular files below {@code root}, sorted by path.
     *
     * @throws ResourceException if the directory cannot be walked
     */
    public static List<Path> listRecursive(Path root) {
        if (!Files.isDirectory(root)) {
            throw new ResourceException("Not a directory: " + root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ResourceException("Cannot list " + root + ": " + e.getMessage(), e);
        }
    }

    /**
     * Files below {@code root} within the file index window.
     * A negative bound leaves that side open; with both negative every file is kept.
     */
    public static List<Path> list(Path root, int startFileIdx, int endFileIdx) {
        List<Path> all = listRecursive(root);
        if (startFileIdx < 0 && endFileIdx < 0) {
            return all;
        }
        long low = startFileIdx < 0 ? 0L : startFileIdx * INDEX_SCALE;
        long high = endFileIdx < 0 ? Long.MAX_VALUE : endFileIdx * INDEX_SCALE;

        List<Path> selected = all.stream()
                .filter(path -> inWindow(path, low, high))
                .collect(Collectors.toList());
        logger.info("Selected {} of {} corpus files (file index {}..{})",
                selected.size(), all.size(), low, high == Long.MAX_VALUE ? "max" : high);
        return selected;
    }

    /**
     * Parse the shard index out of a file name.
     *
     * @return the index, or empty when the name has no {@code -} or the index is not numeric
     */
    public static OptionalLong fileIndex(String fileName) {
        int dash = fileName.indexOf('-');
        if (dash < 0) {
            return OptionalLong.empty();
        }
        String rest = fileName.substring(dash + 1);
        int end = rest.length();
        int nextDash = rest.indexOf('-');
        if (nextDash >= 0) {
            end = nextDash;
        }
        int dot = rest.indexOf('.');
        if (dot >= 0 && dot < end) {
            end = dot;
        }
        String digits = rest.substring(0, end);
        try {
            return OptionalLong.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static boolean inWindow(Path path, long low, long high) {
        String fileName = path.getFileName().toString();
        if (fileName.indexOf('-') < 0) {
            return false;
        }
        OptionalLong index = fileIndex(fileName);
        if (index.isEmpty()) {
            logger.warn("Skipping {}: no numeric file index", path);
            return false;
        }
        return low <= index.getAsLong() && index.getAsLong() <= high;
    }
}
