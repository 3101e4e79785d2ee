package com.raditha.neardup.io;

import com.raditha.neardup.scan.DocumentSource;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads a corpus one JSONL file at a time.
 * <p>
 * A file that cannot be read is logged, reported as a skipped document and passed over.
 * If every file failed, the corpus is unusable and a {@link ResourceException} is raised.
 */
public class CorpusFileSource implements DocumentSource {

    private static final Logger logger = LoggerFactory.getLogger(CorpusFileSource.class);

    private final List<Path> files;
    private final JsonlSequenceReader reader;
    private int next;
    private int failedFiles;
    private long documentsRead;

    public CorpusFileSource(List<Path> files, JsonlSequenceReader reader) {
        this.files = List.copyOf(files);
        this.reader = reader;
    }

    public static CorpusFileSource of(Path searchDir, int startFileIdx, int endFileIdx) {
        return new CorpusFileSource(CorpusFiles.list(searchDir, startFileIdx, endFileIdx),
                new JsonlSequenceReader());
    }

    public List<Path> files() {
        return files;
    }

    public int failedFiles() {
        return failedFiles;
    }

    @Override
    public @Nullable LoadedSequences nextBatch() {
        if (next >= files.size()) {
            if (failedFiles > 0 && documentsRead == 0) {
                throw new ResourceException(String.format(
                        "No usable documents: all %d corpus files failed to load", failedFiles));
            }
            return null;
        }

        Path file = files.get(next++);
        try {
            LoadedSequences loaded = reader.read(file);
            documentsRead += loaded.size();
            return loaded;
        } catch (ResourceException e) {
            failedFiles++;
            logger.warn("Skipping corpus file {}: {}", file, e.getMessage());
            return new LoadedSequences(file.toString(), List.of(),
                    List.of(new SkippedInput(file.toString(), e.getMessage())));
        }
    }
}
