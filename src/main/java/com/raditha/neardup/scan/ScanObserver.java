package com.raditha.neardup.scan;

/**
 * Receives progress callbacks from {@link CorpusScanner}.
 * <p>
 * {@link #onDocumentScanned} is called from worker threads; implementations must be
 * thread-safe. All methods default to no-ops.
 */
public interface ScanObserver {

    ScanObserver NONE = new ScanObserver() {
    };

    /**
     * The query index for {@code queryId} has been built.
     */
    default void onQueryIndexed(String queryId) {
    }

    /**
     * One (query, document) pair has been decided.
     */
    default void onDocumentScanned(String queryId, String documentId, boolean matched) {
    }

    /**
     * Every document of one batch has been scanned against every query.
     *
     * @param source     Name of the batch, usually the corpus file
     * @param batchIndex Zero-based position of the batch in the corpus
     */
    default void onBatchComplete(String source, int batchIndex) {
    }

    /**
     * Final count for a query after the whole corpus has been scanned.
     */
    default void onCorpusComplete(String queryId, long count) {
    }
}
