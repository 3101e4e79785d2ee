package com.raditha.neardup.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes scanner callbacks to SLF4J. Per-document events are logged at TRACE.
 */
public class LoggingScanObserver implements ScanObserver {

    private static final Logger logger = LoggerFactory.getLogger(LoggingScanObserver.class);

    @Override
    public void onQueryIndexed(String queryId) {
        logger.debug("Indexed query {}", queryId);
    }

    @Override
    public void onDocumentScanned(String queryId, String documentId, boolean matched) {
        if (logger.isTraceEnabled()) {
            logger.trace("query {} vs document {}: {}", queryId, documentId, matched ? "match" : "no match");
        }
    }

    @Override
    public void onBatchComplete(String source, int batchIndex) {
        logger.info("Batch {} ({}) finished", batchIndex, source);
    }

    @Override
    public void onCorpusComplete(String queryId, long count) {
        logger.info("Query {}: {}", queryId, count);
    }
}
