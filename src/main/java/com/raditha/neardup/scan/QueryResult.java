package com.raditha.neardup.scan;

import java.util.List;

/**
 * Aggregated result of one query over the corpus.
 *
 * @param queryId             Query identifier
 * @param count               Matching documents, or matching spans in span mode
 * @param matchingDocumentIds Sorted identifiers of matching documents; empty unless collection is enabled
 * @param documentsScanned    Documents the query was run against
 */
public record QueryResult(String queryId, long count, List<String> matchingDocumentIds, long documentsScanned) {

    public QueryResult {
        matchingDocumentIds = List.copyOf(matchingDocumentIds);
    }

    public boolean found() {
        return count > 0;
    }
}
