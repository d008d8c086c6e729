package com.biocbot.content.indexing;

import com.biocbot.content.indexing.IndexingModels.IndexRequest;
import com.biocbot.content.indexing.IndexingModels.IndexResult;

/**
 * Boundary to the text indexing service. Calls are made off the request thread
 * and their outcome never reaches the caller of a document operation.
 */
public interface IndexingClient {
    IndexResult index(IndexRequest request);

    void deindex(String documentId);
}
