package com.biocbot.content.indexing;

import com.biocbot.content.config.SyncProperties;
import com.biocbot.content.indexing.IndexingModels.IndexRequest;
import com.biocbot.content.indexing.IndexingModels.IndexResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process chunk index used when no external indexing service is wired in.
 * Splits text into overlapping windows, breaking on whitespace where possible.
 */
@Component
public class ChunkingIndexClient implements IndexingClient {
    private static final Logger log = LoggerFactory.getLogger(ChunkingIndexClient.class);

    private final int chunkSize;
    private final int overlap;
    private final Map<String, IndexedDocument> index = new ConcurrentHashMap<>();

    public ChunkingIndexClient(SyncProperties properties) {
        this.chunkSize = Math.max(1, properties.indexing().chunkSize());
        this.overlap = Math.max(0, Math.min(properties.indexing().chunkOverlap(), chunkSize - 1));
    }

    @Override
    public IndexResult index(IndexRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            return IndexResult.failed("No text to index");
        }
        List<String> chunks = chunk(request.text());
        index.put(request.documentId(), new IndexedDocument(request.courseId(), request.unitName(), request.fileName(), chunks));
        log.debug("Indexed {} ({} chunks)", request.documentId(), chunks.size());
        return IndexResult.stored(chunks.size());
    }

    @Override
    public void deindex(String documentId) {
        if (index.remove(documentId) != null) {
            log.debug("Removed index entries for {}", documentId);
        }
    }

    public int chunkCount(String documentId) {
        IndexedDocument doc = index.get(documentId);
        return doc == null ? 0 : doc.chunks().size();
    }

    List<String> chunk(String text) {
        String normalized = text.strip();
        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < normalized.length()) {
            int end = Math.min(normalized.length(), start + chunkSize);
            if (end < normalized.length()) {
                int space = normalized.lastIndexOf(' ', end);
                if (space > start + overlap) end = space;
            }
            chunks.add(normalized.substring(start, end).strip());
            if (end == normalized.length()) break;
            start = Math.max(start + 1, end - overlap);
        }
        return chunks;
    }

    private record IndexedDocument(String courseId, String unitName, String fileName, List<String> chunks) {}
}
