package com.biocbot.content.indexing;

import com.biocbot.content.config.SyncProperties;
import com.biocbot.content.indexing.IndexingModels.IndexRequest;
import com.biocbot.content.indexing.IndexingModels.IndexResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget dispatch to the {@link IndexingClient}. Failures are logged and dropped;
 * nothing is retried.
 */
@Component
public class IndexingNotifier {
    private static final Logger log = LoggerFactory.getLogger(IndexingNotifier.class);

    private final IndexingClient client;
    private final TaskExecutor executor;
    private final boolean enabled;

    public IndexingNotifier(IndexingClient client,
                            @Qualifier("indexingExecutor") TaskExecutor executor,
                            SyncProperties properties) {
        this.client = client;
        this.executor = executor;
        this.enabled = properties.indexing().enabled();
    }

    /**
     * @return whether the notification was queued
     */
    public boolean documentIndexed(IndexRequest request) {
        if (!enabled || request.text() == null || request.text().isBlank()) return false;
        return dispatch("index " + request.documentId(), () -> {
            IndexResult result = client.index(request);
            if (result.success()) {
                log.info("Indexed document {}: {} chunks", request.documentId(), result.chunksStored());
            } else {
                log.warn("Indexing of document {} failed: {}", request.documentId(), result.error());
            }
        });
    }

    public boolean documentRemoved(String documentId) {
        if (!enabled) return false;
        return dispatch("deindex " + documentId, () -> client.deindex(documentId));
    }

    private boolean dispatch(String what, Runnable call) {
        try {
            executor.execute(() -> {
                try {
                    call.run();
                } catch (RuntimeException e) {
                    log.warn("Indexing call '{}' failed: {}", what, e.getMessage(), e);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Indexing queue full, dropped '{}'", what);
            return false;
        }
    }
}
