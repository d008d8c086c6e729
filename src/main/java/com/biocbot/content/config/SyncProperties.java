package com.biocbot.content.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@ConfigurationProperties(prefix = "sync")
public record SyncProperties(@DefaultValue Reconcile reconcile,
                             @DefaultValue Indexing indexing,
                             @DefaultValue Upload upload) {

    /**
     * @param batchSize           ids per repository existence query
     * @param lookupFailurePolicy what a failed existence query means for the references it covered
     */
    public record Reconcile(@DefaultValue("500") int batchSize,
                            @DefaultValue("DANGLING") LookupFailurePolicy lookupFailurePolicy) {}

    public record Indexing(@DefaultValue("true") boolean enabled,
                           @DefaultValue("1000") int chunkSize,
                           @DefaultValue("200") int chunkOverlap,
                           @DefaultValue("2") int poolSize,
                           @DefaultValue("100") int queueCapacity) {}

    public record Upload(@DefaultValue("52428800") long maxSizeBytes,
                         @DefaultValue({"application/pdf", "text/plain", "text/markdown"}) List<String> allowedMimeTypes) {}

    public enum LookupFailurePolicy {
        /** Failed lookups count as dangling and are removed. */
        DANGLING,
        /** Failed lookups abort the sweep before any write. */
        ABORT
    }
}
