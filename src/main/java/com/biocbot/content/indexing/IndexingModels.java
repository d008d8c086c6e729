package com.biocbot.content.indexing;

public class IndexingModels {
    public record IndexRequest(String courseId, String unitName, String documentId, String text, String fileName) {}

    public record IndexResult(boolean success, int chunksStored, String error) {
        public static IndexResult stored(int chunks) {
            return new IndexResult(true, chunks, null);
        }

        public static IndexResult failed(String error) {
            return new IndexResult(false, 0, error);
        }
    }
}
