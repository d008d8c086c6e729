package com.biocbot.content.repository;

import com.biocbot.content.domain.DomainModels.ContentKind;
import com.biocbot.content.domain.DomainModels.Document;
import com.biocbot.content.domain.DomainModels.DocumentMetadata;
import com.biocbot.content.domain.DomainModels.DocumentStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.*;

import static com.biocbot.content.repository.ColumnCodec.instant;
import static com.biocbot.content.repository.ColumnCodec.toDb;

@Repository
public class DocumentJdbcRepository {
    private static final String SUMMARY_COLUMNS =
            "document_id, course_id, unit_name, actor_id, document_type, content_kind, display_name, file_name, " +
            "text_content, mime_type, size_bytes, status, metadata, created_at, last_modified_at";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final ColumnCodec codec;

    public DocumentJdbcRepository(JdbcTemplate jdbcTemplate,
                                  NamedParameterJdbcTemplate namedJdbcTemplate,
                                  ColumnCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
        this.codec = codec;
    }

    public void insert(Document d) {
        jdbcTemplate.update(
                "INSERT INTO documents(document_id, course_id, unit_name, actor_id, document_type, content_kind, display_name, file_name, " +
                        "file_data, text_content, mime_type, size_bytes, status, metadata, created_at, last_modified_at) " +
                        "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                d.documentId(), d.courseId(), d.unitName(), d.actorId(), d.documentType(), d.contentKind().name(),
                d.displayName(), d.fileName(), d.fileData(), d.textContent(), d.mimeType(), d.sizeBytes(),
                d.status().name(), codec.toJson(d.metadata()), toDb(d.createdAt()), toDb(d.lastModifiedAt()));
    }

    public Optional<Document> findById(String documentId) {
        return jdbcTemplate.query(
                "SELECT " + SUMMARY_COLUMNS + ", file_data FROM documents WHERE document_id = ?",
                mapper(true), documentId).stream().findFirst();
    }

    /**
     * Unit listing, newest first. Binary payloads are never loaded.
     */
    public List<Document> findByUnit(String courseId, String unitName) {
        return jdbcTemplate.query(
                "SELECT " + SUMMARY_COLUMNS + " FROM documents WHERE course_id = ? AND unit_name = ? ORDER BY created_at DESC, seq DESC",
                mapper(false), courseId, unitName);
    }

    public int updateContent(String documentId, String text, Instant now) {
        return jdbcTemplate.update(
                "UPDATE documents SET text_content = ?, status = ?, last_modified_at = ? WHERE document_id = ?",
                text, DocumentStatus.PARSED.name(), toDb(now), documentId);
    }

    public int updateStatus(String documentId, DocumentStatus status, Instant now) {
        return jdbcTemplate.update(
                "UPDATE documents SET status = ?, last_modified_at = ? WHERE document_id = ?",
                status.name(), toDb(now), documentId);
    }

    public int delete(String documentId) {
        return jdbcTemplate.update("DELETE FROM documents WHERE document_id = ?", documentId);
    }

    public Set<String> findExistingIds(Collection<String> documentIds) {
        if (documentIds.isEmpty()) return Set.of();
        return new HashSet<>(namedJdbcTemplate.queryForList(
                "SELECT document_id FROM documents WHERE document_id IN (:ids)",
                Map.of("ids", documentIds), String.class));
    }

    public List<StatusRow> statusBreakdown(String courseId) {
        return jdbcTemplate.query(
                "SELECT status, COUNT(*), COALESCE(SUM(size_bytes), 0) FROM documents WHERE course_id = ? GROUP BY status",
                (rs, n) -> new StatusRow(DocumentStatus.valueOf(rs.getString(1)), rs.getLong(2), rs.getLong(3)),
                courseId);
    }

    private RowMapper<Document> mapper(boolean withFileData) {
        return (rs, n) -> new Document(
                rs.getString("document_id"),
                rs.getString("course_id"),
                rs.getString("unit_name"),
                rs.getString("actor_id"),
                rs.getString("document_type"),
                ContentKind.valueOf(rs.getString("content_kind")),
                rs.getString("display_name"),
                rs.getString("file_name"),
                withFileData ? rs.getBytes("file_data") : null,
                rs.getString("text_content"),
                rs.getString("mime_type"),
                rs.getLong("size_bytes"),
                DocumentStatus.valueOf(rs.getString("status")),
                Optional.ofNullable(codec.fromJson(rs.getString("metadata"), DocumentMetadata.class)).orElse(DocumentMetadata.empty()),
                instant(rs, "created_at"),
                instant(rs, "last_modified_at"));
    }

    public record StatusRow(DocumentStatus status, long count, long totalSize) {}
}
