package com.biocbot.content.repository;

import com.biocbot.content.domain.DomainModels.*;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

import static com.biocbot.content.repository.ColumnCodec.instant;
import static com.biocbot.content.repository.ColumnCodec.toDb;

/**
 * Course aggregates stored as a course row plus one row per unit and per
 * embedded list element. Every mutation addresses a single unit, so writers
 * to sibling units never touch each other's rows.
 */
@Repository
public class CourseJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ColumnCodec codec;

    public CourseJdbcRepository(JdbcTemplate jdbcTemplate, ColumnCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    public boolean courseExists(String courseId) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM courses WHERE course_id = ?", Integer.class, courseId);
        return count != null && count > 0;
    }

    @Transactional
    public void insertCourse(String courseId, String courseName, String ownerId, List<UnitSeed> units, Instant now) {
        jdbcTemplate.update(
                "INSERT INTO courses(course_id, course_name, owner_id, created_at, updated_at, last_updated_by) VALUES (?,?,?,?,?,?)",
                courseId, courseName, ownerId, toDb(now), toDb(now), ownerId);
        mergeStaff(courseId, ownerId, StaffRole.INSTRUCTOR);
        for (int i = 0; i < units.size(); i++) {
            UnitSeed seed = units.get(i);
            jdbcTemplate.update(
                    "INSERT INTO course_units(course_id, unit_name, position, is_published, pass_threshold, created_at, updated_at, last_updated_by) VALUES (?,?,?,?,?,?,?,?)",
                    courseId, seed.name(), i, false, seed.passThreshold(), toDb(now), toDb(now), ownerId);
            insertObjectives(courseId, seed.name(), seed.learningObjectives());
        }
    }

    public void mergeStaff(String courseId, String memberId, StaffRole role) {
        jdbcTemplate.update(
                "MERGE INTO course_staff(course_id, member_id, role) KEY(course_id, member_id, role) VALUES (?,?,?)",
                courseId, memberId, role.name());
    }

    public int deleteStaff(String courseId, String memberId, StaffRole role) {
        return jdbcTemplate.update(
                "DELETE FROM course_staff WHERE course_id = ? AND member_id = ? AND role = ?",
                courseId, memberId, role.name());
    }

    /**
     * Appends a unit at the end of the course. Returns 0 when the course does not exist.
     *
     * @throws DuplicateKeyException when the course already has a unit with this name
     */
    @Transactional
    public int appendUnit(String courseId, UnitSeed seed, String actorId, Instant now) {
        if (!courseExists(courseId)) return 0;
        Integer position = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(position), -1) + 1 FROM course_units WHERE course_id = ?", Integer.class, courseId);
        jdbcTemplate.update(
                "INSERT INTO course_units(course_id, unit_name, position, is_published, pass_threshold, created_at, updated_at, last_updated_by) VALUES (?,?,?,?,?,?,?,?)",
                courseId, seed.name(), position, false, seed.passThreshold(), toDb(now), toDb(now), actorId);
        insertObjectives(courseId, seed.name(), seed.learningObjectives());
        touchCourse(courseId, actorId, now);
        return 1;
    }

    @Transactional
    public int deleteUnit(String courseId, String unitName, String actorId, Instant now) {
        jdbcTemplate.update("DELETE FROM unit_objectives WHERE course_id = ? AND unit_name = ?", courseId, unitName);
        jdbcTemplate.update("DELETE FROM unit_questions WHERE course_id = ? AND unit_name = ?", courseId, unitName);
        jdbcTemplate.update("DELETE FROM unit_document_refs WHERE course_id = ? AND unit_name = ?", courseId, unitName);
        int deleted = jdbcTemplate.update("DELETE FROM course_units WHERE course_id = ? AND unit_name = ?", courseId, unitName);
        if (deleted > 0) touchCourse(courseId, actorId, now);
        return deleted;
    }

    @Transactional
    public int updatePublished(String courseId, String unitName, boolean published, String actorId, Instant now) {
        int updated = jdbcTemplate.update(
                "UPDATE course_units SET is_published = ?, updated_at = ?, last_updated_by = ? WHERE course_id = ? AND unit_name = ?",
                published, toDb(now), actorId, courseId, unitName);
        if (updated > 0) touchCourse(courseId, actorId, now);
        return updated;
    }

    @Transactional
    public int updatePassThreshold(String courseId, String unitName, int threshold, String actorId, Instant now) {
        int updated = jdbcTemplate.update(
                "UPDATE course_units SET pass_threshold = ?, updated_at = ?, last_updated_by = ? WHERE course_id = ? AND unit_name = ?",
                threshold, toDb(now), actorId, courseId, unitName);
        if (updated > 0) touchCourse(courseId, actorId, now);
        return updated;
    }

    @Transactional
    public int replaceObjectives(String courseId, String unitName, List<String> objectives, String actorId, Instant now) {
        if (touchUnit(courseId, unitName, actorId, now) == 0) return 0;
        jdbcTemplate.update("DELETE FROM unit_objectives WHERE course_id = ? AND unit_name = ?", courseId, unitName);
        insertObjectives(courseId, unitName, objectives);
        return 1;
    }

    /**
     * Replaces the question with the same id in place, or appends it when the id is unknown.
     */
    @Transactional
    public WriteOutcome upsertQuestion(String courseId, String unitName, AssessmentQuestion q, String actorId, Instant now) {
        String payload = codec.toJson(new QuestionPayload(q.options(), q.correctAnswer(), q.explanation()));
        String update = "UPDATE unit_questions SET question_type = ?, prompt = ?, payload = ?, updated_at = ? " +
                "WHERE course_id = ? AND unit_name = ? AND question_id = ?";
        Object[] updateArgs = {q.questionType().name(), q.prompt(), payload, toDb(now), courseId, unitName, q.questionId()};

        WriteOutcome outcome;
        if (jdbcTemplate.update(update, updateArgs) > 0) {
            outcome = WriteOutcome.REPLACED;
        } else {
            try {
                if (unitExists(courseId, unitName)) {
                    jdbcTemplate.update(
                            "INSERT INTO unit_questions(course_id, unit_name, question_id, position, question_type, prompt, payload, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?)",
                            courseId, unitName, q.questionId(), nextPosition("unit_questions", courseId, unitName),
                            q.questionType().name(), q.prompt(), payload, toDb(now), toDb(now));
                    outcome = WriteOutcome.APPENDED;
                } else {
                    outcome = WriteOutcome.MISSING;
                }
            } catch (DuplicateKeyException raced) {
                jdbcTemplate.update(update, updateArgs);
                outcome = WriteOutcome.REPLACED;
            }
        }
        if (outcome != WriteOutcome.MISSING) touchUnit(courseId, unitName, actorId, now);
        return outcome;
    }

    @Transactional
    public int deleteQuestion(String courseId, String unitName, String questionId, String actorId, Instant now) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM unit_questions WHERE course_id = ? AND unit_name = ? AND question_id = ?",
                courseId, unitName, questionId);
        if (deleted > 0) touchUnit(courseId, unitName, actorId, now);
        return deleted;
    }

    @Transactional
    public WriteOutcome upsertReference(String courseId, String unitName, DocumentReference r, String actorId, Instant now) {
        String metadata = codec.toJson(r.metadata());
        String update = "UPDATE unit_document_refs SET display_name = ?, document_type = ?, mime_type = ?, size_bytes = ?, status = ?, metadata = ?, updated_at = ? " +
                "WHERE course_id = ? AND unit_name = ? AND document_id = ?";
        Object[] updateArgs = {r.displayName(), r.documentType(), r.mimeType(), r.sizeBytes(), r.status().name(), metadata, toDb(now),
                courseId, unitName, r.documentId()};

        WriteOutcome outcome;
        if (jdbcTemplate.update(update, updateArgs) > 0) {
            outcome = WriteOutcome.REPLACED;
        } else {
            try {
                if (unitExists(courseId, unitName)) {
                    jdbcTemplate.update(
                            "INSERT INTO unit_document_refs(course_id, unit_name, document_id, position, display_name, document_type, mime_type, size_bytes, status, metadata, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
                            courseId, unitName, r.documentId(), nextPosition("unit_document_refs", courseId, unitName),
                            r.displayName(), r.documentType(), r.mimeType(), r.sizeBytes(), r.status().name(), metadata,
                            toDb(now), toDb(now));
                    outcome = WriteOutcome.APPENDED;
                } else {
                    outcome = WriteOutcome.MISSING;
                }
            } catch (DuplicateKeyException raced) {
                jdbcTemplate.update(update, updateArgs);
                outcome = WriteOutcome.REPLACED;
            }
        }
        if (outcome != WriteOutcome.MISSING) touchUnit(courseId, unitName, actorId, now);
        return outcome;
    }

    @Transactional
    public int deleteReference(String courseId, String unitName, String documentId, String actorId, Instant now) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM unit_document_refs WHERE course_id = ? AND unit_name = ? AND document_id = ?",
                courseId, unitName, documentId);
        if (deleted > 0) touchUnit(courseId, unitName, actorId, now);
        return deleted;
    }

    /**
     * Removes a document reference from whichever units of the course hold it.
     * Returns the names of the units that lost a reference.
     */
    @Transactional
    public List<String> deleteReferenceFromAnyUnit(String courseId, String documentId, String actorId, Instant now) {
        List<String> units = jdbcTemplate.queryForList(
                "SELECT unit_name FROM unit_document_refs WHERE course_id = ? AND document_id = ? ORDER BY unit_name",
                String.class, courseId, documentId);
        if (units.isEmpty()) return List.of();
        jdbcTemplate.update("DELETE FROM unit_document_refs WHERE course_id = ? AND document_id = ?", courseId, documentId);
        // unit rows in name order, then the course row once
        units.forEach(unit -> touchUnitRow(courseId, unit, actorId, now));
        touchCourse(courseId, actorId, now);
        return units;
    }

    /**
     * Swaps the unit's whole reference list in one transaction. Positions follow list order;
     * original creation timestamps are kept.
     */
    @Transactional
    public int replaceReferences(String courseId, String unitName, List<DocumentReference> references, String actorId, Instant now) {
        if (touchUnit(courseId, unitName, actorId, now) == 0) return 0;
        jdbcTemplate.update("DELETE FROM unit_document_refs WHERE course_id = ? AND unit_name = ?", courseId, unitName);
        for (int i = 0; i < references.size(); i++) {
            DocumentReference r = references.get(i);
            jdbcTemplate.update(
                    "INSERT INTO unit_document_refs(course_id, unit_name, document_id, position, display_name, document_type, mime_type, size_bytes, status, metadata, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
                    courseId, unitName, r.documentId(), i, r.displayName(), r.documentType(), r.mimeType(), r.sizeBytes(),
                    r.status().name(), codec.toJson(r.metadata()),
                    toDb(r.createdAt() == null ? now : r.createdAt()), toDb(r.updatedAt() == null ? now : r.updatedAt()));
        }
        return 1;
    }

    public Optional<Course> loadCourse(String courseId) {
        List<CourseRow> rows = jdbcTemplate.query(
                "SELECT course_id, course_name, owner_id, created_at, updated_at, last_updated_by FROM courses WHERE course_id = ?",
                (rs, n) -> new CourseRow(rs.getString(1), rs.getString(2), rs.getString(3),
                        instant(rs, "created_at"), instant(rs, "updated_at"), rs.getString(6)),
                courseId);
        if (rows.isEmpty()) return Optional.empty();
        CourseRow row = rows.get(0);

        List<StaffMember> staff = jdbcTemplate.query(
                "SELECT member_id, role FROM course_staff WHERE course_id = ? ORDER BY role, member_id",
                (rs, n) -> new StaffMember(rs.getString(1), StaffRole.valueOf(rs.getString(2))),
                courseId);

        return Optional.of(new Course(row.courseId(), row.courseName(), row.ownerId(), staff,
                loadUnits(courseId, null), row.createdAt(), row.updatedAt(), row.lastUpdatedBy()));
    }

    public Optional<Unit> loadUnit(String courseId, String unitName) {
        return loadUnits(courseId, unitName).stream().findFirst();
    }

    /**
     * Loads units in course order; {@code unitName == null} loads all of them.
     */
    private List<Unit> loadUnits(String courseId, String unitName) {
        String unitFilter = unitName == null ? "" : " AND unit_name = ?";
        Object[] args = unitName == null ? new Object[]{courseId} : new Object[]{courseId, unitName};

        List<UnitRow> unitRows = jdbcTemplate.query(
                "SELECT unit_name, is_published, pass_threshold, created_at, updated_at, last_updated_by FROM course_units " +
                        "WHERE course_id = ?" + unitFilter + " ORDER BY position",
                (rs, n) -> new UnitRow(rs.getString(1), rs.getBoolean(2), (Integer) rs.getObject(3),
                        instant(rs, "created_at"), instant(rs, "updated_at"), rs.getString(6)),
                args);
        if (unitRows.isEmpty()) return List.of();

        Map<String, List<String>> objectives = new HashMap<>();
        jdbcTemplate.query(
                "SELECT unit_name, objective FROM unit_objectives WHERE course_id = ?" + unitFilter + " ORDER BY unit_name, position",
                rs -> {
                    objectives.computeIfAbsent(rs.getString(1), k -> new ArrayList<>()).add(rs.getString(2));
                },
                args);

        Map<String, List<AssessmentQuestion>> questions = jdbcTemplate.query(
                "SELECT unit_name, question_id, question_type, prompt, payload, created_at, updated_at FROM unit_questions " +
                        "WHERE course_id = ?" + unitFilter + " ORDER BY unit_name, position, seq",
                (rs, n) -> {
                    QuestionPayload payload = Optional.ofNullable(codec.fromJson(rs.getString("payload"), QuestionPayload.class))
                            .orElse(new QuestionPayload(Map.of(), null, null));
                    return Map.entry(rs.getString("unit_name"), new AssessmentQuestion(
                            rs.getString("question_id"),
                            QuestionType.valueOf(rs.getString("question_type")),
                            rs.getString("prompt"),
                            payload.options() == null ? Map.of() : payload.options(),
                            payload.correctAnswer(),
                            payload.explanation(),
                            instant(rs, "created_at"),
                            instant(rs, "updated_at")));
                },
                args).stream()
                .collect(Collectors.groupingBy(Map.Entry::getKey, Collectors.mapping(Map.Entry::getValue, Collectors.toList())));

        Map<String, List<DocumentReference>> references = jdbcTemplate.query(
                "SELECT unit_name, document_id, display_name, document_type, mime_type, size_bytes, status, metadata, created_at, updated_at FROM unit_document_refs " +
                        "WHERE course_id = ?" + unitFilter + " ORDER BY unit_name, position, seq",
                (rs, n) -> Map.entry(rs.getString("unit_name"), new DocumentReference(
                        rs.getString("document_id"),
                        rs.getString("display_name"),
                        rs.getString("document_type"),
                        rs.getString("mime_type"),
                        rs.getLong("size_bytes"),
                        DocumentStatus.valueOf(rs.getString("status")),
                        Optional.ofNullable(codec.fromJson(rs.getString("metadata"), DocumentMetadata.class)).orElse(DocumentMetadata.empty()),
                        instant(rs, "created_at"),
                        instant(rs, "updated_at"))),
                args).stream()
                .collect(Collectors.groupingBy(Map.Entry::getKey, Collectors.mapping(Map.Entry::getValue, Collectors.toList())));

        return unitRows.stream()
                .map(u -> new Unit(u.name(), u.published(),
                        objectives.getOrDefault(u.name(), List.of()),
                        u.passThreshold(),
                        questions.getOrDefault(u.name(), List.of()),
                        references.getOrDefault(u.name(), List.of()),
                        u.createdAt(), u.updatedAt(), u.lastUpdatedBy()))
                .toList();
    }

    public boolean unitExists(String courseId, String unitName) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM course_units WHERE course_id = ? AND unit_name = ?", Integer.class, courseId, unitName);
        return count != null && count > 0;
    }

    private int nextPosition(String table, String courseId, String unitName) {
        Integer position = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(position), -1) + 1 FROM " + table + " WHERE course_id = ? AND unit_name = ?",
                Integer.class, courseId, unitName);
        return position == null ? 0 : position;
    }

    private void insertObjectives(String courseId, String unitName, List<String> objectives) {
        for (int i = 0; i < objectives.size(); i++) {
            jdbcTemplate.update(
                    "INSERT INTO unit_objectives(course_id, unit_name, position, objective) VALUES (?,?,?,?)",
                    courseId, unitName, i, objectives.get(i));
        }
    }

    private int touchUnit(String courseId, String unitName, String actorId, Instant now) {
        int updated = touchUnitRow(courseId, unitName, actorId, now);
        if (updated > 0) touchCourse(courseId, actorId, now);
        return updated;
    }

    private int touchUnitRow(String courseId, String unitName, String actorId, Instant now) {
        return jdbcTemplate.update(
                "UPDATE course_units SET updated_at = ?, last_updated_by = ? WHERE course_id = ? AND unit_name = ?",
                toDb(now), actorId, courseId, unitName);
    }

    private void touchCourse(String courseId, String actorId, Instant now) {
        jdbcTemplate.update("UPDATE courses SET updated_at = ?, last_updated_by = ? WHERE course_id = ?", toDb(now), actorId, courseId);
    }

    public enum WriteOutcome { REPLACED, APPENDED, MISSING }

    public record UnitSeed(String name, Integer passThreshold, List<String> learningObjectives) {}

    public record QuestionPayload(Map<String, String> options, String correctAnswer, String explanation) {}

    private record CourseRow(String courseId, String courseName, String ownerId, Instant createdAt, Instant updatedAt, String lastUpdatedBy) {}

    private record UnitRow(String name, boolean published, Integer passThreshold, Instant createdAt, Instant updatedAt, String lastUpdatedBy) {}
}
