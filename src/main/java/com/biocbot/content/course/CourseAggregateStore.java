package com.biocbot.content.course;

import com.biocbot.content.course.CourseModels.*;
import com.biocbot.content.domain.DomainModels.*;
import com.biocbot.content.exception.CourseNotFoundException;
import com.biocbot.content.exception.InvalidRequestException;
import com.biocbot.content.exception.NotFoundException;
import com.biocbot.content.exception.UnitNotFoundException;
import com.biocbot.content.repository.CourseJdbcRepository;
import com.biocbot.content.repository.CourseJdbcRepository.UnitSeed;
import com.biocbot.content.repository.CourseJdbcRepository.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;

import static com.biocbot.content.exception.StoreFailures.guard;
import static com.biocbot.content.exception.StoreFailures.run;

/**
 * One aggregate per course. Every mutation is scoped to a single existing unit,
 * addressed by {@code (courseId, unitName)}; a missing course or unit raises a
 * {@link NotFoundException} and writes nothing.
 */
@Service
public class CourseAggregateStore {
    private static final Logger log = LoggerFactory.getLogger(CourseAggregateStore.class);

    static final int DEFAULT_PASS_THRESHOLD = 2;
    private static final int MAX_WEEKS = 20;
    private static final int MAX_LECTURES_PER_WEEK = 5;

    private final CourseJdbcRepository repository;
    private final Clock clock;

    public CourseAggregateStore(CourseJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Provisions a course with units {@code Unit 1..weeks*lecturesPerWeek}. Unit 1 receives the
     * initial learning objectives. An existing course is left untouched.
     */
    public CourseCreateResult createCourse(NewCourse request) {
        if (request.courseId() == null || request.courseId().isBlank()) {
            throw new InvalidRequestException("MISSING_FIELD", "courseId", "Missing required field: courseId");
        }
        if (request.courseName() == null || request.courseName().isBlank()) {
            throw new InvalidRequestException("MISSING_FIELD", "courseName", "Missing required field: courseName");
        }
        if (request.weeks() < 1 || request.weeks() > MAX_WEEKS) {
            throw new InvalidRequestException("INVALID_WEEKS", "weeks", "Weeks must be between 1 and " + MAX_WEEKS);
        }
        if (request.lecturesPerWeek() < 1 || request.lecturesPerWeek() > MAX_LECTURES_PER_WEEK) {
            throw new InvalidRequestException("INVALID_LECTURES_PER_WEEK", "lecturesPerWeek",
                    "Lectures per week must be between 1 and " + MAX_LECTURES_PER_WEEK);
        }
        if (guard("course lookup", () -> repository.courseExists(request.courseId()))) {
            int units = getCourse(request.courseId()).units().size();
            log.info("Course {} already exists with {} units", request.courseId(), units);
            return new CourseCreateResult(request.courseId(), false, units);
        }

        int totalUnits = request.weeks() * request.lecturesPerWeek();
        List<UnitSeed> seeds = new ArrayList<>();
        for (int i = 1; i <= totalUnits; i++) {
            List<String> objectives = i == 1 && request.initialObjectives() != null ? request.initialObjectives() : List.of();
            seeds.add(new UnitSeed("Unit " + i, DEFAULT_PASS_THRESHOLD, objectives));
        }
        try {
            run("course create", () -> repository.insertCourse(request.courseId(), request.courseName(), request.ownerId(), seeds, clock.instant()));
        } catch (DuplicateKeyException raced) {
            return new CourseCreateResult(request.courseId(), false, getCourse(request.courseId()).units().size());
        }
        log.info("Created course {} with {} units", request.courseId(), totalUnits);
        return new CourseCreateResult(request.courseId(), true, totalUnits);
    }

    public Course getCourse(String courseId) {
        return guard("course load", () -> repository.loadCourse(courseId))
                .orElseThrow(() -> new CourseNotFoundException(courseId));
    }

    public Unit getUnit(String courseId, String unitName) {
        return guard("unit load", () -> repository.loadUnit(courseId, unitName))
                .orElseThrow(() -> missing(courseId, unitName));
    }

    public Map<String, Boolean> publishStatus(String courseId) {
        Map<String, Boolean> status = new LinkedHashMap<>();
        getCourse(courseId).units().forEach(u -> status.put(u.name(), u.isPublished()));
        return status;
    }

    public List<String> publishedUnits(String courseId) {
        return getCourse(courseId).units().stream().filter(Unit::isPublished).map(Unit::name).toList();
    }

    public List<String> learningObjectives(String courseId, String unitName) {
        return getUnit(courseId, unitName).learningObjectives();
    }

    public List<AssessmentQuestion> assessmentQuestions(String courseId, String unitName) {
        return getUnit(courseId, unitName).assessmentQuestions();
    }

    /**
     * @return the stored threshold, 0 when none was ever set
     */
    public int passThreshold(String courseId, String unitName) {
        Integer threshold = getUnit(courseId, unitName).passThreshold();
        return threshold == null ? 0 : threshold;
    }

    public List<DocumentReference> documentReferences(String courseId, String unitName) {
        return getUnit(courseId, unitName).documentReferences();
    }

    public void addUnit(String courseId, String unitName, String actorId) {
        if (unitName == null || unitName.isBlank()) {
            throw new InvalidRequestException("MISSING_FIELD", "unitName", "Unit name is required");
        }
        int inserted;
        try {
            inserted = guard("unit create", () -> repository.appendUnit(courseId,
                    new UnitSeed(unitName, DEFAULT_PASS_THRESHOLD, List.of()), actorId, clock.instant()));
        } catch (DuplicateKeyException e) {
            throw new InvalidRequestException("DUPLICATE_UNIT", "unitName", "Course " + courseId + " already has a unit named " + unitName);
        }
        if (inserted == 0) throw new CourseNotFoundException(courseId);
        log.info("Added unit {} to course {}", unitName, courseId);
    }

    /**
     * Removes the unit and everything embedded in it. Documents in the repository are not touched.
     */
    public void deleteUnit(String courseId, String unitName, String actorId) {
        int deleted = guard("unit delete", () -> repository.deleteUnit(courseId, unitName, actorId, clock.instant()));
        if (deleted == 0) throw missing(courseId, unitName);
        log.info("Deleted unit {} from course {}", unitName, courseId);
    }

    public void addStaffMember(String courseId, String memberId, StaffRole role) {
        requireCourse(courseId);
        run("staff update", () -> repository.mergeStaff(courseId, memberId, role));
    }

    public boolean removeStaffMember(String courseId, String memberId, StaffRole role) {
        requireCourse(courseId);
        return guard("staff update", () -> repository.deleteStaff(courseId, memberId, role)) > 0;
    }

    public void setPublishState(String courseId, String unitName, boolean isPublished, String actorId) {
        int updated = guard("publish update", () -> repository.updatePublished(courseId, unitName, isPublished, actorId, clock.instant()));
        if (updated == 0) throw missing(courseId, unitName);
        log.debug("Unit {}/{} published={} by {}", courseId, unitName, isPublished, actorId);
    }

    /**
     * Full replace of the unit's objectives, order preserved.
     */
    public void setLearningObjectives(String courseId, String unitName, List<String> objectives, String actorId) {
        List<String> cleaned = objectives == null ? List.of() : objectives.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(o -> !o.isEmpty())
                .toList();
        int updated = guard("objectives update", () -> repository.replaceObjectives(courseId, unitName, cleaned, actorId, clock.instant()));
        if (updated == 0) throw missing(courseId, unitName);
    }

    /**
     * Replaces the question carrying the same id in place. A question without an id gets a
     * generated one; a question whose id is unknown to the unit is appended, not rejected.
     */
    public QuestionUpsertResult upsertAssessmentQuestion(String courseId, String unitName, AssessmentQuestion question, String actorId) {
        if (question.questionType() == null) {
            throw new InvalidRequestException("MISSING_FIELD", "questionType", "Question type is required");
        }
        if (question.prompt() == null || question.prompt().isBlank()) {
            throw new InvalidRequestException("MISSING_FIELD", "prompt", "Question prompt is required");
        }
        AssessmentQuestion toStore = question.questionId() == null || question.questionId().isBlank()
                ? question.withId("q_" + UUID.randomUUID())
                : question;
        WriteOutcome outcome = guard("question upsert",
                () -> repository.upsertQuestion(courseId, unitName, toStore, actorId, clock.instant()));
        if (outcome == WriteOutcome.MISSING) throw missing(courseId, unitName);
        log.debug("Question {} {} in {}/{}", toStore.questionId(), outcome == WriteOutcome.APPENDED ? "appended" : "replaced", courseId, unitName);
        return new QuestionUpsertResult(toStore.questionId(), outcome == WriteOutcome.APPENDED);
    }

    /**
     * @return number of questions removed, 0 when the id was not present
     */
    public int deleteAssessmentQuestion(String courseId, String unitName, String questionId, String actorId) {
        requireUnit(courseId, unitName);
        return guard("question delete", () -> repository.deleteQuestion(courseId, unitName, questionId, actorId, clock.instant()));
    }

    /**
     * Stored as given. Whether it exceeds the unit's question count is left to the presentation layer.
     */
    public void setPassThreshold(String courseId, String unitName, int threshold, String actorId) {
        if (threshold < 0) {
            throw new InvalidRequestException("INVALID_THRESHOLD", "passThreshold", "Pass threshold must not be negative");
        }
        int updated = guard("threshold update", () -> repository.updatePassThreshold(courseId, unitName, threshold, actorId, clock.instant()));
        if (updated == 0) throw missing(courseId, unitName);
    }

    public ReferenceUpsertResult upsertDocumentReference(String courseId, String unitName, DocumentReference reference, String actorId) {
        WriteOutcome outcome = guard("reference upsert",
                () -> repository.upsertReference(courseId, unitName, reference, actorId, clock.instant()));
        if (outcome == WriteOutcome.MISSING) throw missing(courseId, unitName);
        return new ReferenceUpsertResult(reference.documentId(), outcome == WriteOutcome.APPENDED);
    }

    /**
     * @return number of references removed from the unit, 0 when it held none for this document
     */
    public int removeDocumentReference(String courseId, String unitName, String documentId, String actorId) {
        requireUnit(courseId, unitName);
        return guard("reference delete", () -> repository.deleteReference(courseId, unitName, documentId, actorId, clock.instant()));
    }

    /**
     * Course-wide variant for callers that do not know which unit holds the reference.
     *
     * @return names of the units a reference was removed from
     */
    public List<String> removeDocumentReferenceFromAnyUnit(String courseId, String documentId, String actorId) {
        requireCourse(courseId);
        return guard("reference delete", () -> repository.deleteReferenceFromAnyUnit(courseId, documentId, actorId, clock.instant()));
    }

    /**
     * Swaps the unit's reference list in a single write.
     */
    public void replaceUnitDocumentReferences(String courseId, String unitName, List<DocumentReference> references, String actorId) {
        int updated = guard("reference replace",
                () -> repository.replaceReferences(courseId, unitName, List.copyOf(references), actorId, clock.instant()));
        if (updated == 0) throw missing(courseId, unitName);
    }

    private void requireCourse(String courseId) {
        if (!guard("course lookup", () -> repository.courseExists(courseId))) {
            throw new CourseNotFoundException(courseId);
        }
    }

    private void requireUnit(String courseId, String unitName) {
        if (!guard("unit lookup", () -> repository.unitExists(courseId, unitName))) {
            throw missing(courseId, unitName);
        }
    }

    private NotFoundException missing(String courseId, String unitName) {
        return guard("course lookup", () -> repository.courseExists(courseId))
                ? new UnitNotFoundException(courseId, unitName)
                : new CourseNotFoundException(courseId);
    }
}
