package com.biocbot.content.api;

import com.biocbot.content.course.CourseAggregateStore;
import com.biocbot.content.course.CourseModels.CourseCreateResult;
import com.biocbot.content.course.CourseModels.NewCourse;
import com.biocbot.content.course.CourseModels.QuestionUpsertResult;
import com.biocbot.content.domain.DomainModels.*;
import com.biocbot.content.sync.ReconciliationSweep;
import com.biocbot.content.sync.SyncModels.ReconcileResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/courses")
public class CourseController {
    private final CourseAggregateStore courseStore;
    private final ReconciliationSweep sweep;

    public CourseController(CourseAggregateStore courseStore, ReconciliationSweep sweep) {
        this.courseStore = courseStore;
        this.sweep = sweep;
    }

    @PostMapping
    public ResponseEntity<CourseCreateResult> create(@RequestHeader("X-Actor-Id") String actorId,
                                                     @RequestBody CreateCourseRequest request) {
        CourseCreateResult result = courseStore.createCourse(new NewCourse(request.courseId(), request.courseName(), actorId,
                request.weeks(), request.lecturesPerWeek(), request.learningOutcomes()));
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(result);
    }

    @GetMapping("/{courseId}")
    public ResponseEntity<Course> get(@PathVariable String courseId) {
        return ResponseEntity.ok(courseStore.getCourse(courseId));
    }

    @GetMapping("/{courseId}/publish-status")
    public ResponseEntity<Map<String, Boolean>> publishStatus(@PathVariable String courseId) {
        return ResponseEntity.ok(courseStore.publishStatus(courseId));
    }

    @GetMapping("/{courseId}/published-units")
    public ResponseEntity<List<String>> publishedUnits(@PathVariable String courseId) {
        return ResponseEntity.ok(courseStore.publishedUnits(courseId));
    }

    @PostMapping("/{courseId}/staff")
    public ResponseEntity<Void> addStaff(@PathVariable String courseId, @RequestBody StaffRequest request) {
        courseStore.addStaffMember(courseId, request.memberId(), request.role());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{courseId}/staff/{role}/{memberId}")
    public ResponseEntity<Void> removeStaff(@PathVariable String courseId, @PathVariable StaffRole role, @PathVariable String memberId) {
        courseStore.removeStaffMember(courseId, memberId, role);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{courseId}/units")
    public ResponseEntity<Unit> addUnit(@RequestHeader("X-Actor-Id") String actorId,
                                        @PathVariable String courseId,
                                        @RequestBody UnitRequest request) {
        courseStore.addUnit(courseId, request.name(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(courseStore.getUnit(courseId, request.name()));
    }

    @GetMapping("/{courseId}/units/{unitName}")
    public ResponseEntity<Unit> getUnit(@PathVariable String courseId, @PathVariable String unitName) {
        return ResponseEntity.ok(courseStore.getUnit(courseId, unitName));
    }

    @DeleteMapping("/{courseId}/units/{unitName}")
    public ResponseEntity<Void> deleteUnit(@RequestHeader("X-Actor-Id") String actorId,
                                           @PathVariable String courseId,
                                           @PathVariable String unitName) {
        courseStore.deleteUnit(courseId, unitName, actorId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{courseId}/units/{unitName}/publish")
    public ResponseEntity<Void> publish(@RequestHeader("X-Actor-Id") String actorId,
                                        @PathVariable String courseId,
                                        @PathVariable String unitName,
                                        @RequestBody PublishRequest request) {
        courseStore.setPublishState(courseId, unitName, request.published(), actorId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{courseId}/units/{unitName}/objectives")
    public ResponseEntity<List<String>> objectives(@RequestHeader("X-Actor-Id") String actorId,
                                                   @PathVariable String courseId,
                                                   @PathVariable String unitName,
                                                   @RequestBody ObjectivesRequest request) {
        courseStore.setLearningObjectives(courseId, unitName, request.objectives(), actorId);
        return ResponseEntity.ok(courseStore.learningObjectives(courseId, unitName));
    }

    @PutMapping("/{courseId}/units/{unitName}/pass-threshold")
    public ResponseEntity<Void> passThreshold(@RequestHeader("X-Actor-Id") String actorId,
                                              @PathVariable String courseId,
                                              @PathVariable String unitName,
                                              @RequestBody ThresholdRequest request) {
        courseStore.setPassThreshold(courseId, unitName, request.passThreshold(), actorId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{courseId}/units/{unitName}/questions")
    public ResponseEntity<QuestionUpsertResult> upsertQuestion(@RequestHeader("X-Actor-Id") String actorId,
                                                               @PathVariable String courseId,
                                                               @PathVariable String unitName,
                                                               @RequestBody AssessmentQuestion question) {
        return ResponseEntity.ok(courseStore.upsertAssessmentQuestion(courseId, unitName, question, actorId));
    }

    @DeleteMapping("/{courseId}/units/{unitName}/questions/{questionId}")
    public ResponseEntity<Map<String, Integer>> deleteQuestion(@RequestHeader("X-Actor-Id") String actorId,
                                                               @PathVariable String courseId,
                                                               @PathVariable String unitName,
                                                               @PathVariable String questionId) {
        int deleted = courseStore.deleteAssessmentQuestion(courseId, unitName, questionId, actorId);
        return ResponseEntity.ok(Map.of("deletedCount", deleted));
    }

    @PostMapping("/{courseId}/reconcile")
    public ResponseEntity<ReconcileResult> reconcile(@RequestHeader("X-Actor-Id") String actorId, @PathVariable String courseId) {
        return ResponseEntity.ok(sweep.reconcile(courseId, actorId));
    }

    public record CreateCourseRequest(String courseId, String courseName, int weeks, int lecturesPerWeek, List<String> learningOutcomes) {}

    public record StaffRequest(String memberId, StaffRole role) {}

    public record UnitRequest(String name) {}

    public record PublishRequest(@JsonProperty("isPublished") boolean published) {}

    public record ObjectivesRequest(List<String> objectives) {}

    public record ThresholdRequest(int passThreshold) {}
}
