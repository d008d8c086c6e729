package com.biocbot.content;

import com.biocbot.content.course.CourseAggregateStore;
import com.biocbot.content.document.DocumentStore;
import com.biocbot.content.domain.DomainModels.DocumentReference;
import com.biocbot.content.exception.CourseNotFoundException;
import com.biocbot.content.exception.StoreUnavailableException;
import com.biocbot.content.sync.ReconciliationSweep;
import com.biocbot.content.sync.ReferenceSynchronizer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
class ReconciliationSweepTest {
    @Autowired
    private ReconciliationSweep sweep;

    @Autowired
    private ReferenceSynchronizer synchronizer;

    @Autowired
    private CourseAggregateStore courseStore;

    @SpyBean
    private DocumentStore documentStore;

    @Test
    void removesDanglingReferencesAndConverges() {
        String courseId = TestDocuments.uniqueCourseId();
        courseStore.createCourse(TestDocuments.twoUnitCourse(courseId));
        String a = synchronizer.addDocument(TestDocuments.text(courseId, "Unit 1", "A", "alpha")).documentId();
        String b = synchronizer.addDocument(TestDocuments.text(courseId, "Unit 1", "B", "beta")).documentId();
        String c = synchronizer.addDocument(TestDocuments.text(courseId, "Unit 1", "C", "gamma")).documentId();
        String d = synchronizer.addDocument(TestDocuments.text(courseId, "Unit 2", "D", "delta")).documentId();
        documentStore.delete(b);

        var result = sweep.reconcile(courseId, "inst-1");

        assertEquals(1, result.orphanReferencesRemoved());
        assertEquals(1, result.unitsModified());
        assertEquals(Map.of("Unit 1", List.of(b)), result.removedByUnit());
        assertEquals(List.of(a, c), ids(courseId, "Unit 1"));
        assertEquals(List.of(d), ids(courseId, "Unit 2"));

        var second = sweep.reconcile(courseId, "inst-1");
        assertEquals(0, second.orphanReferencesRemoved());
        assertEquals(0, second.unitsModified());
        assertEquals(List.of(a, c), ids(courseId, "Unit 1"));
    }

    @Test
    void unreferencedDocumentsAreNotDiscovered() {
        String courseId = TestDocuments.uniqueCourseId();
        courseStore.createCourse(TestDocuments.twoUnitCourse(courseId));
        String orphan = documentStore.create(TestDocuments.text(courseId, "Unit 1", "Orphan", "nobody links me")).documentId();

        var result = sweep.reconcile(courseId, "inst-1");

        assertEquals(0, result.orphanReferencesRemoved());
        assertTrue(documentStore.find(orphan).isPresent());
        assertTrue(courseStore.documentReferences(courseId, "Unit 1").isEmpty());
    }

    @Test
    void failedLookupCountsAsDanglingByDefault() {
        String courseId = TestDocuments.uniqueCourseId();
        courseStore.createCourse(TestDocuments.twoUnitCourse(courseId));
        synchronizer.addDocument(TestDocuments.text(courseId, "Unit 1", "A", "alpha"));
        doThrow(new StoreUnavailableException("document store down", null)).when(documentStore).existingIds(anyCollection());

        var result = sweep.reconcile(courseId, "inst-1");

        assertEquals(1, result.orphanReferencesRemoved());
        assertTrue(courseStore.documentReferences(courseId, "Unit 1").isEmpty());
    }

    @Test
    void missingCourseIsReported() {
        assertThrows(CourseNotFoundException.class, () -> sweep.reconcile("NOPE-" + TestDocuments.uniqueCourseId(), "inst-1"));
    }

    private List<String> ids(String courseId, String unitName) {
        return courseStore.documentReferences(courseId, unitName).stream().map(DocumentReference::documentId).toList();
    }
}
