package com.biocbot.content.sync;

import com.biocbot.content.config.SyncProperties;
import com.biocbot.content.config.SyncProperties.LookupFailurePolicy;
import com.biocbot.content.course.CourseAggregateStore;
import com.biocbot.content.document.DocumentStore;
import com.biocbot.content.domain.DomainModels.Course;
import com.biocbot.content.domain.DomainModels.DocumentReference;
import com.biocbot.content.domain.DomainModels.Unit;
import com.biocbot.content.exception.StoreUnavailableException;
import com.biocbot.content.exception.UnitNotFoundException;
import com.biocbot.content.sync.SyncModels.ReconcileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Removes dangling references (references whose document is gone from the repository)
 * from one course. Idempotent.
 * <p>
 * The sweep only reads the repository and only removes references. Documents that no unit
 * references (true orphans) are not discovered: finding them needs a full repository scan.
 * <p>
 * Each affected unit is re-read just before its single replace write and the dangling ids are
 * subtracted from the current list, so references added after the initial read survive. A
 * reference added between that re-read and the write can still be lost.
 */
@Service
public class ReconciliationSweep {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationSweep.class);

    private final CourseAggregateStore courseStore;
    private final DocumentStore documentStore;
    private final int batchSize;
    private final LookupFailurePolicy lookupFailurePolicy;

    public ReconciliationSweep(CourseAggregateStore courseStore, DocumentStore documentStore, SyncProperties properties) {
        this.courseStore = courseStore;
        this.documentStore = documentStore;
        this.batchSize = Math.max(1, properties.reconcile().batchSize());
        this.lookupFailurePolicy = properties.reconcile().lookupFailurePolicy();
    }

    public ReconcileResult reconcile(String courseId, String actorId) {
        Course course = courseStore.getCourse(courseId);
        Set<String> existing = existingIds(course);

        int removed = 0;
        Map<String, List<String>> removedByUnit = new LinkedHashMap<>();
        for (Unit unit : course.units()) {
            Set<String> dangling = new LinkedHashSet<>();
            unit.documentReferences().stream()
                    .map(DocumentReference::documentId)
                    .filter(id -> !existing.contains(id))
                    .forEach(dangling::add);
            if (dangling.isEmpty()) continue;

            try {
                List<DocumentReference> current = courseStore.documentReferences(courseId, unit.name());
                List<DocumentReference> kept = current.stream()
                        .filter(r -> !dangling.contains(r.documentId()))
                        .toList();
                if (kept.size() == current.size()) continue;

                courseStore.replaceUnitDocumentReferences(courseId, unit.name(), kept, actorId);
                List<String> dropped = current.stream()
                        .map(DocumentReference::documentId)
                        .filter(dangling::contains)
                        .toList();
                removed += dropped.size();
                removedByUnit.put(unit.name(), dropped);
                log.info("Removed {} dangling references from {}/{}: {}", dropped.size(), courseId, unit.name(), dropped);
            } catch (UnitNotFoundException e) {
                log.debug("Unit {} removed from course {} during sweep", unit.name(), courseId);
            }
        }

        log.info("Reconciled course {}: {} dangling references removed from {} units", courseId, removed, removedByUnit.size());
        return new ReconcileResult(courseId, removed, removedByUnit.size(), removedByUnit);
    }

    private Set<String> existingIds(Course course) {
        List<String> ids = course.units().stream()
                .flatMap(u -> u.documentReferences().stream())
                .map(DocumentReference::documentId)
                .distinct()
                .toList();

        Set<String> existing = new HashSet<>();
        for (int from = 0; from < ids.size(); from += batchSize) {
            List<String> batch = ids.subList(from, Math.min(ids.size(), from + batchSize));
            try {
                existing.addAll(documentStore.existingIds(batch));
            } catch (StoreUnavailableException e) {
                if (lookupFailurePolicy == LookupFailurePolicy.ABORT) throw e;
                log.warn("Existence lookup failed for {} references in course {}, treating them as dangling: {}",
                        batch.size(), course.courseId(), e.getMessage());
            }
        }
        return existing;
    }
}
