package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models.IdConfig;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.CellIdComparator;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out cell ids that are unused in a document.
 * <p>
 * Sub-step vertices and edges draw from two ranges placed above the largest numeric id found in
 * the document, so ids from one save never collide with ids from the next.
 */
@Slf4j
public class IdAllocator {
    private static final int MAX_NUMERIC_DIGITS = 18;

    private final Set<String> usedIds;
    private final int maxAttempts;
    private long nextSubprocessId;
    private long nextEdgeId;

    public IdAllocator(Set<String> usedIds, IdConfig config) {
        this.usedIds = new HashSet<>(usedIds);
        this.maxAttempts = config.maxAllocationAttempts;

        long maxId = maxNumericId(usedIds);
        this.nextSubprocessId = Math.max(config.subprocessFloor, maxId + config.subprocessOffset);
        this.nextEdgeId = Math.max(config.edgeFloor, maxId + config.edgeOffset);
        log.debug("Id ranges start at {} (sub-steps) and {} (edges), max id {}", nextSubprocessId, nextEdgeId, maxId);
    }

    public String nextSubprocessId() {
        String id = allocate(nextSubprocessId, "sub-step");
        nextSubprocessId = Long.parseLong(id) + 1;
        return id;
    }

    public String nextEdgeId() {
        String id = allocate(nextEdgeId, "edge");
        nextEdgeId = Long.parseLong(id) + 1;
        return id;
    }

    /**
     * Marks an id as taken so it is never handed out.
     */
    public void reserve(String id) {
        usedIds.add(id);
    }

    public boolean isUsed(String id) {
        return usedIds.contains(id);
    }

    static long maxNumericId(Set<String> ids) {
        long max = 0;
        for (String id : ids) {
            if (CellIdComparator.isNumeric(id) && id.length() <= MAX_NUMERIC_DIGITS) {
                max = Math.max(max, Long.parseLong(id));
            }
        }
        return max;
    }

    private String allocate(long start, String purpose) {
        long candidate = start;
        int collisions = 0;
        while (usedIds.contains(String.valueOf(candidate))) {
            if (++collisions > maxAttempts) {
                throw new IdentifierExhaustionException(String.format(
                        "No free %s id after %d attempts starting at %d", purpose, maxAttempts, start));
            }
            candidate++;
        }
        if (collisions > 0) {
            log.warn("Skipped {} used ids while allocating a {} id", collisions, purpose);
        }
        String id = String.valueOf(candidate);
        usedIds.add(id);
        return id;
    }
}
