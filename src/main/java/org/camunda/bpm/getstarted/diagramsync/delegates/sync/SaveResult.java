package org.camunda.bpm.getstarted.diagramsync.delegates.sync;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch.PatchResult;

/**
 * @param document the full document to persist
 * @param patch    what the patch engine did to the body
 */
public record SaveResult(
        String document,
        PatchResult patch
) {
}
