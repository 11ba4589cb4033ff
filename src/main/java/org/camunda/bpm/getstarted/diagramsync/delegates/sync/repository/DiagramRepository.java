package org.camunda.bpm.getstarted.diagramsync.delegates.sync.repository;

import java.util.Optional;

/**
 * Where diagram documents are persisted, keyed by diagram id.
 */
public interface DiagramRepository {

    Optional<String> load(String key);

    void store(String key, String document);
}
