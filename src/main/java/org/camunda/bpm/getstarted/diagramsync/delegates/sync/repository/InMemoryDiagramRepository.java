package org.camunda.bpm.getstarted.diagramsync.delegates.sync.repository;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component("diagramRepository")
public class InMemoryDiagramRepository implements DiagramRepository {
    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<String> load(String key) {
        return Optional.ofNullable(documents.get(key));
    }

    @Override
    public void store(String key, String document) {
        documents.put(key, document);
    }
}
