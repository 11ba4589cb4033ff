package org.camunda.bpm.getstarted.diagramsync.delegates.sync.form;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-load memory of the form: detected sub-steps the user removed stay hidden until the diagram
 * is reloaded.
 */
public class FormSession {
    private final Map<String, Set<String>> deletedNamesByNode = new HashMap<>();
    private Set<String> shownIds;

    public void recordDeletion(String nodeId, String name) {
        if (name == null || name.isBlank()) {
            return;
        }
        deletedNamesByNode.computeIfAbsent(nodeId, key -> new HashSet<>()).add(name.trim());
    }

    public boolean isDeleted(String nodeId, String name) {
        if (name == null) {
            return false;
        }
        return deletedNamesByNode.getOrDefault(nodeId, Set.of()).contains(name.trim());
    }

    public boolean hasDeletions() {
        return !deletedNamesByNode.isEmpty();
    }

    public void recordShown(Set<String> ids) {
        shownIds = ids == null ? null : Set.copyOf(ids);
    }

    /**
     * Ids of the vertices shown by the last load, or null before the first load.
     */
    public Set<String> shownIds() {
        return shownIds;
    }

    /**
     * Forgets every deletion. Called when the diagram is fetched again.
     */
    public void reload() {
        deletedNamesByNode.clear();
    }
}
