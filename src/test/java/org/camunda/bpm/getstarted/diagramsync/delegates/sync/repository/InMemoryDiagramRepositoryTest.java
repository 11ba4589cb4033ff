package org.camunda.bpm.getstarted.diagramsync.delegates.sync.repository;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDiagramRepositoryTest {

    @Test
    void shouldStoreAndReplaceDocuments() {
        InMemoryDiagramRepository repository = new InMemoryDiagramRepository();

        assertTrue(repository.load("onboarding").isEmpty());
        repository.store("onboarding", "<mxfile>v1</mxfile>");
        repository.store("onboarding", "<mxfile>v2</mxfile>");

        assertEquals("<mxfile>v2</mxfile>", repository.load("onboarding").orElseThrow());
    }
}
