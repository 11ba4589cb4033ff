package org.camunda.bpm.getstarted.diagramsync.delegates.sync;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.build.DiagramBuilder;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec.DiagramCodec;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec.DiagramEnvelope;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.SyncConfigHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models.SyncConfig;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow.FlowAnalyzer;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow.FlowStructure;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormSession;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormView;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormViewHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.GraphExtractor;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch.PatchEngine;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch.PatchResult;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.repository.DiagramRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Load and save paths between a stored diagram document and the form.
 */
@Slf4j
@Component("diagramSyncService")
public class DiagramSyncService {
    private final DiagramRepository repository;
    private final FlowAnalyzer flowAnalyzer;
    private final PatchEngine patchEngine;
    private final DiagramBuilder diagramBuilder;

    @Autowired
    public DiagramSyncService(DiagramRepository repository) {
        this(repository, SyncConfigHelper.loadDefault());
    }

    public DiagramSyncService(DiagramRepository repository, SyncConfig config) {
        this.repository = repository;
        this.flowAnalyzer = new FlowAnalyzer(config.flow);
        this.patchEngine = new PatchEngine(config);
        this.diagramBuilder = new DiagramBuilder(config);
    }

    /**
     * Builds the form view of a document. A body that cannot be parsed shows as an empty diagram.
     *
     * @throws org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec.DecompressionFailureException
     *         if the payload is compressed but corrupt
     */
    public FormView load(String document, List<DiagramNode> persistedNodes, FormSession session) {
        DiagramEnvelope envelope = DiagramCodec.decode(document);
        DiagramGraph graph = GraphExtractor.extractOrEmpty(envelope.body()).withSubStepsOf(persistedNodes);
        FlowStructure flow = flowAnalyzer.analyze(graph);
        log.info("Loaded diagram '{}': {} nodes, {} main-flow steps, {} orphans",
                envelope.diagramName(), graph.nodes().size(), flow.mainFlow().size(), flow.orphans().size());
        FormView view = FormViewHelper.buildFormView(envelope.diagramName(), graph, flow, persistedNodes, session);
        if (session != null) {
            session.recordShown(view.shownIds());
        }
        return view;
    }

    /**
     * Patches the given document with the edited nodes and re-encodes it in its original format.
     */
    public SaveResult save(String latestDocument, List<DiagramNode> editedNodes) {
        return save(latestDocument, editedNodes, null);
    }

    /**
     * Same as {@link #save(String, List)}, but only the vertices in {@code shownIds} (see
     * {@link FormView#shownIds()}) may be deleted, so vertices added since the form was loaded stay.
     */
    public SaveResult save(String latestDocument, List<DiagramNode> editedNodes, Set<String> shownIds) {
        DiagramEnvelope envelope = DiagramCodec.decode(latestDocument);
        PatchResult patch = patchEngine.apply(envelope.body(), editedNodes, shownIds);
        String document = DiagramCodec.encode(envelope, patch.body());
        return new SaveResult(document, patch);
    }

    /**
     * Re-reads the stored document and patches that, so connections drawn in the editor since the
     * form was loaded are kept. Form edits to nodes and sub-steps take precedence.
     *
     * @throws IllegalStateException if nothing is stored under {@code key}
     */
    public SaveResult saveToRepository(String key, List<DiagramNode> editedNodes) {
        return saveToRepository(key, editedNodes, null);
    }

    /**
     * Re-reads the stored document and patches that. Vertices drawn in the editor since the form
     * was loaded are kept along with their connections: only the ids in {@code shownIds} may be
     * deleted.
     *
     * @throws IllegalStateException if nothing is stored under {@code key}
     */
    public SaveResult saveToRepository(String key, List<DiagramNode> editedNodes, Set<String> shownIds) {
        String latest = fetch(key);
        SaveResult result = save(latest, editedNodes, shownIds);
        if (result.patch().changed()) {
            repository.store(key, result.document());
            log.info("Stored patched diagram {}", key);
        } else {
            log.info("Diagram {} unchanged, nothing stored", key);
        }
        return result;
    }

    /**
     * Fetches the stored document again and forgets the session's removals.
     */
    public FormView reload(String key, List<DiagramNode> persistedNodes, FormSession session) {
        session.reload();
        return load(fetch(key), persistedNodes, session);
    }

    public String rebuild(DiagramGraph graph, String diagramName, boolean compress) {
        return diagramBuilder.buildDocument(graph, diagramName, compress);
    }

    private String fetch(String key) {
        return repository.load(key)
                .orElseThrow(() -> new IllegalStateException("No diagram stored under '" + key + "'"));
    }
}
