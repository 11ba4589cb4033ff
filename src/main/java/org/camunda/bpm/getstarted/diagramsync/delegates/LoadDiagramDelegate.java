package org.camunda.bpm.getstarted.diagramsync.delegates;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.engine.delegate.DelegateExecution;
import org.camunda.bpm.engine.delegate.JavaDelegate;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.DiagramSyncService;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormPayloadHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormSession;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormView;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Puts the form view of a diagram into the process.
 * <p>
 * Reads the diagram from {@code diagramXml}, or from the repository when only {@code diagramKey}
 * is set, and the nodes saved by the previous form round from {@code formNodes}. Writes the view
 * as JSON to {@code formView}.
 */
@Slf4j
@Component("loadDiagramDelegate")
public class LoadDiagramDelegate implements JavaDelegate {
    public static final String DIAGRAM_KEY = "diagramKey";
    public static final String DIAGRAM_XML = "diagramXml";
    public static final String FORM_NODES = "formNodes";
    public static final String FORM_VIEW = "formView";
    public static final String PATCH_APPLIED = "patchApplied";

    private final DiagramSyncService diagramSyncService;

    @Autowired
    public LoadDiagramDelegate(DiagramSyncService diagramSyncService) {
        this.diagramSyncService = diagramSyncService;
    }

    @Override
    public void execute(DelegateExecution delegateExecution) throws Exception {
        String diagramKey = (String) delegateExecution.getVariable(DIAGRAM_KEY);
        String diagramXml = (String) delegateExecution.getVariable(DIAGRAM_XML);
        List<DiagramNode> persistedNodes = FormPayloadHelper.readNodes((String) delegateExecution.getVariable(FORM_NODES));

        FormView view;
        if (diagramXml != null && !diagramXml.isBlank()) {
            view = diagramSyncService.load(diagramXml, persistedNodes, new FormSession());
        } else if (diagramKey != null && !diagramKey.isBlank()) {
            view = diagramSyncService.reload(diagramKey, persistedNodes, new FormSession());
        } else {
            throw new IllegalArgumentException("Either '" + DIAGRAM_XML + "' or '" + DIAGRAM_KEY + "' must be set");
        }

        delegateExecution.setVariable(FORM_VIEW, FormPayloadHelper.writeFormView(view));
        log.info("Activity '{}': form view with {} steps", delegateExecution.getCurrentActivityName(), view.steps().size());
    }
}
