package org.camunda.bpm.getstarted.diagramsync.delegates;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.engine.delegate.DelegateExecution;
import org.camunda.bpm.engine.delegate.JavaDelegate;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.DiagramSyncService;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.SaveResult;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormPayloadHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

import static org.camunda.bpm.getstarted.diagramsync.delegates.LoadDiagramDelegate.DIAGRAM_KEY;
import static org.camunda.bpm.getstarted.diagramsync.delegates.LoadDiagramDelegate.DIAGRAM_XML;
import static org.camunda.bpm.getstarted.diagramsync.delegates.LoadDiagramDelegate.FORM_NODES;
import static org.camunda.bpm.getstarted.diagramsync.delegates.LoadDiagramDelegate.FORM_VIEW;
import static org.camunda.bpm.getstarted.diagramsync.delegates.LoadDiagramDelegate.PATCH_APPLIED;

/**
 * Writes the edited form nodes back into the diagram.
 * <p>
 * With {@code diagramKey} set, the latest stored document is patched and stored again. Otherwise
 * {@code diagramXml} is patched and replaced. When {@code formView} still holds the view the form
 * was loaded with, only vertices shown in it can be deleted. {@code formNodes} is updated with the
 * ids of created sub-step vertices.
 */
@Slf4j
@Component("saveDiagramDelegate")
public class SaveDiagramDelegate implements JavaDelegate {
    private final DiagramSyncService diagramSyncService;

    @Autowired
    public SaveDiagramDelegate(DiagramSyncService diagramSyncService) {
        this.diagramSyncService = diagramSyncService;
    }

    @Override
    public void execute(DelegateExecution delegateExecution) throws Exception {
        String diagramKey = (String) delegateExecution.getVariable(DIAGRAM_KEY);
        List<DiagramNode> editedNodes = FormPayloadHelper.readNodes((String) delegateExecution.getVariable(FORM_NODES));
        String formView = (String) delegateExecution.getVariable(FORM_VIEW);
        Set<String> shownIds = formView == null || formView.isBlank() ? null : FormPayloadHelper.readShownIds(formView);

        SaveResult result;
        if (diagramKey != null && !diagramKey.isBlank()) {
            result = diagramSyncService.saveToRepository(diagramKey, editedNodes, shownIds);
        } else {
            String diagramXml = (String) delegateExecution.getVariable(DIAGRAM_XML);
            if (diagramXml == null || diagramXml.isBlank()) {
                throw new IllegalArgumentException("Either '" + DIAGRAM_KEY + "' or '" + DIAGRAM_XML + "' must be set");
            }
            result = diagramSyncService.save(diagramXml, editedNodes, shownIds);
        }

        delegateExecution.setVariable(DIAGRAM_XML, result.document());
        delegateExecution.setVariable(FORM_NODES, FormPayloadHelper.writeNodes(result.patch().nodes()));
        delegateExecution.setVariable(PATCH_APPLIED, result.patch().applied());
        if (!result.patch().applied()) {
            log.warn("Activity '{}': form edits were not applied to the diagram", delegateExecution.getCurrentActivityName());
        }
    }
}
