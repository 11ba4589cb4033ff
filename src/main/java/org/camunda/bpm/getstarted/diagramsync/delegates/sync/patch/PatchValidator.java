package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.DiagramXmlHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.GraphExtractor;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.MalformedDocumentException;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.ResolvedCell;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Cell;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a patched body against the body it was produced from. Problems the original already had
 * are tolerated; new ones are not.
 */
public class PatchValidator {

    /**
     * @throws StructuralValidationException if the patched body has no graph model root, or has a
     *                                       duplicate id or dangling edge endpoint the original did not have
     */
    public static void validate(String originalBody, String patchedBody) {
        if (patchedBody == null
                || !patchedBody.contains("<" + DiagramXmlHelper.GRAPH_MODEL_TAG)
                || !patchedBody.contains("<" + DiagramXmlHelper.ROOT_TAG)) {
            throw new StructuralValidationException("Patched body has no <mxGraphModel> root");
        }

        Document original = DiagramXmlHelper.parseBody(originalBody);
        Set<String> newDuplicates;
        Set<String> newDangling;
        try {
            Document patched = DiagramXmlHelper.parseBody(patchedBody);
            newDuplicates = duplicateIds(patched);
            newDangling = danglingEndpoints(patched);
        } catch (MalformedDocumentException e) {
            throw new StructuralValidationException("Patched body is not a valid graph model", e);
        }

        newDuplicates.removeAll(duplicateIds(original));
        if (!newDuplicates.isEmpty()) {
            throw new StructuralValidationException("Patched body has duplicate cell ids " + newDuplicates);
        }

        newDangling.removeAll(danglingEndpoints(original));
        if (!newDangling.isEmpty()) {
            throw new StructuralValidationException("Patched body has edges pointing at missing cells " + newDangling);
        }
    }

    static Set<String> duplicateIds(Document doc) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        NodeList elements = doc.getElementsByTagName("*");
        for (int i = 0; i < elements.getLength(); i++) {
            Element element = (Element) elements.item(i);
            if (element.hasAttribute("id") && !seen.add(element.getAttribute("id"))) {
                duplicates.add(element.getAttribute("id"));
            }
        }
        return duplicates;
    }

    /**
     * Returns {@code edgeId->missingId} for every edge end that refers to an unknown id.
     */
    static Set<String> danglingEndpoints(Document doc) {
        Set<String> ids = new HashSet<>();
        NodeList elements = doc.getElementsByTagName("*");
        for (int i = 0; i < elements.getLength(); i++) {
            Element element = (Element) elements.item(i);
            if (element.hasAttribute("id")) {
                ids.add(element.getAttribute("id"));
            }
        }

        Set<String> dangling = new LinkedHashSet<>();
        List<ResolvedCell> cells = GraphExtractor.resolveCells(doc);
        for (ResolvedCell resolved : cells) {
            Cell cell = resolved.cell();
            if (!cell.isEdge()) {
                continue;
            }
            if (cell.source() != null && !ids.contains(cell.source())) {
                dangling.add(cell.id() + "->" + cell.source());
            }
            if (cell.target() != null && !ids.contains(cell.target())) {
                dangling.add(cell.id() + "->" + cell.target());
            }
        }
        return dangling;
    }
}
