package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.DiagramXmlHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.GraphExtractor;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.LabelHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.ResolvedCell;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.StyleHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Cell;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.CellKind;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.DiagramXmlHelper.CELL_TAG;
import static org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.DiagramXmlHelper.GEOMETRY_TAG;
import static org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.DiagramXmlHelper.attribute;

/**
 * A parsed diagram body that can be edited cell by cell and written back once.
 * <p>
 * Keeps its cell list in step with the DOM, so lookups after an edit see the edit.
 */
@Slf4j
public class DiagramDocument {
    private static final String WRAPPER_TAG = "UserObject";

    private final Document doc;
    private final Element root;
    private final List<ResolvedCell> cells;
    private int modifications;

    private DiagramDocument(Document doc) {
        this.doc = doc;
        this.root = DiagramXmlHelper.findCellRoot(doc);
        this.cells = new ArrayList<>(GraphExtractor.resolveCells(doc));
    }

    /**
     * @throws org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.MalformedDocumentException
     *         if the body is not a graph model
     */
    public static DiagramDocument parse(String body) {
        return new DiagramDocument(DiagramXmlHelper.parseBody(body));
    }

    public DiagramGraph toGraph() {
        return GraphExtractor.toGraph(cells.stream().map(ResolvedCell::cell).toList());
    }

    public ResolvedCell find(String id) {
        if (id == null) {
            return null;
        }
        for (ResolvedCell cell : cells) {
            if (id.equals(cell.cell().id())) {
                return cell;
            }
        }
        return null;
    }

    public ResolvedCell findVertex(String id) {
        ResolvedCell cell = find(id);
        return cell != null && cell.cell().isVertex() ? cell : null;
    }

    public List<ResolvedCell> edges() {
        return cells.stream().filter(cell -> cell.cell().isEdge()).toList();
    }

    /**
     * Every {@code id} attribute in the document, including the root and layer cells and
     * anything the extractor does not model.
     */
    public Set<String> allIds() {
        Set<String> ids = new LinkedHashSet<>();
        NodeList elements = doc.getElementsByTagName("*");
        for (int i = 0; i < elements.getLength(); i++) {
            Element element = (Element) elements.item(i);
            if (element.hasAttribute("id")) {
                ids.add(element.getAttribute("id"));
            }
        }
        return ids;
    }

    public String currentLabel(ResolvedCell cell) {
        String label = attribute(cell.labelElement(), cell.labelAttribute());
        return label == null ? "" : label;
    }

    public String currentStyle(ResolvedCell cell) {
        String style = attribute(cell.cellElement(), "style");
        return style == null ? "" : style;
    }

    public String currentOwner(ResolvedCell cell) {
        return attribute(cell.wrapperElement(), "owner");
    }

    /**
     * Writes form text as the label of a cell. Returns false when the cell already shows that text.
     */
    public boolean updateLabel(ResolvedCell cell, String text) {
        String current = currentLabel(cell);
        if (LabelHelper.sameText(current, text)) {
            return false;
        }
        String stored = LabelHelper.toStoredLabel(text, StyleHelper.isHtml(currentStyle(cell)));
        cell.labelElement().setAttribute(cell.labelAttribute(), stored);
        modified("label", cell);
        return true;
    }

    public boolean updateStyle(ResolvedCell cell, String style) {
        if (style.equals(currentStyle(cell))) {
            return false;
        }
        cell.cellElement().setAttribute("style", style);
        modified("style", cell);
        return true;
    }

    /**
     * Sets the owner property of a cell, wrapping a plain cell in a {@code UserObject} the way the
     * editor stores custom properties. A blank owner removes the property.
     *
     * @return the cell as it is now, possibly with a new wrapper
     */
    public ResolvedCell updateOwner(ResolvedCell cell, String owner) {
        String current = currentOwner(cell);
        boolean blank = owner == null || owner.isBlank();
        if (blank) {
            if (current != null && !current.isEmpty()) {
                cell.wrapperElement().removeAttribute("owner");
                modified("owner", cell);
            }
            return cell;
        }
        if (owner.equals(current)) {
            return cell;
        }
        if (cell.wrapperElement() != null) {
            cell.wrapperElement().setAttribute("owner", owner);
            modified("owner", cell);
            return cell;
        }

        Element cellEl = cell.cellElement();
        Element wrapper = doc.createElement(WRAPPER_TAG);
        wrapper.setAttribute("label", cellEl.hasAttribute("value") ? cellEl.getAttribute("value") : "");
        wrapper.setAttribute("owner", owner);
        wrapper.setAttribute("id", cellEl.getAttribute("id"));
        cellEl.getParentNode().replaceChild(wrapper, cellEl);
        cellEl.removeAttribute("id");
        cellEl.removeAttribute("value");
        wrapper.appendChild(cellEl);

        Cell wrappedCell = cell.cell().toBuilder().owner(owner).wrapped(true).build();
        ResolvedCell wrapped = new ResolvedCell(wrappedCell, cellEl, wrapper);
        cells.set(cells.indexOf(cell), wrapped);
        modified("owner", wrapped);
        return wrapped;
    }

    public ResolvedCell addVertex(String id, String label, String style, String parent,
                                  double x, double y, double width, double height) {
        Element cellEl = doc.createElement(CELL_TAG);
        cellEl.setAttribute("id", id);
        cellEl.setAttribute("value", label);
        cellEl.setAttribute("style", style);
        cellEl.setAttribute("vertex", "1");
        cellEl.setAttribute("parent", parent);

        Element geometry = doc.createElement(GEOMETRY_TAG);
        geometry.setAttribute("x", formatNumber(x));
        geometry.setAttribute("y", formatNumber(y));
        geometry.setAttribute("width", formatNumber(width));
        geometry.setAttribute("height", formatNumber(height));
        geometry.setAttribute("as", "geometry");
        cellEl.appendChild(geometry);

        return append(cellEl, Cell.builder()
                .id(id)
                .kind(CellKind.VERTEX)
                .style(style)
                .label(label)
                .x(x)
                .y(y)
                .width(width)
                .height(height)
                .parent(parent)
                .build());
    }

    public ResolvedCell addEdge(String id, String source, String target, String style, String parent) {
        Element cellEl = doc.createElement(CELL_TAG);
        cellEl.setAttribute("id", id);
        cellEl.setAttribute("style", style);
        cellEl.setAttribute("edge", "1");
        cellEl.setAttribute("parent", parent);
        cellEl.setAttribute("source", source);
        cellEl.setAttribute("target", target);

        Element geometry = doc.createElement(GEOMETRY_TAG);
        geometry.setAttribute("relative", "1");
        geometry.setAttribute("as", "geometry");
        cellEl.appendChild(geometry);

        return append(cellEl, Cell.builder()
                .id(id)
                .kind(CellKind.EDGE)
                .style(style)
                .label("")
                .parent(parent)
                .source(source)
                .target(target)
                .build());
    }

    /**
     * Removes a vertex together with every cell nested under it and every edge touching any of
     * those cells.
     *
     * @return the ids of all removed cells
     */
    public Set<String> removeVertex(String id) {
        Set<String> doomed = new LinkedHashSet<>();
        doomed.add(id);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (ResolvedCell cell : cells) {
                Cell c = cell.cell();
                if (doomed.contains(c.id())) {
                    continue;
                }
                if (doomed.contains(c.parent())
                        || (c.isEdge() && (doomed.contains(c.source()) || doomed.contains(c.target())))) {
                    doomed.add(c.id());
                    grew = true;
                }
            }
        }

        List<ResolvedCell> removed = cells.stream()
                .filter(cell -> doomed.contains(cell.cell().id()))
                .toList();
        removed.forEach(this::detach);
        log.debug("Removed vertex {} with {} dependent cells", id, removed.size() - 1);
        return doomed;
    }

    public void removeEdge(ResolvedCell edge) {
        detach(edge);
    }

    public boolean isModified() {
        return modifications > 0;
    }

    public String write() {
        return DiagramXmlHelper.writeBody(doc);
    }

    private ResolvedCell append(Element cellEl, Cell cell) {
        root.appendChild(cellEl);
        ResolvedCell resolved = new ResolvedCell(cell, cellEl, null);
        cells.add(resolved);
        modified("add", resolved);
        return resolved;
    }

    private void detach(ResolvedCell cell) {
        Element outer = cell.outerElement();
        Node parent = outer.getParentNode();
        if (parent != null) {
            parent.removeChild(outer);
        }
        cells.remove(cell);
        modified("remove", cell);
    }

    private void modified(String change, ResolvedCell cell) {
        modifications++;
        log.debug("{} {}", change, cell.cell().id());
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
