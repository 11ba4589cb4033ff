package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Cell;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.CellKind;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Connection;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.DiagramXmlHelper.CELL_TAG;
import static org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.DiagramXmlHelper.GEOMETRY_TAG;
import static org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.DiagramXmlHelper.attribute;

@Slf4j
public class GraphExtractor {
    private static final Set<String> WRAPPER_TAGS = Set.of("UserObject", "object");

    /**
     * Parses a decompressed diagram body into nodes and connections.
     *
     * @param body the {@code <mxGraphModel>} body
     * @return the extracted graph
     * @throws MalformedDocumentException if the body cannot be parsed
     */
    public static DiagramGraph extract(String body) {
        List<Cell> cells = resolveCells(DiagramXmlHelper.parseBody(body)).stream()
                .map(ResolvedCell::cell)
                .toList();
        return toGraph(cells);
    }

    /**
     * Same as {@link #extract(String)}, but a corrupt body yields an empty graph so that a bad
     * upload does not block the rest of the pipeline.
     */
    public static DiagramGraph extractOrEmpty(String body) {
        try {
            return extract(body);
        } catch (MalformedDocumentException e) {
            log.warn("Diagram body could not be parsed, using an empty graph: {}", e.getMessage());
            return DiagramGraph.empty();
        }
    }

    public static List<Cell> resolveCells(String body) {
        return resolveCells(DiagramXmlHelper.parseBody(body)).stream()
                .map(ResolvedCell::cell)
                .toList();
    }

    /**
     * Collects every vertex and edge cell of a parsed body, in document order, including cells
     * nested in {@code UserObject}/{@code object} wrappers.
     */
    public static List<ResolvedCell> resolveCells(Document doc) {
        Element root = DiagramXmlHelper.findCellRoot(doc);
        List<ResolvedCell> cells = new ArrayList<>();
        collectCells(root, cells);
        return cells;
    }

    private static void collectCells(Element container, List<ResolvedCell> cells) {
        for (Element child : DiagramXmlHelper.childElements(container)) {
            String tag = child.getTagName();
            if (CELL_TAG.equals(tag)) {
                addIfGraphCell(resolveCell(child, null), cells);
            } else if (WRAPPER_TAGS.contains(tag)) {
                Element inner = DiagramXmlHelper.firstChildElement(child, CELL_TAG);
                if (inner != null) {
                    addIfGraphCell(resolveCell(inner, child), cells);
                } else {
                    log.debug("Skipping <{}> id={} without an inner cell", tag, child.getAttribute("id"));
                }
            } else if (!GEOMETRY_TAG.equals(tag)) {
                collectCells(child, cells);
            }
        }
    }

    private static void addIfGraphCell(ResolvedCell resolved, List<ResolvedCell> cells) {
        if (resolved.cell().kind() != null && resolved.cell().id() != null) {
            cells.add(resolved);
        }
    }

    /**
     * Resolves the effective id/label pair of a cell: the inner cell id when it has one, else the
     * wrapper id; the wrapper {@code label} when present, else the cell {@code value}.
     */
    static ResolvedCell resolveCell(Element cellEl, Element wrapperEl) {
        String id = attribute(cellEl, "id");
        if (id == null || id.isEmpty()) {
            id = attribute(wrapperEl, "id");
        }

        String label = attribute(wrapperEl, "label");
        if (label == null) {
            label = attribute(cellEl, "value");
        }

        Element geometry = findGeometry(cellEl);

        Cell cell = Cell.builder()
                .id(id == null || id.isEmpty() ? null : id)
                .kind(kindOf(cellEl))
                .style(nullToEmpty(attribute(cellEl, "style")))
                .label(nullToEmpty(label))
                .x(number(geometry, "x"))
                .y(number(geometry, "y"))
                .width(number(geometry, "width"))
                .height(number(geometry, "height"))
                .parent(attribute(cellEl, "parent"))
                .source(emptyToNull(attribute(cellEl, "source")))
                .target(emptyToNull(attribute(cellEl, "target")))
                .owner(emptyToNull(attribute(wrapperEl, "owner")))
                .wrapped(wrapperEl != null)
                .build();
        return new ResolvedCell(cell, cellEl, wrapperEl);
    }

    /**
     * Promotes resolved cells to nodes and connections. Edge labels (vertices parented to an
     * edge) are not steps, and edges without both ends are not connections.
     */
    public static DiagramGraph toGraph(List<Cell> cells) {
        Set<String> edgeIds = cells.stream()
                .filter(Cell::isEdge)
                .map(Cell::id)
                .collect(Collectors.toCollection(HashSet::new));

        List<DiagramNode> nodes = new ArrayList<>();
        List<Connection> connections = new ArrayList<>();
        Map<String, String> subStepOwners = new LinkedHashMap<>();
        for (Cell cell : cells) {
            if (cell.isVertex()) {
                if (isEdgeLabel(cell, edgeIds)) {
                    continue;
                }
                nodes.add(toNode(cell));
                String owner = StyleHelper.subStepOwner(cell.style());
                if (owner != null && cell.id() != null && !owner.equals(cell.id())) {
                    subStepOwners.putIfAbsent(cell.id(), owner);
                }
            } else if (cell.source() != null && cell.target() != null) {
                connections.add(toConnection(cell));
            }
        }

        log.debug("Extracted {} nodes and {} connections from {} cells", nodes.size(), connections.size(), cells.size());
        return new DiagramGraph(nodes, connections, subStepOwners);
    }

    public static DiagramNode toNode(Cell cell) {
        return DiagramNode.builder()
                .id(cell.id())
                .label(cell.label())
                .shape(StyleHelper.inferShape(cell.style()))
                .x(cell.x())
                .y(cell.y())
                .width(cell.width())
                .height(cell.height())
                .owner(cell.owner())
                .subprocesses(List.of())
                .build();
    }

    public static Connection toConnection(Cell cell) {
        Map<String, String> style = StyleHelper.parse(cell.style());
        String dashed = style.get("dashed");
        return Connection.builder()
                .from(cell.source())
                .to(cell.target())
                .id(cell.id())
                .style(cell.style())
                .strokeWidth(style.get("strokeWidth"))
                .strokeColor(style.get("strokeColor"))
                .endArrow(style.get("endArrow"))
                .startArrow(style.get("startArrow"))
                .dashed(dashed == null ? null : "1".equals(dashed) || "true".equalsIgnoreCase(dashed))
                .dashPattern(style.get("dashPattern"))
                .build();
    }

    private static boolean isEdgeLabel(Cell cell, Set<String> edgeIds) {
        return (cell.parent() != null && edgeIds.contains(cell.parent()))
                || StyleHelper.parse(cell.style()).containsKey("edgeLabel");
    }

    private static CellKind kindOf(Element cellEl) {
        if (isSet(attribute(cellEl, "vertex"))) {
            return CellKind.VERTEX;
        }
        if (isSet(attribute(cellEl, "edge"))) {
            return CellKind.EDGE;
        }
        return null;
    }

    private static boolean isSet(String flag) {
        return "1".equals(flag) || "true".equalsIgnoreCase(flag);
    }

    private static Element findGeometry(Element cellEl) {
        Element fallback = null;
        for (Element child : DiagramXmlHelper.childElements(cellEl)) {
            if (GEOMETRY_TAG.equals(child.getTagName())) {
                if ("geometry".equals(child.getAttribute("as"))) {
                    return child;
                }
                if (fallback == null) {
                    fallback = child;
                }
            }
        }
        return fallback;
    }

    private static double number(Element element, String name) {
        String value = attribute(element, name);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {}='{}'", name, value);
            return 0;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
