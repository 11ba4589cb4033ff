package org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models.FlowConfig;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.CellIdComparator;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Connection;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the main flow of a diagram and hangs every other node under a main-flow step.
 * <p>
 * The main flow is the longest simple path from a start node (no incoming connections) to an end
 * node (no outgoing connections). Start nodes are tried in id order and children in connection
 * order; a path only replaces the best one when it is strictly longer, so equal graphs always
 * produce the same flow.
 * <p>
 * Sub-step vertices listed in {@link DiagramGraph#subStepOwners()} are left out of the search and
 * hang under their owning step.
 */
@Slf4j
public class FlowAnalyzer {
    private final FlowConfig config;

    public FlowAnalyzer() {
        this(new FlowConfig());
    }

    public FlowAnalyzer(FlowConfig config) {
        this.config = config;
    }

    public FlowStructure analyze(DiagramGraph graph) {
        List<DiagramNode> nodes = graph.nodes();
        if (nodes.isEmpty()) {
            return FlowStructure.empty();
        }
        Adjacency adjacency = new Adjacency(nodes, graph.connections());
        Map<String, String> subStepOwners = subStepOwners(graph, adjacency);
        Adjacency flowGraph = subStepOwners.isEmpty()
                ? adjacency
                : new Adjacency(nodes.stream().filter(node -> !subStepOwners.containsKey(node.id())).toList(),
                graph.connections());

        List<String> path;
        if (flowGraph.edgeCount == 0) {
            path = new ArrayList<>(flowGraph.nodesById.keySet());
        } else {
            path = findLongestPath(flowGraph);
            if (path.isEmpty()) {
                log.debug("No start-to-end path found, falling back to topological order");
                path = topologicalOrder(flowGraph);
            }
        }

        List<DiagramNode> mainFlow = path.stream()
                .map(adjacency.nodesById::get)
                .toList();
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < path.size(); i++) {
            positions.put(path.get(i), i);
        }

        Map<String, List<DiagramNode>> branches = new LinkedHashMap<>();
        List<DiagramNode> orphans = new ArrayList<>();
        Map<String, List<DiagramNode>> byAnchor = new HashMap<>();
        for (DiagramNode node : adjacency.nodesById.values()) {
            if (positions.containsKey(node.id())) {
                continue;
            }
            String owner = subStepOwners.get(node.id());
            String anchor = owner != null && positions.containsKey(owner)
                    ? owner
                    : findAnchor(node.id(), adjacency, path, positions);
            if (anchor == null) {
                log.warn("Node {} ('{}') is not connected to the main flow", node.id(), node.label());
                orphans.add(node);
            } else {
                byAnchor.computeIfAbsent(anchor, key -> new ArrayList<>()).add(node);
            }
        }
        for (String mainId : path) {
            List<DiagramNode> anchored = byAnchor.get(mainId);
            if (anchored != null) {
                branches.put(mainId, anchored);
            }
        }

        return new FlowStructure(mainFlow, branches, orphans);
    }

    /**
     * Keeps the sub-step entries whose vertex and owner are both nodes of the graph.
     */
    private static Map<String, String> subStepOwners(DiagramGraph graph, Adjacency adjacency) {
        Map<String, String> owners = new HashMap<>();
        graph.subStepOwners().forEach((subStep, owner) -> {
            if (adjacency.nodesById.containsKey(subStep) && adjacency.nodesById.containsKey(owner)) {
                owners.put(subStep, owner);
            } else {
                log.debug("Ignoring sub-step {} of {}: not both in the diagram", subStep, owner);
            }
        });
        return owners;
    }

    private List<String> findLongestPath(Adjacency adjacency) {
        List<String> starts = adjacency.nodesById.keySet().stream()
                .filter(id -> adjacency.parents.get(id).isEmpty())
                .sorted(CellIdComparator.INSTANCE)
                .toList();

        PathSearch search = new PathSearch(adjacency, config.maxPathSearchSteps);
        for (String start : starts) {
            search.searchFrom(start);
            if (search.exhausted) {
                log.warn("Main flow search stopped after {} steps, keeping a path of {} nodes",
                        config.maxPathSearchSteps, search.best.size());
                break;
            }
        }
        return search.best;
    }

    private List<String> topologicalOrder(Adjacency adjacency) {
        String seed = adjacency.nodesById.keySet().stream()
                .filter(id -> adjacency.parents.get(id).isEmpty())
                .min(CellIdComparator.INSTANCE)
                .orElseGet(() -> adjacency.nodesById.keySet().stream()
                        .min(CellIdComparator.INSTANCE)
                        .orElseThrow());

        Map<String, Integer> inDegree = new HashMap<>();
        adjacency.parents.forEach((id, parents) -> inDegree.put(id, parents.size()));

        List<String> sorted = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(seed);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            sorted.add(current);
            for (String child : adjacency.children.get(current)) {
                int degree = inDegree.merge(child, -1, Integer::sum);
                if (degree == 0 && !visited.contains(child)) {
                    queue.add(child);
                }
            }
        }
        return sorted;
    }

    /**
     * Finds the main-flow node an off-flow node belongs under: a main-flow parent, else the anchor
     * of one of its parents (depth first), else the predecessor of a main-flow child.
     */
    private static String findAnchor(String nodeId, Adjacency adjacency, List<String> mainFlow,
                                     Map<String, Integer> positions) {
        Set<String> visited = new HashSet<>();
        Deque<AnchorFrame> stack = new ArrayDeque<>();
        visited.add(nodeId);
        String direct = mainFlowParent(nodeId, adjacency, positions);
        if (direct != null) {
            return direct;
        }
        stack.push(new AnchorFrame(nodeId));

        while (!stack.isEmpty()) {
            AnchorFrame frame = stack.peek();
            List<String> parents = adjacency.parents.get(frame.nodeId);
            if (frame.nextParent < parents.size()) {
                String parent = parents.get(frame.nextParent++);
                if (visited.add(parent)) {
                    String anchor = mainFlowParent(parent, adjacency, positions);
                    if (anchor != null) {
                        return anchor;
                    }
                    stack.push(new AnchorFrame(parent));
                }
                continue;
            }
            for (String child : adjacency.children.get(frame.nodeId)) {
                Integer index = positions.get(child);
                if (index != null) {
                    return index > 0 ? mainFlow.get(index - 1) : child;
                }
            }
            stack.pop();
        }
        return null;
    }

    private static String mainFlowParent(String nodeId, Adjacency adjacency, Map<String, Integer> positions) {
        for (String parent : adjacency.parents.get(nodeId)) {
            if (positions.containsKey(parent)) {
                return parent;
            }
        }
        return null;
    }

    private static class AnchorFrame {
        private final String nodeId;
        private int nextParent;

        AnchorFrame(String nodeId) {
            this.nodeId = nodeId;
        }
    }

    private static class Adjacency {
        private final Map<String, DiagramNode> nodesById = new LinkedHashMap<>();
        private final Map<String, List<String>> children = new HashMap<>();
        private final Map<String, List<String>> parents = new HashMap<>();
        private int edgeCount;

        Adjacency(List<DiagramNode> nodes, List<Connection> connections) {
            for (DiagramNode node : nodes) {
                if (nodesById.putIfAbsent(node.id(), node) != null) {
                    log.warn("Duplicate node id {}, keeping the first occurrence", node.id());
                    continue;
                }
                children.put(node.id(), new ArrayList<>());
                parents.put(node.id(), new ArrayList<>());
            }
            for (Connection connection : connections) {
                if (nodesById.containsKey(connection.from()) && nodesById.containsKey(connection.to())) {
                    children.get(connection.from()).add(connection.to());
                    parents.get(connection.to()).add(connection.from());
                    edgeCount++;
                }
            }
        }
    }

    /**
     * Depth-first search for the longest simple path, kept on an explicit stack so long chains do
     * not exhaust the call stack.
     */
    private static class PathSearch {
        private final Adjacency adjacency;
        private final long maxSteps;
        private long steps;
        private boolean exhausted;
        private List<String> best = List.of();

        PathSearch(Adjacency adjacency, long maxSteps) {
            this.adjacency = adjacency;
            this.maxSteps = maxSteps;
        }

        void searchFrom(String start) {
            Deque<PathFrame> stack = new ArrayDeque<>();
            Deque<String> path = new ArrayDeque<>();
            Set<String> visited = new HashSet<>();
            enter(start, stack, path, visited);

            while (!stack.isEmpty()) {
                PathFrame frame = stack.peek();
                List<String> next = adjacency.children.get(frame.nodeId);
                if (next.isEmpty()) {
                    if (path.size() > best.size()) {
                        best = new ArrayList<>(path);
                    }
                    leave(stack, path, visited);
                    continue;
                }
                if (frame.nextChild >= next.size()) {
                    leave(stack, path, visited);
                    continue;
                }
                String child = next.get(frame.nextChild++);
                if (++steps > maxSteps) {
                    exhausted = true;
                    return;
                }
                if (!visited.contains(child)) {
                    enter(child, stack, path, visited);
                }
            }
        }

        private static void enter(String nodeId, Deque<PathFrame> stack, Deque<String> path, Set<String> visited) {
            visited.add(nodeId);
            path.addLast(nodeId);
            stack.push(new PathFrame(nodeId));
        }

        private static void leave(Deque<PathFrame> stack, Deque<String> path, Set<String> visited) {
            PathFrame frame = stack.pop();
            path.removeLast();
            visited.remove(frame.nodeId);
        }
    }

    private static class PathFrame {
        private final String nodeId;
        private int nextChild;

        PathFrame(String nodeId) {
            this.nodeId = nodeId;
        }
    }
}
