package org.camunda.bpm.getstarted.diagramsync.delegates.sync.form;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow.FlowStructure;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.LabelHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Connection;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Subprocess;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the form view of a diagram and applies the form's sub-step edits.
 * <p>
 * A step's sub-step list is the detected sub-steps (off-flow nodes anchored to the step) followed
 * by the user-authored ones persisted from the last save. Positional parents
 * ({@code "subprocess-<k>"}) always refer to that merged list.
 */
@Slf4j
public class FormViewHelper {

    public static FormView buildFormView(DiagramGraph graph, FlowStructure flow,
                                         List<DiagramNode> persistedNodes, FormSession session) {
        return buildFormView(null, graph, flow, persistedNodes, session);
    }

    public static FormView buildFormView(String diagramName, DiagramGraph graph, FlowStructure flow,
                                         List<DiagramNode> persistedNodes, FormSession session) {
        Map<String, DiagramNode> persistedById = new HashMap<>();
        if (persistedNodes != null) {
            persistedNodes.forEach(node -> persistedById.putIfAbsent(node.id(), node));
        }
        FormSession activeSession = session != null ? session : new FormSession();

        List<DiagramNode> steps = new ArrayList<>();
        for (DiagramNode mainNode : flow.mainFlow()) {
            DiagramNode persisted = persistedById.get(mainNode.id());
            List<Subprocess> merged = mergeSubprocesses(mainNode, flow.branchesOf(mainNode.id()),
                    graph.connections(), persisted, activeSession);
            steps.add(mainNode.toBuilder()
                    .owner(resolveOwner(mainNode, persisted))
                    .subprocesses(merged)
                    .build());
        }

        return new FormView(diagramName, steps, flow.branchesByMainNode(), graph.connections());
    }

    /**
     * Merges the detected sub-steps of a step with the user-authored ones. Detected entries that
     * a user entry already covers (same name, same {@code branchId} or same vertex id) or that were
     * removed in this session are dropped.
     */
    public static List<Subprocess> mergeSubprocesses(DiagramNode mainNode, List<DiagramNode> branches,
                                                     List<Connection> connections, DiagramNode persisted,
                                                     FormSession session) {
        List<Subprocess> persistedList = persisted != null ? persisted.subprocesses() : List.of();
        List<Subprocess> userEntries = persistedList.stream()
                .filter(sub -> !sub.detected())
                .toList();

        List<Subprocess> detected = new ArrayList<>();
        List<String> detectedIds = new ArrayList<>();
        for (DiagramNode branch : branches) {
            String name = detectedName(branch);
            if (session.isDeleted(mainNode.id(), name)) {
                log.debug("Skipping detected sub-step '{}' of {}: removed in this session", name, mainNode.id());
                continue;
            }
            if (coveredByUser(branch, name, userEntries)) {
                continue;
            }
            detected.add(Subprocess.builder()
                    .name(name)
                    .shape(branch.shape())
                    .parent(detectedParent(branch.id(), mainNode.id(), detectedIds, connections))
                    .detected(true)
                    .branchId(branch.id())
                    .id(branch.id())
                    .build());
            detectedIds.add(branch.id());
        }

        List<Subprocess> merged = new ArrayList<>(detected);
        merged.addAll(userEntries);
        return remapUserParents(merged, detected.size(), persistedList);
    }

    public static DiagramNode addSubprocess(DiagramNode node, Subprocess subprocess) {
        List<Subprocess> subprocesses = new ArrayList<>(node.subprocesses());
        subprocesses.add(subprocess.toBuilder().detected(false).build());
        return node.withSubprocesses(subprocesses);
    }

    /**
     * Replaces the sub-step at {@code index}. The result is always user-authored; the vertex it was
     * detected from stays attached through {@code branchId} and {@code id}.
     */
    public static DiagramNode editSubprocess(DiagramNode node, int index, Subprocess edited) {
        List<Subprocess> subprocesses = new ArrayList<>(node.subprocesses());
        checkIndex(node, index);
        Subprocess current = subprocesses.get(index);
        subprocesses.set(index, edited.toBuilder()
                .detected(false)
                .branchId(edited.branchId() != null ? edited.branchId() : current.branchId())
                .id(edited.id() != null ? edited.id() : current.id())
                .build());
        return node.withSubprocesses(subprocesses);
    }

    /**
     * Removes the sub-step at {@code index} and shifts later positional parents down. Entries that
     * pointed at the removed one attach to the step itself.
     */
    public static DiagramNode removeSubprocess(DiagramNode node, int index, FormSession session) {
        checkIndex(node, index);
        Subprocess removed = node.subprocesses().get(index);
        if (session != null) {
            session.recordDeletion(node.id(), removed.name());
        }

        List<Subprocess> remaining = new ArrayList<>();
        for (int i = 0; i < node.subprocesses().size(); i++) {
            if (i == index) {
                continue;
            }
            Subprocess sub = node.subprocesses().get(i);
            int parentIndex = sub.parentIndex();
            if (parentIndex == index) {
                sub = sub.toBuilder().parent(Subprocess.MAIN_PARENT).build();
            } else if (parentIndex > index) {
                sub = sub.toBuilder().parent(Subprocess.siblingParent(parentIndex - 1)).build();
            }
            remaining.add(sub);
        }
        return node.withSubprocesses(remaining);
    }

    static String detectedName(DiagramNode branch) {
        String text = LabelHelper.toPlainText(branch.label());
        return text.isEmpty() ? branch.id() : text;
    }

    private static String resolveOwner(DiagramNode mainNode, DiagramNode persisted) {
        if (mainNode.owner() != null && !mainNode.owner().isBlank()) {
            return mainNode.owner();
        }
        return persisted != null ? persisted.owner() : null;
    }

    private static boolean coveredByUser(DiagramNode branch, String name, List<Subprocess> userEntries) {
        for (Subprocess user : userEntries) {
            if (user.hasName() && LabelHelper.toPlainText(user.name()).equals(name)) {
                return true;
            }
            if (branch.id().equals(user.branchId()) || branch.id().equals(user.id())) {
                return true;
            }
        }
        return false;
    }

    private static String detectedParent(String branchId, String mainId, List<String> earlierDetected,
                                         List<Connection> connections) {
        String siblingParent = null;
        for (Connection connection : connections) {
            if (!branchId.equals(connection.to())) {
                continue;
            }
            if (mainId.equals(connection.from())) {
                return Subprocess.MAIN_PARENT;
            }
            int sibling = earlierDetected.indexOf(connection.from());
            if (sibling >= 0 && siblingParent == null) {
                siblingParent = Subprocess.siblingParent(sibling);
            }
        }
        return siblingParent != null ? siblingParent : Subprocess.MAIN_PARENT;
    }

    /**
     * User entries were saved with parents pointing into the list as it was then. Re-points them
     * at the same entries in the merged list, or at the step when the entry is gone.
     */
    private static List<Subprocess> remapUserParents(List<Subprocess> merged, int firstUserIndex,
                                                     List<Subprocess> persistedList) {
        List<Subprocess> result = new ArrayList<>(merged.subList(0, firstUserIndex));
        for (int i = firstUserIndex; i < merged.size(); i++) {
            Subprocess user = merged.get(i);
            int oldIndex = user.parentIndex();
            if (oldIndex < 0) {
                result.add(user);
                continue;
            }
            int newIndex = oldIndex < persistedList.size()
                    ? indexInMerged(persistedList.get(oldIndex), merged)
                    : -1;
            String parent = newIndex >= 0 && newIndex != i
                    ? Subprocess.siblingParent(newIndex)
                    : Subprocess.MAIN_PARENT;
            if (!parent.equals(user.parent())) {
                log.debug("Re-pointing sub-step '{}' from {} to {}", user.name(), user.parent(), parent);
                user = user.toBuilder().parent(parent).build();
            }
            result.add(user);
        }
        return result;
    }

    private static int indexInMerged(Subprocess target, List<Subprocess> merged) {
        for (int i = 0; i < merged.size(); i++) {
            if (merged.get(i) == target) {
                return i;
            }
        }
        for (int i = 0; i < merged.size(); i++) {
            Subprocess candidate = merged.get(i);
            if (target.branchId() != null && target.branchId().equals(candidate.branchId())) {
                return i;
            }
            if (target.id() != null && target.id().equals(candidate.id())) {
                return i;
            }
        }
        for (int i = 0; i < merged.size(); i++) {
            if (target.hasName() && Objects.equals(target.name(), merged.get(i).name())) {
                return i;
            }
        }
        return -1;
    }

    private static void checkIndex(DiagramNode node, int index) {
        if (index < 0 || index >= node.subprocesses().size()) {
            throw new IllegalArgumentException(String.format(
                    "Node %s has no sub-step at position %d", node.id(), index));
        }
    }
}
