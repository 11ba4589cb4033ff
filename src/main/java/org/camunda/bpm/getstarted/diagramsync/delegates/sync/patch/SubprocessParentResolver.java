package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Subprocess;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the positional parents of a sub-step list.
 * <p>
 * Returns one entry per sub-step: the index of the sibling it hangs under, or {@link #MAIN} when
 * it hangs under the step itself. References to a missing position, to the entry itself or
 * into a cycle fall back to the step.
 */
@Slf4j
public class SubprocessParentResolver {
    public static final int MAIN = -1;

    public static int[] resolve(List<Subprocess> subprocesses) {
        int size = subprocesses.size();
        int[] parents = new int[size];

        for (int i = 0; i < size; i++) {
            Subprocess sub = subprocesses.get(i);
            int index = sub.parentIndex();
            if (index >= 0 && index < size && index != i) {
                parents[i] = index;
            } else {
                if (!Subprocess.MAIN_PARENT.equals(sub.parent())) {
                    log.warn("Sub-step '{}' has unresolvable parent '{}', attaching it to the step", sub.name(), sub.parent());
                }
                parents[i] = MAIN;
            }
        }

        for (int i = 0; i < size; i++) {
            breakCycleFrom(i, parents, subprocesses);
        }
        return parents;
    }

    private static void breakCycleFrom(int start, int[] parents, List<Subprocess> subprocesses) {
        List<Integer> chain = new ArrayList<>();
        int current = start;
        while (current != MAIN) {
            if (chain.contains(current)) {
                int closing = chain.get(chain.size() - 1);
                log.warn("Sub-step '{}' closes a parent cycle, attaching it to the step", subprocesses.get(closing).name());
                parents[closing] = MAIN;
                return;
            }
            chain.add(current);
            current = parents[current];
        }
    }
}
