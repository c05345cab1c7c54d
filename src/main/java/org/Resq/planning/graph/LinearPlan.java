package org.Resq.planning.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Resq.planning.domain.GroundAction;

import java.util.List;

/**
 * Totally ordered, duplicate-free action sequence in execution order.
 *
 * <p>Not guaranteed minimal: supporters are chosen by catalog order.</p>
 */
@Value
@Builder
public class LinearPlan {
    /** Actions in execution order. */
    @Singular("step")
    List<GroundAction> steps;

    /**
     * Returns step names in execution order.
     */
    public List<String> getStepNames() {
        return steps.stream().map(GroundAction::getName).toList();
    }

    /**
     * Returns the zero-based position of the named step, or -1.
     */
    public int indexOf(String actionName) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getName().equals(actionName)) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
