package com.dcruver.goalrec.domain.scoring;

import com.dcruver.goalrec.domain.model.GroundedModel;
import com.dcruver.goalrec.domain.model.Plan;
import com.dcruver.goalrec.domain.model.Task;
import com.dcruver.goalrec.domain.model.WorldState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stage II: probability of the plan's total order when, at each step, the next
 * action is picked uniformly among the available ones. An action is available
 * when no pending action precedes it and its preconditions hold in the
 * simulated state.
 * <p>
 * An empty available set is counted as one option. This is an approximation
 * of what the planner could do, so every clamp is logged and counted.
 */
@Component
@Slf4j
public class LinearizationScorer {

    public LinearizationResult score(GroundedModel model, Plan plan, OrderingRelation ordering) {
        WorldState state = WorldState.initialOf(model);
        Set<Integer> remaining = new LinkedHashSet<>(plan.getActions());
        List<Integer> availableCounts = new ArrayList<>(plan.size());

        double logProbability = 0.0;
        int clamped = 0;

        for (int step = 0; step < plan.size(); step++) {
            Task selected = model.getTask(plan.actionAt(step));

            int available = countAvailable(model, remaining, ordering, state);
            availableCounts.add(available);
            if (available == 0) {
                clamped++;
                log.warn("Step {} ({}): no action available under ordering and state, counted as 1",
                    step + 1, selected.getName());
            }
            int options = Math.max(available, 1);
            logProbability -= Math.log(options);

            log.debug("  Step {}: {} | |A_{}| = {} | P = {}",
                step + 1, selected.getName(), step + 1, options, 1.0 / options);

            state.apply(selected);
            remaining.remove(selected.getId());
        }

        log.debug("Stage II: log P = {} over {} steps ({} clamped)", logProbability, plan.size(), clamped);
        return LinearizationResult.builder()
            .logProbability(logProbability)
            .availableCounts(List.copyOf(availableCounts))
            .clampedSteps(clamped)
            .build();
    }

    private int countAvailable(GroundedModel model, Set<Integer> remaining,
                               OrderingRelation ordering, WorldState state) {
        int count = 0;
        for (int candidate : remaining) {
            if (!ordering.hasPendingPredecessor(candidate, remaining)
                && state.isApplicable(model.getTask(candidate))) {
                count++;
            }
        }
        return count;
    }
}
