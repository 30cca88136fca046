package com.dcruver.goalrec.domain.scoring;

import com.dcruver.goalrec.domain.model.GroundedModel;
import com.dcruver.goalrec.domain.model.Method;
import com.dcruver.goalrec.domain.model.SubtaskOrdering;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the precedence relation between tasks from the orderings of the
 * methods a decomposition actually used. Orderings of unused methods are
 * ignored so they cannot block tasks that were never decomposed that way.
 */
@Component
@Slf4j
public class OrderingConstraintResolver {

    public OrderingRelation resolve(GroundedModel model, Collection<Integer> usedMethodIds) {
        Set<Precedence> pairs = new LinkedHashSet<>();
        for (int methodId : usedMethodIds) {
            Method method = model.getMethod(methodId);
            for (SubtaskOrdering ordering : method.getOrderings()) {
                pairs.add(new Precedence(
                    method.subtaskAt(ordering.getBeforeIndex()),
                    method.subtaskAt(ordering.getAfterIndex())));
            }
        }

        int declared = pairs.size();
        OrderingRelation relation = new OrderingRelation(close(pairs));
        log.info("Ordering constraints from {} used methods (of {}): {} declared, {} after closure",
            usedMethodIds.size(), model.getMethodCount(), declared, relation.size());
        if (relation.hasCycle()) {
            log.warn("Method orderings are cyclic; affected tasks will never become available");
        }
        return relation;
    }

    /**
     * Transitive closure by repeated passes: every chain (a,b),(b,c) adds (a,c)
     * until a full pass adds nothing.
     */
    public static Set<Precedence> close(Set<Precedence> pairs) {
        Set<Precedence> closure = new LinkedHashSet<>(pairs);
        boolean changed = true;
        while (changed) {
            List<Precedence> added = new ArrayList<>();
            for (Precedence first : closure) {
                for (Precedence second : closure) {
                    if (first.getAfter() == second.getBefore()) {
                        Precedence chained = new Precedence(first.getBefore(), second.getAfter());
                        if (!closure.contains(chained)) {
                            added.add(chained);
                        }
                    }
                }
            }
            changed = closure.addAll(added);
        }
        return closure;
    }
}
