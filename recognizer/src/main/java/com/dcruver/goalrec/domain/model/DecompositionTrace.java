package com.dcruver.goalrec.domain.model;

import lombok.Data;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Method choices taken while decomposing a plan.
 * One entry per distinct compound task name with the number of alternative
 * methods the model offers for it, plus the ids of the methods actually used.
 */
@Data
public class DecompositionTrace {
    private final Map<String, Integer> methodCounts;
    private final Set<Integer> usedMethodIds;

    public DecompositionTrace(Map<String, Integer> methodCounts, Set<Integer> usedMethodIds) {
        this.methodCounts = Collections.unmodifiableMap(new TreeMap<>(methodCounts));
        this.usedMethodIds = Collections.unmodifiableSet(new TreeSet<>(usedMethodIds));
    }

    public static DecompositionTrace empty() {
        return new DecompositionTrace(Map.of(), Set.of());
    }

    public boolean isEmpty() {
        return methodCounts.isEmpty();
    }
}
