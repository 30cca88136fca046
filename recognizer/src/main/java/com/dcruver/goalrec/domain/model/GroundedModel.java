package com.dcruver.goalrec.domain.model;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Read-only view of a grounded HTN planning model.
 * Implementations must not change while a scoring pass is running;
 * one instance is shared by every hypothesis scored against it.
 */
public interface GroundedModel {

    List<Task> getTasks();

    List<Method> getMethods();

    Task getTask(int taskId);

    Method getMethod(int methodId);

    /**
     * Methods decomposing the given task, empty for primitive tasks
     */
    List<Method> getMethodsFor(int taskId);

    /**
     * Proposition ids true in the initial state
     */
    Set<Integer> getInitialState();

    /**
     * Look up a task by name. Exact match first, case-insensitive as fallback.
     */
    OptionalInt findTaskId(String name);

    /**
     * Look up a method by name among the methods of one task
     */
    OptionalInt findMethodId(String methodName, int taskId);

    default int getTaskCount() {
        return getTasks().size();
    }

    default int getMethodCount() {
        return getMethods().size();
    }
}
