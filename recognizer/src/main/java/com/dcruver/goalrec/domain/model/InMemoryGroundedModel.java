package com.dcruver.goalrec.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable in-memory grounded model.
 * Task ids and method ids are positions in the respective lists.
 */
public final class InMemoryGroundedModel implements GroundedModel {

    private final List<Task> tasks;
    private final List<Method> methods;
    private final Set<Integer> initialState;
    private final Map<Integer, List<Method>> methodsByTask;
    private final Map<String, Integer> taskIdsByName;
    private final Map<String, Integer> taskIdsByLowerName;

    private InMemoryGroundedModel(List<Task> tasks, List<Method> methods, Set<Integer> initialState) {
        this.tasks = List.copyOf(tasks);
        this.methods = List.copyOf(methods);
        this.initialState = Collections.unmodifiableSet(new LinkedHashSet<>(initialState));

        Map<Integer, List<Method>> byTask = new HashMap<>();
        for (Method method : methods) {
            byTask.computeIfAbsent(method.getTaskId(), id -> new ArrayList<>()).add(method);
        }
        byTask.replaceAll((id, list) -> List.copyOf(list));
        this.methodsByTask = Map.copyOf(byTask);

        Map<String, Integer> byName = new HashMap<>();
        Map<String, Integer> byLowerName = new HashMap<>();
        for (Task task : tasks) {
            byName.putIfAbsent(task.getName(), task.getId());
            byLowerName.putIfAbsent(task.getName().toLowerCase(Locale.ROOT), task.getId());
        }
        this.taskIdsByName = Map.copyOf(byName);
        this.taskIdsByLowerName = Map.copyOf(byLowerName);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<Task> getTasks() {
        return tasks;
    }

    @Override
    public List<Method> getMethods() {
        return methods;
    }

    @Override
    public Task getTask(int taskId) {
        return tasks.get(taskId);
    }

    @Override
    public Method getMethod(int methodId) {
        return methods.get(methodId);
    }

    @Override
    public List<Method> getMethodsFor(int taskId) {
        return methodsByTask.getOrDefault(taskId, List.of());
    }

    @Override
    public Set<Integer> getInitialState() {
        return initialState;
    }

    @Override
    public OptionalInt findTaskId(String name) {
        if (name == null) {
            return OptionalInt.empty();
        }
        Integer id = taskIdsByName.get(name);
        if (id == null) {
            id = taskIdsByLowerName.get(name.toLowerCase(Locale.ROOT));
        }
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    @Override
    public OptionalInt findMethodId(String methodName, int taskId) {
        for (Method method : getMethodsFor(taskId)) {
            if (method.getName().equals(methodName)) {
                return OptionalInt.of(method.getId());
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Incremental construction of a model. Ids are handed out in insertion order.
     */
    public static final class Builder {
        private final List<Task> tasks = new ArrayList<>();
        private final List<Method> methods = new ArrayList<>();
        private final Set<Integer> initialState = new LinkedHashSet<>();

        private Builder() {
        }

        public int primitive(String name, Set<Integer> preconditions,
                             Set<Integer> addEffects, Set<Integer> deleteEffects) {
            int id = tasks.size();
            tasks.add(Task.builder()
                .id(id)
                .name(name)
                .kind(TaskKind.PRIMITIVE)
                .preconditions(Set.copyOf(preconditions))
                .addEffects(Set.copyOf(addEffects))
                .deleteEffects(Set.copyOf(deleteEffects))
                .build());
            return id;
        }

        public int primitive(String name) {
            return primitive(name, Set.of(), Set.of(), Set.of());
        }

        public int compound(String name) {
            int id = tasks.size();
            tasks.add(Task.builder()
                .id(id)
                .name(name)
                .kind(TaskKind.COMPOUND)
                .build());
            return id;
        }

        public int method(String name, int taskId, List<Integer> subtasks, List<SubtaskOrdering> orderings) {
            if (taskId < 0 || taskId >= tasks.size()) {
                throw new IllegalArgumentException("Unknown task id " + taskId + " for method " + name);
            }
            if (!tasks.get(taskId).isCompound()) {
                throw new IllegalArgumentException(
                    "Method " + name + " decomposes primitive task " + tasks.get(taskId).getName());
            }
            for (int subtask : subtasks) {
                if (subtask < 0 || subtask >= tasks.size()) {
                    throw new IllegalArgumentException("Unknown subtask id " + subtask + " in method " + name);
                }
            }
            Method method = Method.builder()
                .id(methods.size())
                .name(name)
                .taskId(taskId)
                .subtasks(List.copyOf(subtasks))
                .orderings(List.copyOf(orderings))
                .build();
            for (SubtaskOrdering ordering : orderings) {
                method.subtaskAt(ordering.getBeforeIndex());
                method.subtaskAt(ordering.getAfterIndex());
            }
            methods.add(method);
            return method.getId();
        }

        public Builder initialState(Set<Integer> propositions) {
            initialState.addAll(propositions);
            return this;
        }

        public InMemoryGroundedModel build() {
            return new InMemoryGroundedModel(tasks, methods, initialState);
        }
    }
}
