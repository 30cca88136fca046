package com.dcruver.goalrec.io;

import com.dcruver.goalrec.domain.InputFormatException;
import com.dcruver.goalrec.domain.model.InMemoryGroundedModel;
import com.dcruver.goalrec.domain.model.SubtaskOrdering;
import com.dcruver.goalrec.domain.model.TaskKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads a grounded model exported as JSON (see {@link ModelDocument}).
 * Task and method ids follow declaration order; proposition ids are assigned
 * in order of first appearance.
 */
@Component
@Slf4j
public class GroundedModelLoader {

    private final ObjectMapper objectMapper;

    public GroundedModelLoader() {
        this.objectMapper = new ObjectMapper();
    }

    public InMemoryGroundedModel load(Path modelFile) {
        ModelDocument document;
        try {
            document = objectMapper.readValue(modelFile.toFile(), ModelDocument.class);
        } catch (IOException e) {
            throw new InputFormatException("Cannot read model " + modelFile + ": " + e.getMessage(), e);
        }
        InMemoryGroundedModel model = build(document, modelFile.toString());
        log.info("Loaded model {}: {} tasks, {} methods, {} initial facts",
            modelFile, model.getTaskCount(), model.getMethodCount(), model.getInitialState().size());
        return model;
    }

    public InMemoryGroundedModel build(ModelDocument document, String source) {
        Map<String, Integer> propositionIds = new LinkedHashMap<>();
        Map<String, Integer> taskIds = new HashMap<>();
        InMemoryGroundedModel.Builder builder = InMemoryGroundedModel.builder();

        builder.initialState(propositions(document.getInitialState(), propositionIds));

        for (ModelDocument.TaskEntry entry : document.getTasks()) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new InputFormatException(source + ": task without a name");
            }
            if (taskIds.containsKey(entry.getName())) {
                throw new InputFormatException(source + ": duplicate task " + entry.getName());
            }
            int id = switch (kindOf(entry, source)) {
                case PRIMITIVE -> builder.primitive(entry.getName(),
                    propositions(entry.getPreconditions(), propositionIds),
                    propositions(entry.getAddEffects(), propositionIds),
                    propositions(entry.getDeleteEffects(), propositionIds));
                case COMPOUND -> builder.compound(entry.getName());
            };
            taskIds.put(entry.getName(), id);
        }

        for (ModelDocument.MethodEntry entry : document.getMethods()) {
            int taskId = taskId(entry.getTask(), taskIds, source, entry.getName());
            List<Integer> subtasks = new ArrayList<>();
            for (String subtask : entry.getSubtasks()) {
                subtasks.add(taskId(subtask, taskIds, source, entry.getName()));
            }
            List<SubtaskOrdering> orderings = new ArrayList<>();
            for (List<Integer> pair : entry.getOrderings()) {
                if (pair == null || pair.size() != 2 || pair.contains(null)) {
                    throw new InputFormatException(source + ": method " + entry.getName()
                        + " has an ordering that is not an index pair: " + pair);
                }
                orderings.add(new SubtaskOrdering(pair.get(0), pair.get(1)));
            }
            try {
                builder.method(entry.getName(), taskId, subtasks, orderings);
            } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                throw new InputFormatException(source + ": " + e.getMessage(), e);
            }
        }

        return builder.build();
    }

    private TaskKind kindOf(ModelDocument.TaskEntry entry, String source) {
        if (entry.getKind() == null) {
            throw new InputFormatException(source + ": task " + entry.getName() + " has no kind");
        }
        try {
            return TaskKind.valueOf(entry.getKind().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InputFormatException(source + ": task " + entry.getName()
                + " has unknown kind " + entry.getKind(), e);
        }
    }

    private int taskId(String name, Map<String, Integer> taskIds, String source, String methodName) {
        Integer id = taskIds.get(name);
        if (id == null) {
            throw new InputFormatException(source + ": method " + methodName + " refers to unknown task " + name);
        }
        return id;
    }

    private Set<Integer> propositions(List<String> names, Map<String, Integer> propositionIds) {
        Set<Integer> ids = new LinkedHashSet<>();
        for (String name : names) {
            ids.add(propositionIds.computeIfAbsent(name, n -> propositionIds.size()));
        }
        return ids;
    }
}
