package com.dcruver.goalrec.io;

import com.dcruver.goalrec.domain.InputFormatException;
import com.dcruver.goalrec.domain.model.DecompositionTrace;
import com.dcruver.goalrec.domain.model.GroundedModel;
import com.dcruver.goalrec.domain.model.Method;
import com.dcruver.goalrec.domain.model.Plan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves planner traces against a grounded model into the plan and
 * decomposition choices needed for scoring.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TraceExtractor {

    private final PlannerTraceReader traceReader;

    public ExtractedTrace extract(Path logFile, GroundedModel model) {
        return extract(traceReader.read(logFile), model);
    }

    public ExtractedTrace extract(PlannerTrace trace, GroundedModel model) {
        if (!trace.isPlanSectionFound()) {
            throw new InputFormatException("No plan section found in " + trace.getSource());
        }
        if (trace.getPlanSteps().isEmpty()) {
            throw new InputFormatException("Plan section of " + trace.getSource() + " contains no actions");
        }

        if (!trace.isDecompositionSectionFound()) {
            log.warn("{}: no decomposition section, every method choice is treated as certain", trace.getSource());
        }

        List<String> unresolved = new ArrayList<>();
        Plan plan = resolvePlan(trace, model, unresolved);
        DecompositionTrace decomposition = resolveDecomposition(trace, model, unresolved);

        log.info("Extracted {}: {} actions, {} decomposed tasks, {} used methods",
            trace.getSource(), plan.size(), decomposition.getMethodCounts().size(),
            decomposition.getUsedMethodIds().size());

        return ExtractedTrace.builder()
            .source(trace.getSource())
            .plan(plan)
            .decomposition(decomposition)
            .unresolvedNames(List.copyOf(unresolved))
            .build();
    }

    /**
     * Resolve action names to primitive task ids, dropping what the model does not know
     */
    public List<Integer> resolveActions(List<String> names, GroundedModel model,
                                        List<String> unresolved, String source) {
        List<Integer> actions = new ArrayList<>();
        for (String name : names) {
            OptionalInt id = model.findTaskId(name);
            if (id.isEmpty()) {
                log.warn("{}: action '{}' not found in model, dropped", source, name);
                unresolved.add(name);
            } else if (!model.getTask(id.getAsInt()).isPrimitive()) {
                log.warn("{}: '{}' is not a primitive action, dropped", source, name);
                unresolved.add(name);
            } else {
                actions.add(id.getAsInt());
            }
        }
        return actions;
    }

    private Plan resolvePlan(PlannerTrace trace, GroundedModel model, List<String> unresolved) {
        Plan plan = Plan.of(resolveActions(trace.getPlanSteps(), model, unresolved, trace.getSource()));
        if (plan.isEmpty()) {
            log.warn("{}: none of the {} plan steps resolved against the model",
                trace.getSource(), trace.getPlanSteps().size());
        }
        return plan;
    }

    private DecompositionTrace resolveDecomposition(PlannerTrace trace, GroundedModel model,
                                                    List<String> unresolved) {
        Map<String, Integer> methodCounts = new LinkedHashMap<>();
        Set<Integer> usedMethods = new TreeSet<>();

        for (TraceLine record : trace.getDecompositionRecords()) {
            String taskName = record.getName();
            OptionalInt taskId = model.findTaskId(taskName);
            if (taskId.isEmpty()) {
                log.warn("{}:{} task '{}' not found in model, record dropped",
                    trace.getSource(), record.getLineNumber(), taskName);
                unresolved.add(taskName);
                continue;
            }

            List<Method> alternatives = model.getMethodsFor(taskId.getAsInt());
            if (alternatives.isEmpty()) {
                // Primitive actions show up in the tree too; they carry no choice
                continue;
            }
            methodCounts.put(taskName, alternatives.size());

            String methodName = record.getTargetHead();
            OptionalInt methodId = model.findMethodId(methodName, taskId.getAsInt());
            if (methodId.isPresent()) {
                usedMethods.add(methodId.getAsInt());
            } else {
                log.warn("{}:{} method '{}' of task '{}' not found in model",
                    trace.getSource(), record.getLineNumber(), methodName, taskName);
                unresolved.add(methodName);
            }
        }

        return new DecompositionTrace(methodCounts, usedMethods);
    }
}
