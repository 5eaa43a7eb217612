package com.github.salilvnair.formflow.engine.factory;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.engine.exception.FormFlowErrorCode;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.pipeline.EnginePipeline;
import com.github.salilvnair.formflow.engine.pipeline.EngineStep;
import com.github.salilvnair.formflow.engine.pipeline.StepResult;
import com.github.salilvnair.formflow.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formflow.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.formflow.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Orders the discovered {@link EngineStep} beans from their {@code @MustRunBefore},
 * {@code @MustRunAfter} and {@code @TerminalStep} annotations and builds the shared pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnginePipelineFactory {

    private final List<EngineStep> discoveredSteps;
    private final AuditService audit;

    private EnginePipeline pipeline;

    @PostConstruct
    public void init() {
        List<EngineStep> ordered = orderByDag(discoveredSteps);
        log.info("FormFlow pipeline order: {}", names(ordered.stream().map(EngineStep::getClass).toList()));
        List<EngineStep> timed = new ArrayList<>(ordered.size());
        for (EngineStep step : ordered) {
            timed.add(new TimingEngineStep(step, audit));
        }
        this.pipeline = new EnginePipeline(timed);
    }

    public EnginePipeline create() {
        return pipeline;
    }

    List<EngineStep> orderByDag(List<EngineStep> steps) {
        Map<Class<?>, EngineStep> byType = indexByType(steps);
        Class<?> terminal = singleTerminal(byType.keySet());

        // step -> steps that have to finish before it starts
        Map<Class<?>, Set<Class<?>>> predecessors = new LinkedHashMap<>();
        byType.keySet().forEach(type -> predecessors.put(type, new LinkedHashSet<>()));

        for (Class<?> type : byType.keySet()) {
            MustRunBefore before = type.getAnnotation(MustRunBefore.class);
            if (before != null) {
                for (Class<? extends EngineStep> later : before.value()) {
                    requirePresent(byType, type, later);
                    link(predecessors, type, later);
                }
            }
            MustRunAfter after = type.getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends EngineStep> earlier : after.value()) {
                    requirePresent(byType, type, earlier);
                    link(predecessors, earlier, type);
                }
            }
            link(predecessors, type, terminal);
        }

        List<EngineStep> ordered = new ArrayList<>(byType.size());
        for (Class<?> type : topologicalOrder(predecessors)) {
            ordered.add(byType.get(type));
        }
        return ordered;
    }

    private static Map<Class<?>, EngineStep> indexByType(List<EngineStep> steps) {
        Map<Class<?>, EngineStep> byType = new LinkedHashMap<>();
        for (EngineStep step : steps) {
            if (byType.putIfAbsent(step.getClass(), step) != null) {
                throw new FormFlowException(FormFlowErrorCode.DUPLICATE_ENGINE_STEP,
                        "Duplicate EngineStep bean for class: " + step.getClass().getName());
            }
        }
        return byType;
    }

    private static Class<?> singleTerminal(Collection<Class<?>> types) {
        List<Class<?>> terminals = types.stream()
                .filter(type -> type.isAnnotationPresent(TerminalStep.class))
                .toList();
        if (terminals.size() != 1) {
            throw new FormFlowException(FormFlowErrorCode.MISSING_TERMINAL_STEP,
                    "Exactly one @TerminalStep is required, found: " + names(terminals));
        }
        return terminals.get(0);
    }

    private static void requirePresent(Map<Class<?>, EngineStep> byType, Class<?> owner, Class<?> dependency) {
        if (!byType.containsKey(dependency)) {
            throw new FormFlowException(FormFlowErrorCode.MISSING_DEPENDENT_STEP,
                    owner.getSimpleName() + " depends on missing step: " + dependency.getName());
        }
    }

    private static void link(Map<Class<?>, Set<Class<?>>> predecessors, Class<?> earlier, Class<?> later) {
        if (!earlier.equals(later)) {
            predecessors.get(later).add(earlier);
        }
    }

    /**
     * Kahn's algorithm. Among steps that are ready at the same time the one with the smaller class
     * name goes first, so the order does not depend on bean discovery order.
     */
    private static List<Class<?>> topologicalOrder(Map<Class<?>, Set<Class<?>>> predecessors) {
        Map<Class<?>, Set<Class<?>>> pending = new HashMap<>();
        predecessors.forEach((type, before) -> pending.put(type, new HashSet<>(before)));

        TreeMap<String, Class<?>> ready = new TreeMap<>();
        pending.forEach((type, before) -> {
            if (before.isEmpty()) {
                ready.put(type.getName(), type);
            }
        });

        List<Class<?>> order = new ArrayList<>(predecessors.size());
        while (!ready.isEmpty()) {
            Class<?> next = ready.pollFirstEntry().getValue();
            order.add(next);
            pending.remove(next);
            for (Map.Entry<Class<?>, Set<Class<?>>> entry : pending.entrySet()) {
                if (entry.getValue().remove(next) && entry.getValue().isEmpty()) {
                    ready.put(entry.getKey().getName(), entry.getKey());
                }
            }
        }

        if (!pending.isEmpty()) {
            throw new FormFlowException(FormFlowErrorCode.MISSING_DAG_CYCLE,
                    "EngineStep DAG cycle or unsatisfied constraints: " + names(pending.keySet()));
        }
        return order;
    }

    private static String names(Collection<? extends Class<?>> types) {
        return types.stream().map(Class::getSimpleName).collect(Collectors.joining(" -> "));
    }

    /**
     * Records per-step latency on the turn and audits the step that threw.
     */
    private static final class TimingEngineStep implements EngineStep {

        private final EngineStep delegate;
        private final AuditService audit;
        private final String stepName;

        private TimingEngineStep(EngineStep delegate, AuditService audit) {
            this.delegate = delegate;
            this.audit = audit;
            this.stepName = delegate.getClass().getSimpleName();
        }

        @Override
        public StepResult execute(DialogueTurn turn) {
            long startedAt = System.nanoTime();
            try {
                return delegate.execute(turn);
            } catch (RuntimeException e) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("step", stepName);
                payload.put("durationMs", elapsedMs(startedAt));
                payload.put("errorType", e.getClass().getSimpleName());
                payload.put("errorMessage", String.valueOf(e.getMessage()));
                if (e instanceof FormFlowException ffe && ffe.getMetaData() != null) {
                    payload.put("errorMeta", ffe.getMetaData());
                }
                audit.audit(DialogueAuditStage.STEP_ERROR, turn.getSessionId(), payload);
                throw e;
            } finally {
                turn.getStepTimingsMs().put(stepName, elapsedMs(startedAt));
            }
        }

        private static long elapsedMs(long startedAt) {
            return (System.nanoTime() - startedAt) / 1_000_000;
        }

        @Override
        public String toString() {
            return "Timed(" + stepName + ")";
        }
    }
}
