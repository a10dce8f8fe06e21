package io.crewmesh.agent;

import io.crewmesh.config.WorkerDefinition;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps the {@code executor} kind of a worker definition to an executor instance.
 */
public final class ExecutorRegistry {
    private final Map<String, Function<WorkerDefinition, TaskExecutor>> factories = new ConcurrentHashMap<>();

    public static ExecutorRegistry withDefaults() {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register("echo", def -> new EchoTaskExecutor());
        registry.register("fail", def -> new FailTaskExecutor());
        registry.register("script", def -> new ScriptTaskExecutor(def.command(), def.timeoutMs()));
        return registry;
    }

    public void register(String kind, Function<WorkerDefinition, TaskExecutor> factory) {
        factories.put(kind, factory);
    }

    public TaskExecutor create(WorkerDefinition definition) {
        Function<WorkerDefinition, TaskExecutor> factory = factories.get(definition.executor());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown executor '" + definition.executor() + "' for worker " + definition.id());
        }
        return factory.apply(definition);
    }

    public Collection<String> kinds() {
        return factories.keySet();
    }
}
