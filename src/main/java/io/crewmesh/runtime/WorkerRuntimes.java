package io.crewmesh.runtime;

import io.crewmesh.bus.Mailbox;
import io.crewmesh.config.RuntimeMode;
import io.crewmesh.config.RuntimeSettings;
import io.crewmesh.storage.WorkQueue;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

/**
 * Builds the {@link WorkerRuntime} selected by {@code runtime.mode}.
 */
public final class WorkerRuntimes {
    private WorkerRuntimes() {
    }

    public static WorkerRuntime create(
            RuntimeSettings settings,
            ProcessLauncher launcher,
            Mailbox mailbox,
            WorkerTickFactory ticks,
            WorkQueue queue,
            Clock clock
    ) {
        return switch (settings.mode()) {
            case PROCESS, IN_PROCESS -> eager(settings.mode(), settings, launcher, mailbox, ticks);
            case LAZY -> new LazyWorkerRuntime(
                    eager(settings.delegate(), settings, launcher, mailbox, ticks),
                    queue,
                    Set.copyOf(settings.alwaysOn()),
                    Duration.ofMillis(settings.idleShutdownMs()),
                    Duration.ofMillis(settings.idleMonitorIntervalMs()),
                    clock
            );
        };
    }

    private static WorkerRuntime eager(
            RuntimeMode mode,
            RuntimeSettings settings,
            ProcessLauncher launcher,
            Mailbox mailbox,
            WorkerTickFactory ticks
    ) {
        return switch (mode) {
            case PROCESS -> new ProcessWorkerRuntime(launcher, mailbox, Duration.ofMillis(settings.gracePeriodMs()));
            case IN_PROCESS -> new CooperativeWorkerRuntime(ticks, Duration.ofMillis(settings.pollIntervalMs()));
            case LAZY -> throw new IllegalArgumentException("lazy runtime cannot delegate to another lazy runtime");
        };
    }
}
