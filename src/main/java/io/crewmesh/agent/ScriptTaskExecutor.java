package io.crewmesh.agent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command per task. The prompt is written to stdin and stdout becomes the
 * result; a non-zero exit or a timeout fails the task. Output is drained on its own thread while
 * the command runs, so a full pipe never stalls it.
 */
public final class ScriptTaskExecutor implements TaskExecutor {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long OUTPUT_DRAIN_MS = 5_000L;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptTaskExecutor(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script executor command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String kind() {
        return "script";
    }

    @Override
    public TaskOutcome execute(ExecutionContext context) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.environment().put("CREWMESH_WORKER_ID", context.workerId());
        pb.environment().put("CREWMESH_TASK_ID", context.taskId());
        pb.environment().put("CREWMESH_MODEL", context.model() == null ? "" : context.model());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return TaskOutcome.fail("script_spawn", "script spawn failed: " + e.getMessage());
        }

        FutureTask<byte[]> output = new FutureTask<>(() -> process.getInputStream().readAllBytes());
        Thread reader = new Thread(output, "crewmesh-script-output-" + context.taskId());
        reader.setDaemon(true);
        reader.start();
        try {
            process.getOutputStream().write(context.prompt().getBytes(StandardCharsets.UTF_8));
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return TaskOutcome.fail("script_timeout", "script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(output.get(OUTPUT_DRAIN_MS, TimeUnit.MILLISECONDS), StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return TaskOutcome.ok(combined.strip());
            }
            return TaskOutcome.fail("script_exit", "script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return TaskOutcome.fail("script_interrupted", "script interrupted");
        } catch (IOException e) {
            process.destroyForcibly();
            return TaskOutcome.fail("script_io", "script execution failed: " + e.getMessage());
        } catch (ExecutionException e) {
            return TaskOutcome.fail("script_io", "script output unreadable: " + e.getCause().getMessage());
        } catch (TimeoutException e) {
            output.cancel(true);
            return TaskOutcome.fail("script_io", "script output still open " + OUTPUT_DRAIN_MS + "ms after exit");
        }
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
