package io.crewmesh.runtime;

import io.crewmesh.Main;
import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.config.WorkerDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts {@code crewmesh worker --worker-id <id>} in a child JVM with this JVM's classpath.
 * Output goes to {@code logs/<id>.log}.
 */
public final class JavaProcessLauncher implements ProcessLauncher {
    private final CrewMeshConfig config;

    public JavaProcessLauncher(CrewMeshConfig config) {
        this.config = config;
    }

    @Override
    public Process launch(WorkerDefinition worker) throws IOException {
        Files.createDirectories(config.logsDir());
        Path logFile = config.logsDir().resolve(worker.id() + ".log");
        ProcessBuilder pb = new ProcessBuilder(command(worker));
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        return pb.start();
    }

    List<String> command(WorkerDefinition worker) {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(Main.class.getName());
        command.add("--root");
        command.add(config.rootDir().toString());
        command.add("worker");
        command.add("--worker-id");
        command.add(worker.id());
        return command;
    }
}
