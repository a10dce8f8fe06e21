package io.crewmesh;

import io.crewmesh.cli.CrewMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CrewMeshCommand()).execute(args);
        System.exit(code);
    }
}
