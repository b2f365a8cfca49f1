package io.survivalmesh;

import io.survivalmesh.cli.SurvivalMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SurvivalMeshCommand()).execute(args);
        System.exit(code);
    }
}
