package io.chunkmesh;

import io.chunkmesh.cli.ChunkMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ChunkMeshCommand()).execute(args);
        System.exit(code);
    }
}
