package io.torotator;

import io.torotator.cli.TorotatorCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TorotatorCommand()).execute(args);
        System.exit(code);
    }
}
