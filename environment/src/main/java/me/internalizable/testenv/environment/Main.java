package me.internalizable.testenv.environment;

import me.internalizable.testenv.environment.cli.TestEnvCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TestEnvCommand()).execute(args);
        System.exit(code);
    }
}
