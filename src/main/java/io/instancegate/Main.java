package io.instancegate;

import io.instancegate.cli.InstanceGateCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new InstanceGateCommand()).execute(args);
        System.exit(code);
    }
}
