package io.abrserver;

import io.abrserver.cli.AbrServerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AbrServerCommand()).execute(args);
        System.exit(code);
    }
}
