package io.relaybox;

import io.relaybox.cli.RelayBoxCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RelayBoxCommand()).execute(args);
        System.exit(code);
    }
}
