package io.timstate;

import io.timstate.cli.TimStateCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TimStateCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
