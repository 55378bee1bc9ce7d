package io.teamrelay;

import io.teamrelay.cli.TeamRelayCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TeamRelayCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
