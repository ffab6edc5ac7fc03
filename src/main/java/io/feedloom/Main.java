package io.feedloom;

import io.feedloom.cli.FeedloomCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = FeedloomCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
