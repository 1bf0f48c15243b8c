package com.shelfmark.app;

import com.shelfmark.app.cli.ShelfmarkCli;

public final class Main {

    private Main() {}

    public static void main(String[] args) {
        int exitCode = ShelfmarkCli.execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }
}
