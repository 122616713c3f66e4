package com.baton.dispatch.cli;

import java.io.IOException;
import java.net.ConnectException;

/**
 * Base for commands that talk to a running Baton server.
 */
abstract class ApiCommand implements Runnable {

    protected final BatonApiClient client;

    protected ApiCommand(BatonApiClient client) {
        this.client = client;
    }

    protected abstract void call() throws IOException, InterruptedException;

    @Override
    public void run() {
        try {
            call();
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Baton server at " + client.getBaseUrl());
            ConsoleOutput.info("Start the server first: baton serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
        }
    }

    /** Prints the server's error and returns false when the call did not succeed. */
    protected static boolean check(BatonApiClient.ApiResponse response) {
        if (response.isSuccess()) return true;
        ConsoleOutput.error(response.errorMessage());
        return false;
    }
}
