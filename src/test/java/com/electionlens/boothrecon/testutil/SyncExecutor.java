package com.electionlens.boothrecon.testutil;

import java.util.concurrent.Executor;

/**
 * Runs tasks on the calling thread, for deterministic tests of parallel code paths.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
