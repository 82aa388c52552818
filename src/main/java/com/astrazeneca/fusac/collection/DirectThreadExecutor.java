package com.astrazeneca.fusac.collection;

import java.util.concurrent.Executor;

/**
 * Executor running the task in the calling thread. Used to run the record pipeline inside a worker
 * (or in not parallel mode) without handing stages over to other threads.
 */
public class DirectThreadExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
