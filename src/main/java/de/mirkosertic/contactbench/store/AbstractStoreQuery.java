package de.mirkosertic.contactbench.store;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class handling the abort flag, the statement counter and deferred release. A
 * {@link #close()} issued while {@link #execute()} still runs on another thread postpones
 * {@link #release()} until that execution returns.
 *
 * @param <T> the result type
 */
public abstract class AbstractStoreQuery<T> implements StoreQuery<T> {

    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicInteger statements = new AtomicInteger(0);

    // guarded by this
    private boolean running;
    private boolean closeRequested;
    private boolean released;

    @Override
    public final T execute() throws StoreException {
        synchronized (this) {
            if (closeRequested) {
                throw new StoreException("Query already closed");
            }
            if (running) {
                throw new IllegalStateException("Query is already executing");
            }
            running = true;
        }
        try {
            if (aborted.get()) {
                throw new StoreException("Query aborted before execution");
            }
            return doExecute();
        } finally {
            synchronized (this) {
                running = false;
                if (closeRequested) {
                    releaseOnce();
                }
            }
        }
    }

    @Override
    public final void abort() {
        if (aborted.compareAndSet(false, true)) {
            onAbort();
        }
    }

    @Override
    public final int statementCount() {
        return statements.get();
    }

    @Override
    public final void close() {
        synchronized (this) {
            closeRequested = true;
            if (!running) {
                releaseOnce();
            }
        }
    }

    protected final boolean isAborted() {
        return aborted.get();
    }

    protected final void statementIssued() {
        statements.incrementAndGet();
    }

    private void releaseOnce() {
        if (!released) {
            released = true;
            release();
        }
    }

    protected abstract T doExecute() throws StoreException;

    /**
     * Interrupts a running statement. Called at most once, possibly from another thread.
     */
    protected abstract void onAbort();

    /**
     * Frees the resources held by this query. Called exactly once, never while executing.
     */
    protected abstract void release();
}
