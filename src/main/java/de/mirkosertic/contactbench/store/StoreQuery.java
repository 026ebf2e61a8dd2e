package de.mirkosertic.contactbench.store;

/**
 * A prepared query bound to store resources. {@link #execute()} runs at most once; {@link #abort()}
 * may be called from any thread while it runs. {@link #close()} releases the resources and must
 * be called on every exit path.
 *
 * @param <T> the result type
 */
public interface StoreQuery<T> extends AutoCloseable {

    /**
     * @throws StoreTimeoutException if the statement timeout fired
     * @throws StoreException        on any other store failure, including an abort
     */
    T execute() throws StoreException;

    /**
     * Best-effort request to stop a running {@link #execute()}. Safe to call before, during or
     * after execution, and more than once.
     */
    void abort();

    /**
     * Number of data statements issued so far.
     */
    int statementCount();

    @Override
    void close();
}
