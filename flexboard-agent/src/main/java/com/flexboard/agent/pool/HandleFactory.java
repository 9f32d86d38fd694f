package com.flexboard.agent.pool;

/**
 * Opens and destroys backend handles for a {@link BoundedConnectionPool}.
 *
 * @param <H> handle type
 */
public interface HandleFactory<H> extends AutoCloseable {

    /**
     * Open a new handle. Called without the pool lock held.
     *
     * @return a live handle
     * @throws Exception when the backend cannot be reached
     */
    H create() throws Exception;

    /**
     * Destroy a handle that will never be used again.
     *
     * @param handle handle
     * @throws Exception on close failure
     */
    void destroy(H handle) throws Exception;

    /**
     * Release resources shared by all handles of this factory.
     */
    @Override
    default void close() {
    }
}
