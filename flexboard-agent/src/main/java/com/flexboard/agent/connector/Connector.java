package com.flexboard.agent.connector;

import com.flexboard.agent.model.NativeResult;

import java.util.Map;

/**
 * Executes queries against one backend kind over a pooled handle.
 *
 * <p>Implementations never close or return the handle; the dispatcher owns its lifecycle.
 * Failures are reported as {@link com.flexboard.agent.error.QueryDispatchException} subtypes
 * that state whether the handle may be reused.
 *
 * @param <H> handle type
 */
public interface Connector<H> {

    /**
     * Run one query.
     *
     * @param handle exclusively owned backend handle
     * @param query query text in the backend's own language
     * @param params parameters in insertion order, bound natively
     * @return native result
     */
    NativeResult run(H handle, String query, Map<String, Object> params);

    /**
     * Check that the backend answers over this handle.
     *
     * @param handle backend handle
     * @return true when the backend is reachable
     */
    boolean ping(H handle);
}
