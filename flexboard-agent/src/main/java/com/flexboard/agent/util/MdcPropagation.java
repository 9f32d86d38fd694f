package com.flexboard.agent.util;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries the submitting thread's MDC ({@code trace_id}, {@code tenant_id},
 * {@code data_source}) onto dispatcher worker threads so backend logs correlate with the
 * request that caused them.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Capture the current MDC and return a Callable that runs with it, restoring the worker's
     * own context afterwards.
     *
     * @param task task to run on another thread
     * @param <T> result type
     * @return wrapped task
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            setContext(captured);
            try {
                return task.call();
            } finally {
                setContext(previous);
            }
        };
    }

    private static void setContext(Map<String, String> context) {
        if (context == null || context.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
}
