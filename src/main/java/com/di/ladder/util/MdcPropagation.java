package com.di.ladder.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * MDC helpers: scoped context for a rebalancing run ({@code cycleNumber}, {@code entityKind}).
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Runs {@code work} with {@code context} added to the current thread's MDC, then restores the
     * MDC exactly as it was.
     */
    public static <T> T callWithContext(Map<String, String> context, Supplier<T> work) {
        Map<String, String> previous = copyMdc();
        Map<String, String> merged = new HashMap<>(previous);
        merged.putAll(context);
        MDC.setContextMap(merged);
        try {
            return work.get();
        } finally {
            if (previous.isEmpty()) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }

    private static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map != null ? map : Collections.emptyMap();
    }
}
