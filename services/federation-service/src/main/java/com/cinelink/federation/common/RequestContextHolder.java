package com.cinelink.federation.common;

import org.slf4j.MDC;

/**
 * Thread-bound {@link RequestContext}. The ids are mirrored into the SLF4J MDC under
 * {@code request_id} and {@code trace_id} so store client log lines carry them too.
 */
public final class RequestContextHolder {
    static final String MDC_REQUEST_ID = "request_id";
    static final String MDC_TRACE_ID = "trace_id";

    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void bind(RequestContext context) {
        CURRENT.set(context);
        MDC.put(MDC_REQUEST_ID, context.requestId());
        MDC.put(MDC_TRACE_ID, context.traceId());
    }

    public static String requestId() {
        RequestContext context = CURRENT.get();
        return context == null ? null : context.requestId();
    }

    public static String traceId() {
        RequestContext context = CURRENT.get();
        return context == null ? null : context.traceId();
    }

    public static void unbind() {
        CURRENT.remove();
        MDC.remove(MDC_REQUEST_ID);
        MDC.remove(MDC_TRACE_ID);
    }
}
