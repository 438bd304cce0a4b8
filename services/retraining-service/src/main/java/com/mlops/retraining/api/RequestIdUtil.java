package com.mlops.retraining.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

/**
 * Trace and request ids of the current HTTP request. Ids come from the {@code x-trace-id} and
 * {@code x-request-id} headers or are generated, and are resolved once per request.
 */
public final class RequestIdUtil {
    public static final String TRACE_HEADER = "x-trace-id";
    public static final String REQUEST_HEADER = "x-request-id";

    static final String TRACE_ATTRIBUTE = RequestIdUtil.class.getName() + ".traceId";
    static final String REQUEST_ATTRIBUTE = RequestIdUtil.class.getName() + ".requestId";

    private RequestIdUtil() {
    }

    public static String traceId(HttpServletRequest request) {
        return resolve(request, TRACE_ATTRIBUTE, TRACE_HEADER);
    }

    public static String requestId(HttpServletRequest request) {
        return resolve(request, REQUEST_ATTRIBUTE, REQUEST_HEADER);
    }

    private static String resolve(HttpServletRequest request, String attribute, String headerName) {
        Object cached = request.getAttribute(attribute);
        if (cached instanceof String) {
            return (String) cached;
        }
        String header = request.getHeader(headerName);
        String id = header == null || header.isBlank()
            ? UUID.randomUUID().toString().replace("-", "")
            : header.trim();
        request.setAttribute(attribute, id);
        return id;
    }
}
