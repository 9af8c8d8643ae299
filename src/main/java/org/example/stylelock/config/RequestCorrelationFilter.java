package org.example.stylelock.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.example.stylelock.service.RequestScheduler;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every API call with a request id (echoed in {@code X-Request-Id}). Calls that address
 * a batch or a project style also carry that id in the MDC, using the same {@code batchId}
 * key as the scheduler workers, so report polls and cancellations line up with the worker
 * logs of the batch they touch.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    static final String MDC_PROJECT_ID = "projectId";

    private static final Pattern BATCH_PATH = Pattern.compile("^/api/batches/([^/]+)(?:/.*)?$");
    private static final Pattern PROJECT_PATH = Pattern.compile("^/api/projects/([^/]+)/style(?:/.*)?$");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = RequestCorrelation.normalize(request.getHeader(RequestCorrelation.HEADER_NAME));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }

        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);

        String path = request.getRequestURI().substring(request.getContextPath().length());
        String batchId = pathVariable(BATCH_PATH, path);
        String projectId = pathVariable(PROJECT_PATH, path);

        MDC.put(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        putIfPresent(RequestScheduler.MDC_BATCH_ID, batchId);
        putIfPresent(MDC_PROJECT_ID, projectId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestCorrelation.ATTRIBUTE_NAME);
            MDC.remove(RequestScheduler.MDC_BATCH_ID);
            MDC.remove(MDC_PROJECT_ID);
        }
    }

    static String pathVariable(Pattern pattern, String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(path);
        return matcher.matches() ? RequestCorrelation.normalize(matcher.group(1)) : null;
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
