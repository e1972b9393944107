package com.snowman.balance.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    public static final String MDC_KEY = "trace_id";
    public static final String USER_MDC_KEY = "user_id";

    private static final Pattern USER_PATH = Pattern.compile("^/users/(\\d+)(?:/.*)?$");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId));
        MDC.put(MDC_KEY, traceId);
        userIdFromPath(request.getRequestURI()).ifPresent(userId -> MDC.put(USER_MDC_KEY, userId));
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(USER_MDC_KEY);
            RequestContextHolder.clear();
        }
    }

    static Optional<String> userIdFromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = USER_PATH.matcher(path);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
