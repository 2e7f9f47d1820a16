package io.agentcron.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.agentcron.server.config.ApiProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-client request limits on the API routes.
 *
 * <p>Each client address gets a fixed one-minute window per kind of route:
 * <ul>
 *   <li>reads ({@code GET}): {@code read-per-minute}</li>
 *   <li>task creation ({@code POST /api/agent-tasks}): {@code create-per-minute}</li>
 *   <li>updates ({@code PUT}): {@code update-per-minute}</li>
 *   <li>deletes ({@code DELETE}): {@code delete-per-minute}</li>
 *   <li>anything else, e.g. a manual run: {@code default-per-minute}</li>
 * </ul>
 * A request over the limit is answered 429 with a {@code Retry-After} header and never reaches
 * the controller. Counters are kept in memory, so limits are per server instance.
 */
public class RateLimitInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    static final String TASKS_PATH = "/api/agent-tasks";

    private static final long WINDOW_MILLIS = Duration.ofMinutes(1).toMillis();

    enum RouteKind { READ, CREATE, UPDATE, DELETE, OTHER }

    private final ApiProperties.RateLimit limits;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // key: client|kind|window; entries outlive their window by one more minute at most
    private final Cache<String, AtomicInteger> counters = Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterWrite(Duration.ofMinutes(2))
            .build();

    public RateLimitInterceptor(ApiProperties.RateLimit limits, ObjectMapper objectMapper, Clock clock) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        RouteKind kind = classify(request);
        int limit = limitFor(kind);
        if (limit <= 0) {
            return true;
        }

        long now = clock.millis();
        long window = now / WINDOW_MILLIS;
        String client = request.getRemoteAddr();
        String key = client + "|" + kind + "|" + window;

        int count = counters.get(key, k -> new AtomicInteger()).incrementAndGet();
        if (count <= limit) {
            return true;
        }

        long retryAfterSeconds = Math.max(1, ((window + 1) * WINDOW_MILLIS - now + 999) / 1000);
        log.warn("agentcron api rate limit hit client={} route={} {} kind={} limit={}/min",
                client, request.getMethod(), request.getRequestURI(), kind, limit);

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), ApiResponse.error(
                HttpStatus.TOO_MANY_REQUESTS.value(),
                "rate limit exceeded: " + limit + " requests per minute"));
        return false;
    }

    static RouteKind classify(HttpServletRequest request) {
        String method = request.getMethod();
        if (HttpMethod.GET.matches(method)) {
            return RouteKind.READ;
        }
        if (HttpMethod.PUT.matches(method)) {
            return RouteKind.UPDATE;
        }
        if (HttpMethod.DELETE.matches(method)) {
            return RouteKind.DELETE;
        }
        if (HttpMethod.POST.matches(method) && isTaskCollection(request)) {
            return RouteKind.CREATE;
        }
        return RouteKind.OTHER;
    }

    private static boolean isTaskCollection(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return TASKS_PATH.equals(path);
    }

    private int limitFor(RouteKind kind) {
        switch (kind) {
            case READ:
                return limits.getReadPerMinute();
            case CREATE:
                return limits.getCreatePerMinute();
            case UPDATE:
                return limits.getUpdatePerMinute();
            case DELETE:
                return limits.getDeletePerMinute();
            default:
                return limits.getDefaultPerMinute();
        }
    }
}
