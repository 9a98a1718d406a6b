package com.mondayBi.biAgent.gateway.service;

import com.mondayBi.biAgent.gateway.util.ClientIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sliding-window rate limiter, one window per client.
 * <p>
 * Every question costs two language model calls, so the limit protects the Groq quota
 * as much as the service itself. Windows live only in this process.
 * </p>
 */
@Slf4j
@Service
public class RateLimiter {

    private static final long WINDOW_SIZE_SECONDS = 60;

    private final Map<String, RequestWindow> clientWindows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxRequestsPerMinute;

    public RateLimiter(Clock clock, @Value("${bi.gateway.max-requests-per-minute:15}") int maxRequestsPerMinute) {
        this.clock = clock;
        this.maxRequestsPerMinute = maxRequestsPerMinute;
    }

    /**
     * Records the request if the client is still under the limit.
     *
     * @param clientId The client to check
     * @return true if the request is allowed, false if the limit is exceeded
     */
    public boolean isAllowed(String clientId) {
        RequestWindow window = clientWindows.computeIfAbsent(clientId, k -> new RequestWindow());
        Instant now = clock.instant();

        if (!window.tryAdd(now, now.minusSeconds(WINDOW_SIZE_SECONDS), maxRequestsPerMinute)) {
            log.warn("Rate limit exceeded for clientId: {}", ClientIdMasker.mask(clientId));
            return false;
        }
        return true;
    }

    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();

        synchronized boolean tryAdd(Instant now, Instant cutoff, int limit) {
            while (!requests.isEmpty() && requests.peekFirst().isBefore(cutoff)) {
                requests.pollFirst();
            }
            if (requests.size() >= limit) {
                return false;
            }
            requests.addLast(now);
            return true;
        }
    }
}
