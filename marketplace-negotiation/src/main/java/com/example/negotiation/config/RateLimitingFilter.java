package com.example.negotiation.config;

import com.example.negotiation.service.PrincipalResolver;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token bucket per caller and route. Callers are keyed by the gateway-supplied user id when present,
 * otherwise by client address.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    private final NegotiationSecurityProperties securityProperties;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitingFilter(NegotiationSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!securityProperties.isRateLimitingEnabled()
                || HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        String prefix = securityProperties.getRateLimit().getPathPrefix();
        return StringUtils.hasText(prefix) && !request.getRequestURI().startsWith(prefix);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String key = bucketKey(request);
        ConsumptionProbe probe = buckets.computeIfAbsent(key, ignored -> newBucket())
                .tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            filterChain.doFilter(request, response);
            return;
        }
        log.debug("Rate limit exceeded for {}", key);
        reject(response, probe);
    }

    private Bucket newBucket() {
        NegotiationSecurityProperties.RateLimit limit = securityProperties.getRateLimit();
        long capacity = Math.max(limit.getCapacity(), 1);
        long refillTokens = Math.max(limit.getRefillTokens(), 1);
        return Bucket.builder()
                .addLimit(Bandwidth.classic(capacity, Refill.greedy(refillTokens, limit.effectiveRefillPeriod())))
                .build();
    }

    private void reject(HttpServletResponse response, ConsumptionProbe probe) throws IOException {
        long retryAfterSeconds = Math.max(TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()), 1);
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        response.getWriter().write("{\"timestamp\":\"" + Instant.now()
                + "\",\"error\":\"Request rate exceeded, retry later\",\"code\":\"too_many_requests\"}");
    }

    private String bucketKey(HttpServletRequest request) {
        String userId = request.getHeader(PrincipalResolver.USER_ID_HEADER);
        String caller;
        if (StringUtils.hasText(userId)) {
            caller = "user:" + userId.trim();
        } else {
            String forwardedFor = request.getHeader("X-Forwarded-For");
            caller = StringUtils.hasText(forwardedFor)
                    ? "ip:" + forwardedFor.split(",")[0].trim()
                    : "ip:" + request.getRemoteAddr();
        }
        return caller + "|" + request.getMethod() + " " + request.getRequestURI();
    }
}
