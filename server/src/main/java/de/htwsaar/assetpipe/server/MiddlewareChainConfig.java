package de.htwsaar.assetpipe.server;

import de.htwsaar.assetpipe.common.chain.ChainOrder;
import de.htwsaar.assetpipe.server.middleware.CompressionFilter;
import de.htwsaar.assetpipe.server.middleware.DeadlineFilter;
import de.htwsaar.assetpipe.server.middleware.EtagFilter;
import de.htwsaar.assetpipe.server.middleware.HttpsRedirectFilter;
import de.htwsaar.assetpipe.server.middleware.RateLimitFilter;
import de.htwsaar.assetpipe.server.middleware.RealIpFilter;
import de.htwsaar.assetpipe.server.middleware.RecoveryFilter;
import de.htwsaar.assetpipe.server.middleware.RequestLoggingFilter;
import de.htwsaar.assetpipe.server.middleware.SecurityHeadersFilter;
import de.htwsaar.assetpipe.server.middleware.TrustedProxies;
import de.htwsaar.assetpipe.server.ratelimit.SlidingWindowRateLimiter;
import jakarta.servlet.Filter;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registriert die Middleware-Kette in fester Reihenfolge (siehe {@link ChainOrder}).
 * Der Request-ID-Filter kommt aus {@code LoggingConfig}.
 */
@Configuration
public class MiddlewareChainConfig {

    @Bean
    public FilterRegistrationBean<RealIpFilter> realIpFilter(
            @Value("${pipeline.real-ip.trusted-proxies:}") List<String> trustedProxies) {
        return register(new RealIpFilter(TrustedProxies.of(trustedProxies)), "realIpFilter", ChainOrder.REAL_IP);
    }

    @Bean
    public FilterRegistrationBean<HttpsRedirectFilter> httpsRedirectFilter(
            @Value("${pipeline.https-redirect.enabled:false}") boolean enabled) {
        FilterRegistrationBean<HttpsRedirectFilter> registration =
                register(new HttpsRedirectFilter(), "httpsRedirectFilter", ChainOrder.HTTPS_REDIRECT);
        registration.setEnabled(enabled);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(
            SlidingWindowRateLimiter limiter,
            Clock clock,
            @Value("${pipeline.rate-limit.enabled:true}") boolean enabled) {
        FilterRegistrationBean<RateLimitFilter> registration =
                register(new RateLimitFilter(limiter, clock), "rateLimitFilter", ChainOrder.RATE_LIMIT);
        registration.setEnabled(enabled);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RecoveryFilter> recoveryFilter() {
        return register(new RecoveryFilter(), "recoveryFilter", ChainOrder.RECOVERY);
    }

    @Bean
    public FilterRegistrationBean<RequestLoggingFilter> requestLoggingFilter() {
        return register(new RequestLoggingFilter(), "requestLoggingFilter", ChainOrder.REQUEST_LOGGING);
    }

    @Bean
    public FilterRegistrationBean<DeadlineFilter> deadlineFilter(
            ExecutorService deadlineExecutor,
            Clock clock,
            @Value("${pipeline.request-timeout-ms:60000}") long timeoutMs) {
        DeadlineFilter filter = new DeadlineFilter(deadlineExecutor, clock, Duration.ofMillis(timeoutMs));
        return register(filter, "deadlineFilter", ChainOrder.DEADLINE);
    }

    @Bean
    public FilterRegistrationBean<SecurityHeadersFilter> securityHeadersFilter(
            @Value("${pipeline.security.hsts-enabled:false}") boolean hstsEnabled) {
        return register(new SecurityHeadersFilter(hstsEnabled), "securityHeadersFilter", ChainOrder.SECURITY_HEADERS);
    }

    @Bean
    public FilterRegistrationBean<CompressionFilter> compressionFilter(
            @Value("${pipeline.compression.level:6}") int level,
            @Value("${pipeline.compression.content-types:}") List<String> contentTypes) {
        List<String> types = contentTypes.stream().anyMatch(t -> !t.isBlank())
                ? contentTypes
                : CompressionFilter.DEFAULT_CONTENT_TYPES;
        return register(new CompressionFilter(level, types), "compressionFilter", ChainOrder.COMPRESSION);
    }

    @Bean
    public FilterRegistrationBean<EtagFilter> etagFilter() {
        return register(new EtagFilter(), "etagFilter", ChainOrder.ETAG);
    }

    private static <T extends Filter> FilterRegistrationBean<T> register(T filter, String name, int order) {
        FilterRegistrationBean<T> registration = new FilterRegistrationBean<>(filter);
        registration.setName(name);
        registration.setOrder(order);
        return registration;
    }
}
