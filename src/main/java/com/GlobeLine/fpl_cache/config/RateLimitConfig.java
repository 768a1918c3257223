package com.GlobeLine.fpl_cache.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

/**
 * Outbound rate limit for calls to the FPL API. Callers wait briefly for a permit
 * before the call is refused.
 */
@Configuration
public class RateLimitConfig {

	private static final int PERIOD_IN_SECONDS = 60;
	private static final Duration PERMIT_WAIT = Duration.ofSeconds(5);

	@Bean
	public RateLimiter fplUpstreamRateLimiter(FplApiProperties properties) {
		RateLimiterConfig config = RateLimiterConfig.custom()
				.limitForPeriod(properties.requestsPerMinute())
				.limitRefreshPeriod(Duration.ofSeconds(PERIOD_IN_SECONDS))
				.timeoutDuration(PERMIT_WAIT)
				.build();

		return RateLimiter.of("fplUpstream", config);
	}
}
