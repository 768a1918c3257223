package com.GlobeLine.fpl_cache.health;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.GlobeLine.fpl_cache.config.FplApiProperties;
import com.GlobeLine.fpl_cache.connectors.FplApiClient;

/**
 * Connectivity of the FPL API, checked with the small event-status document.
 *
 * The FPL API being down does not take the service down with it (cached data is still served),
 * so failures are reported as OUT_OF_SERVICE rather than DOWN.
 */
@Component
public class FplApiHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(FplApiHealthIndicator.class);

	private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

	private final FplApiClient fplApiClient;
	private final FplApiProperties apiProperties;

	public FplApiHealthIndicator(FplApiClient fplApiClient, FplApiProperties apiProperties) {
		this.fplApiClient = fplApiClient;
		this.apiProperties = apiProperties;
	}

	@Override
	public Health health() {
		try {
			fplApiClient.getEventStatus()
					.timeout(HEALTH_CHECK_TIMEOUT)
					.doOnSuccess(status -> logger.debug("FPL API health check passed"))
					.block();

			return Health.up()
					.withDetail("api", "FPL API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("status", "reachable")
					.build();

		} catch (WebClientResponseException ex) {
			int statusCode = ex.getStatusCode().value();
			logger.warn("FPL API health check failed: HTTP error ({})", statusCode, ex);
			return Health.outOfService()
					.withDetail("api", "FPL API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("error", statusCode >= 500 ? "Server error - service unavailable" : "HTTP error " + statusCode)
					.withDetail("statusCode", statusCode)
					.build();

		} catch (Exception ex) {
			if (ex.getCause() instanceof TimeoutException) {
				logger.warn("FPL API health check failed: Request timeout after {} seconds", HEALTH_CHECK_TIMEOUT.getSeconds());
				return Health.outOfService()
						.withDetail("api", "FPL API")
						.withDetail("baseUrl", apiProperties.baseUrl())
						.withDetail("error", "Request timeout")
						.withDetail("timeoutSeconds", HEALTH_CHECK_TIMEOUT.getSeconds())
						.build();
			}

			logger.error("FPL API health check failed: Unexpected error", ex);
			return Health.outOfService()
					.withDetail("api", "FPL API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("error", ex.getMessage() != null ? ex.getMessage() : "Unknown error")
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();
		}
	}
}
