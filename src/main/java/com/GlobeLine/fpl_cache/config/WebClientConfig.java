package com.GlobeLine.fpl_cache.config;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import io.netty.channel.ChannelOption;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

@Configuration
@EnableConfigurationProperties(FplApiProperties.class)
public class WebClientConfig {

	private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

	// bootstrap-static alone is well over a megabyte
	private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

	@Bean
	public WebClient fplWebClient(FplApiProperties properties) {
		HttpClient httpClient = HttpClient.create()
				.responseTimeout(Duration.ofSeconds(30))
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000);

		return WebClient.builder()
				.baseUrl(properties.baseUrl())
				.defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
				.clientConnector(new ReactorClientHttpConnector(httpClient))
				.codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
				.filter(logRequestAndResponseWithLatency())
				.filter(retryFilter(properties))
				.build();
	}

	private ExchangeFilterFunction logRequestAndResponseWithLatency() {
		return (clientRequest, next) -> {
			Instant startTime = Instant.now();
			String method = clientRequest.method().name();
			String url = clientRequest.url().toString();

			if (logger.isDebugEnabled()) {
				logger.debug("Outgoing request to FPL API: {} {}", method, url);
			}

			return next.exchange(clientRequest)
					.doOnSuccess(response -> {
						Duration duration = Duration.between(startTime, Instant.now());
						int statusCode = response.statusCode().value();

						if (logger.isDebugEnabled()) {
							logger.debug("Received response from FPL API: {} in {}ms",
									statusCode, duration.toMillis());
						}

						if (response.statusCode().isError()) {
							logger.warn("FPL API returned error: {} for {} {} (took {}ms)",
									statusCode, method, url, duration.toMillis());
						}
					})
					.doOnError(error -> {
						Duration duration = Duration.between(startTime, Instant.now());

						if (error instanceof WebClientResponseException webClientError) {
							HttpStatus status = HttpStatus.resolve(webClientError.getStatusCode().value());
							logger.error("FPL API request failed: {} {} for {} {} (took {}ms) - {}",
									webClientError.getStatusCode().value(),
									status != null ? status.getReasonPhrase() : "Unknown",
									method, url, duration.toMillis(), webClientError.getMessage());
						} else {
							logger.error("FPL API request failed for {} {} (took {}ms) - {}",
									method, url, duration.toMillis(), error.getMessage(), error);
						}
					});
		};
	}

	/**
	 * Retries throttled (429), server-side (5xx) and connection failures with exponential backoff.
	 * Once retries are exhausted the last failure is propagated unchanged.
	 */
	private ExchangeFilterFunction retryFilter(FplApiProperties properties) {
		Retry retrySpec = Retry.backoff(properties.maxRetries(), properties.retryBackoff())
				.filter(WebClientConfig::isRetryable)
				.maxBackoff(Duration.ofSeconds(10))
				.onRetryExhaustedThrow((backoff, signal) -> signal.failure());

		return (request, next) -> next.exchange(request)
				.flatMap(response -> isRetryableStatus(response.statusCode())
						? response.createException().flatMap(ex -> Mono.<ClientResponse>error(ex))
						: Mono.just(response))
				.retryWhen(retrySpec);
	}

	static boolean isRetryable(Throwable error) {
		if (error instanceof WebClientResponseException responseError) {
			return isRetryableStatus(responseError.getStatusCode());
		}
		return error instanceof WebClientRequestException;
	}

	static boolean isRetryableStatus(HttpStatusCode status) {
		return status.value() == HttpStatus.TOO_MANY_REQUESTS.value() || status.is5xxServerError();
	}
}
