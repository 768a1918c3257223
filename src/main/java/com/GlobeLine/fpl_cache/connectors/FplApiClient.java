package com.GlobeLine.fpl_cache.connectors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;

import com.GlobeLine.fpl_cache.exception.NotFoundException;
import com.GlobeLine.fpl_cache.exception.UpstreamRateLimitedException;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import reactor.core.publisher.Mono;

@Component
public class FplApiClient {

	public static final String BOOTSTRAP_STATIC = "/bootstrap-static/";
	public static final String FIXTURES = "/fixtures/";
	public static final String EVENT_STATUS = "/event-status/";

	private final WebClient fplWebClient;
	private final RateLimiter rateLimiter;

	public FplApiClient(
			@Qualifier("fplWebClient") WebClient fplWebClient,
			@Qualifier("fplUpstreamRateLimiter") RateLimiter rateLimiter) {
		this.fplWebClient = fplWebClient;
		this.rateLimiter = rateLimiter;
	}

	/**
	 * Fetches the bootstrap snapshot: players (elements), teams, positions and gameweeks (events).
	 */
	public Mono<JsonNode> getBootstrapStatic() {
		return get(BOOTSTRAP_STATIC);
	}

	/**
	 * Fetches every fixture of the season.
	 */
	public Mono<JsonNode> getFixtures() {
		return get(FIXTURES);
	}

	/**
	 * Fetches fixtures, history and past seasons of a single player.
	 */
	public Mono<JsonNode> getElementSummary(int playerId) {
		return get(elementSummaryPath(playerId));
	}

	/**
	 * Small status document, used as a connectivity check.
	 */
	public Mono<JsonNode> getEventStatus() {
		return get(EVENT_STATUS);
	}

	public static String elementSummaryPath(int playerId) {
		return "/element-summary/" + playerId + "/";
	}

	public Mono<JsonNode> get(String path) {
		return conditionalGet(path, null, null).mapNotNull(UpstreamResponse::body);
	}

	/**
	 * GETs {@code path}, sending If-None-Match / If-Modified-Since when validators are given.
	 *
	 * @return Mono of the response; a 304 answer yields {@link UpstreamResponse#notModified()}
	 */
	public Mono<UpstreamResponse> conditionalGet(String path, String ifNoneMatch, String ifModifiedSince) {
		return fplWebClient.get()
				.uri(path)
				.headers(headers -> {
					if (ifNoneMatch != null) {
						headers.setIfNoneMatch(ifNoneMatch);
					}
					if (ifModifiedSince != null) {
						headers.set(HttpHeaders.IF_MODIFIED_SINCE, ifModifiedSince);
					}
				})
				.exchangeToMono(response -> {
					int status = response.statusCode().value();
					if (status == HttpStatus.NOT_MODIFIED.value()) {
						return response.releaseBody().thenReturn(UpstreamResponse.notModified());
					}
					if (status == HttpStatus.NOT_FOUND.value()) {
						return response.releaseBody()
								.then(Mono.<UpstreamResponse>error(new NotFoundException("FPL API resource not found: " + path)));
					}
					if (response.statusCode().isError()) {
						return response.createException().flatMap(ex -> Mono.<UpstreamResponse>error(ex));
					}
					HttpHeaders headers = response.headers().asHttpHeaders();
					return response.bodyToMono(JsonNode.class)
							.map(body -> new UpstreamResponse(status, body, headers.getFirst(HttpHeaders.ETAG),
									headers.getFirst(HttpHeaders.LAST_MODIFIED)));
				})
				.transformDeferred(RateLimiterOperator.of(rateLimiter))
				.onErrorMap(RequestNotPermitted.class,
						ex -> new UpstreamRateLimitedException("FPL API rate limit reached for " + path, ex));
	}
}
