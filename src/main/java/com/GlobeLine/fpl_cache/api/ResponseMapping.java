package com.GlobeLine.fpl_cache.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.GlobeLine.fpl_cache.exception.InvalidKeyInputException;
import com.GlobeLine.fpl_cache.exception.NotFoundException;
import com.GlobeLine.fpl_cache.exception.UpstreamUnavailableException;

import reactor.core.publisher.Mono;

/**
 * Status mapping shared by the REST controllers. Stale data is still a 200; the body says so.
 */
final class ResponseMapping {

	private static final Logger logger = LoggerFactory.getLogger(ResponseMapping.class);

	private ResponseMapping() {
	}

	static <T> Mono<ResponseEntity<T>> toResponse(Mono<T> body) {
		return body
				.map(value -> ResponseEntity.ok(value))
				.onErrorResume(NotFoundException.class, ex ->
					status(HttpStatus.NOT_FOUND, ex))
				.onErrorResume(InvalidKeyInputException.class, ex ->
					status(HttpStatus.BAD_REQUEST, ex))
				.onErrorResume(UpstreamUnavailableException.class, ex ->
					ex.getCause() instanceof NotFoundException
							? status(HttpStatus.NOT_FOUND, ex)
							: status(HttpStatus.SERVICE_UNAVAILABLE, ex))
				.onErrorResume(Exception.class, ex -> {
					logger.error("Unexpected error while serving request", ex);
					return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).<T>body(null));
				});
	}

	private static <T> Mono<ResponseEntity<T>> status(HttpStatus status, Exception ex) {
		logger.debug("Responding {}: {}", status.value(), ex.getMessage());
		return Mono.just(ResponseEntity.status(status).<T>body(null));
	}
}
