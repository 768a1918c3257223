package com.GlobeLine.fpl_cache.loader;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ArrayNode;

import com.GlobeLine.fpl_cache.history.CsvTableReader;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Loads a historical CSV dataset as a JSON array of rows. The file's size and modification
 * time are its validation metadata, so revalidation is a local stat call.
 */
public class CsvFileLoader implements UpstreamLoader {

	private static final Logger logger = LoggerFactory.getLogger(CsvFileLoader.class);

	public static final String SIZE = "size";
	public static final String LAST_MODIFIED = "lastModifiedMillis";

	private final Path file;

	public CsvFileLoader(Path file) {
		this.file = file;
	}

	@Override
	public Mono<LoadResult> fetchFull() {
		return Mono.fromCallable(this::read)
				.subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public boolean supportsRevalidation() {
		return true;
	}

	@Override
	public Mono<Revalidation> revalidate(Map<String, String> validationMetadata) {
		return Mono.fromCallable(() -> {
			Map<String, String> current = fingerprint(Files.readAttributes(file, BasicFileAttributes.class));
			if (current.equals(validationMetadata)) {
				return Revalidation.unchanged();
			}
			logger.debug("CSV file {} changed on disk", file);
			return Revalidation.changed(read());
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private LoadResult read() throws IOException {
		BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
		ArrayNode rows;
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			rows = CsvTableReader.read(reader);
		}
		logger.info("Read {} rows from {}", rows.size(), file);
		return new LoadResult(rows, fingerprint(attributes));
	}

	private static Map<String, String> fingerprint(BasicFileAttributes attributes) {
		return Map.of(
				SIZE, Long.toString(attributes.size()),
				LAST_MODIFIED, Long.toString(attributes.lastModifiedTime().toMillis()));
	}
}
