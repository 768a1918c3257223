package com.GlobeLine.fpl_cache.cache;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import com.GlobeLine.fpl_cache.exception.CacheStoreException;
import com.GlobeLine.fpl_cache.exception.CorruptEntryException;

/**
 * Cache store keeping one JSON document per entry ({@code <key>.json}) under a root directory.
 *
 * Writes go to a temporary file in the same directory and are then renamed over the target,
 * so a reader sees either the previous document or the complete new one. A failed write
 * leaves the previous entry in place. The root is created on first write and never cleared
 * except by {@link #purge()}.
 */
public class FileSystemCacheStore implements CacheStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCacheStore.class);

	static final String ENTRY_SUFFIX = ".json";
	static final String TEMP_SUFFIX = ".tmp";

	private final Path root;
	private final ObjectMapper mapper;

	public FileSystemCacheStore(Path root, ObjectMapper objectMapper) {
		this.root = root.toAbsolutePath().normalize();
		this.mapper = objectMapper.copy()
				.registerModule(new JavaTimeModule())
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.enable(SerializationFeature.INDENT_OUTPUT);
	}

	public Path getRoot() {
		return root;
	}

	@Override
	public Optional<CacheEntry> get(CacheKey key) {
		Path file = entryPath(key);
		byte[] content;
		try {
			content = Files.readAllBytes(file);
		} catch (NoSuchFileException ex) {
			return Optional.empty();
		} catch (IOException ex) {
			throw new CacheStoreException("Failed to read cache entry " + key + " from " + file, ex);
		}

		CacheEntry entry;
		try {
			entry = mapper.readValue(content, CacheEntry.class);
		} catch (IOException ex) {
			throw new CorruptEntryException(key, "unparseable document (" + content.length + " bytes)", ex);
		}

		if (entry == null) {
			throw new CorruptEntryException(key, "empty document", null);
		}
		if (!key.equals(entry.key())) {
			throw new CorruptEntryException(key, "document belongs to key " + entry.key(), null);
		}
		if (entry.payload() == null || entry.storedAt() == null) {
			throw new CorruptEntryException(key, "payload or storedAt missing", null);
		}
		return Optional.of(entry);
	}

	@Override
	public void put(CacheEntry entry) {
		Path target = entryPath(entry.key());
		Path temp = null;
		try {
			byte[] document = mapper.writeValueAsBytes(entry);
			Files.createDirectories(root);
			temp = Files.createTempFile(root, entry.key().value() + ".", TEMP_SUFFIX);
			Files.write(temp, document, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING,
					StandardOpenOption.SYNC);
			moveIntoPlace(temp, target);
			logger.debug("Stored cache entry {} ({} bytes)", entry.key(), document.length);
		} catch (IOException ex) {
			if (temp != null) {
				deleteTempFile(temp);
			}
			throw new CacheStoreException("Failed to write cache entry " + entry.key() + " to " + target, ex);
		}
	}

	@Override
	public void delete(CacheKey key) {
		try {
			if (Files.deleteIfExists(entryPath(key))) {
				logger.debug("Deleted cache entry {}", key);
			}
		} catch (IOException ex) {
			throw new CacheStoreException("Failed to delete cache entry " + key, ex);
		}
	}

	@Override
	public List<CacheKey> listExpired(Instant now) {
		List<CacheKey> expired = new ArrayList<>();
		for (CacheKey key : listKeys()) {
			try {
				get(key).filter(entry -> !now.isBefore(entry.expiresAt()))
						.ifPresent(entry -> expired.add(key));
			} catch (CorruptEntryException ex) {
				logger.debug("Listing unreadable entry {} as expired", key);
				expired.add(key);
			}
		}
		return expired;
	}

	@Override
	public int purge() {
		if (!Files.isDirectory(root)) {
			return 0;
		}
		int removed = 0;
		try (Stream<Path> files = Files.list(root)) {
			for (Path file : (Iterable<Path>) files::iterator) {
				String name = file.getFileName().toString();
				if (name.endsWith(ENTRY_SUFFIX) || name.endsWith(TEMP_SUFFIX)) {
					if (Files.deleteIfExists(file) && name.endsWith(ENTRY_SUFFIX)) {
						removed++;
					}
				}
			}
		} catch (IOException ex) {
			throw new CacheStoreException("Failed to purge cache root " + root, ex);
		}
		logger.info("Purged {} cache entries from {}", removed, root);
		return removed;
	}

	@Override
	public CacheStoreStats stats() {
		long count = 0;
		long bytes = 0;
		for (CacheKey key : listKeys()) {
			try {
				bytes += Files.size(entryPath(key));
				count++;
			} catch (NoSuchFileException ex) {
				logger.debug("Cache entry {} removed while collecting stats", key);
			} catch (IOException ex) {
				throw new CacheStoreException("Failed to stat cache entry " + key, ex);
			}
		}
		return new CacheStoreStats(root.toString(), count, bytes);
	}

	private List<CacheKey> listKeys() {
		if (!Files.isDirectory(root)) {
			return List.of();
		}
		try (Stream<Path> files = Files.list(root)) {
			return files.map(file -> file.getFileName().toString())
					.filter(name -> name.endsWith(ENTRY_SUFFIX))
					.map(name -> name.substring(0, name.length() - ENTRY_SUFFIX.length()))
					.filter(CacheKey::isValid)
					.sorted()
					.map(CacheKey::of)
					.toList();
		} catch (IOException ex) {
			throw new CacheStoreException("Failed to list cache root " + root, ex);
		}
	}

	private void moveIntoPlace(Path temp, Path target) throws IOException {
		try {
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException ex) {
			logger.warn("Filesystem under {} does not support atomic moves, replacing {} non-atomically",
					root, target.getFileName());
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private void deleteTempFile(Path temp) {
		try {
			Files.deleteIfExists(temp);
		} catch (IOException ex) {
			logger.warn("Could not remove temporary cache file {}: {}", temp, ex.getMessage());
		}
	}

	Path entryPath(CacheKey key) {
		return root.resolve(key.value() + ENTRY_SUFFIX);
	}
}
