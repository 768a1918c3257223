package com.GlobeLine.fpl_cache.cache;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.GlobeLine.fpl_cache.exception.InvalidKeyInputException;

/**
 * Derives stable cache keys from a logical request descriptor (namespace + parameters).
 *
 * Parameters are sorted by name and their values stringified canonically before hashing,
 * so the same semantic request yields the same key whatever order it was built in.
 * Accepted value types: null, strings, characters, booleans, numbers, enums, UUIDs,
 * java.time values, Optionals, collections/arrays and string-keyed maps of those.
 * Lists and arrays are ordered; other collections are treated as unordered.
 */
@Component
public class KeyCodec {

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private final ObjectMapper canonicalMapper = new ObjectMapper()
			.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

	public CacheKey deriveKey(String namespace, List<KeyParam> params) {
		if (namespace == null || namespace.isBlank()) {
			throw new InvalidKeyInputException("Cache namespace must not be blank");
		}
		List<KeyParam> safeParams = params != null ? params : List.of();

		List<ArrayNode> pairs = new ArrayList<>(safeParams.size());
		for (KeyParam param : safeParams) {
			if (param == null || param.name() == null || param.name().isBlank()) {
				throw new InvalidKeyInputException("Parameter names must not be blank in namespace " + namespace);
			}
			ArrayNode pair = NODES.arrayNode();
			pair.add(param.name());
			pair.add(canonicalValue(param.name(), param.value()));
			pairs.add(pair);
		}
		pairs.sort(Comparator.comparing((ArrayNode pair) -> pair.get(0).asText())
				.thenComparing(pair -> pair.get(1).toString()));

		ObjectNode descriptor = NODES.objectNode();
		descriptor.put("ns", namespace);
		descriptor.set("params", NODES.arrayNode().addAll(pairs));

		return new CacheKey(sha256(serialize(descriptor)));
	}

	public CacheKey deriveKey(String namespace, Map<String, ?> params) {
		List<KeyParam> list = new ArrayList<>();
		if (params != null) {
			params.forEach((name, value) -> list.add(KeyParam.of(name, value)));
		}
		return deriveKey(namespace, list);
	}

	private JsonNode canonicalValue(String name, Object value) {
		if (value == null) {
			return NODES.nullNode();
		}
		if (value instanceof Optional<?> optional) {
			return canonicalValue(name, optional.orElse(null));
		}
		if (value instanceof CharSequence || value instanceof Character || value instanceof UUID) {
			return NODES.textNode(value.toString());
		}
		if (value instanceof Enum<?> enumValue) {
			return NODES.textNode(enumValue.name());
		}
		if (value instanceof Boolean bool) {
			return NODES.booleanNode(bool);
		}
		if (value instanceof Number number) {
			return NODES.numberNode(canonicalNumber(name, number));
		}
		if (value instanceof TemporalAccessor) {
			return NODES.textNode(value.toString());
		}
		if (value instanceof Collection<?> collection) {
			List<JsonNode> elements = new ArrayList<>(collection.size());
			collection.forEach(element -> elements.add(canonicalValue(name, element)));
			// lists keep their order; sets and other collections iterate in an unstable order
			if (!(collection instanceof List<?>)) {
				elements.sort(Comparator.comparing(JsonNode::toString));
			}
			return NODES.arrayNode().addAll(elements);
		}
		if (value.getClass().isArray()) {
			ArrayNode array = NODES.arrayNode();
			int length = Array.getLength(value);
			for (int i = 0; i < length; i++) {
				array.add(canonicalValue(name, Array.get(value, i)));
			}
			return array;
		}
		if (value instanceof Map<?, ?> map) {
			TreeMap<String, JsonNode> sorted = new TreeMap<>();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (!(entry.getKey() instanceof String mapKey)) {
					throw new InvalidKeyInputException("Parameter '" + name + "' contains a map with a non-string key");
				}
				sorted.put(mapKey, canonicalValue(name, entry.getValue()));
			}
			ObjectNode object = NODES.objectNode();
			sorted.forEach(object::set);
			return object;
		}
		throw new InvalidKeyInputException("Parameter '" + name + "' has a value of unsupported type "
				+ value.getClass().getName());
	}

	private BigDecimal canonicalNumber(String name, Number number) {
		if (number instanceof BigDecimal decimal) {
			return decimal.stripTrailingZeros();
		}
		if (number instanceof BigInteger integer) {
			return new BigDecimal(integer);
		}
		if (number instanceof Double || number instanceof Float) {
			double d = number.doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				throw new InvalidKeyInputException("Parameter '" + name + "' is not a finite number: " + number);
			}
			return new BigDecimal(number.toString()).stripTrailingZeros();
		}
		if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
			return BigDecimal.valueOf(number.longValue());
		}
		try {
			return new BigDecimal(number.toString()).stripTrailingZeros();
		} catch (NumberFormatException ex) {
			throw new InvalidKeyInputException("Parameter '" + name + "' is not a canonical number: " + number, ex);
		}
	}

	private byte[] serialize(ObjectNode descriptor) {
		try {
			return canonicalMapper.writeValueAsBytes(descriptor);
		} catch (JsonProcessingException ex) {
			throw new InvalidKeyInputException("Unable to serialize request descriptor", ex);
		}
	}

	private static String sha256(byte[] canonical) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(canonical));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}
}
