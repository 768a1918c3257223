package com.GlobeLine.fpl_cache.history;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reads a CSV table with a header row into a JSON array of row objects.
 *
 * <p>Fields may be quoted; quotes inside quoted fields are doubled ({@code ""}).
 * Integers and decimals become JSON numbers, {@code True}/{@code False} become booleans and
 * empty cells become null. Quoted fields spanning several lines are not supported.</p>
 */
public final class CsvTableReader {

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private CsvTableReader() {
	}

	public static ArrayNode read(Reader reader) throws IOException {
		ArrayNode rows = NODES.arrayNode();
		try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
			String headerLine = br.readLine();
			if (headerLine == null) {
				return rows;
			}
			List<String> header = splitLine(stripBom(headerLine));

			String line;
			while ((line = br.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				List<String> cells = splitLine(line);
				ObjectNode row = NODES.objectNode();
				for (int i = 0; i < header.size(); i++) {
					row.set(header.get(i), i < cells.size() ? typed(cells.get(i)) : NODES.nullNode());
				}
				rows.add(row);
			}
		}
		return rows;
	}

	static List<String> splitLine(String line) {
		List<String> fields = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (quoted) {
				if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
					current.append('"');
					i++;
				} else if (c == '"') {
					quoted = false;
				} else {
					current.append(c);
				}
			} else if (c == '"') {
				quoted = true;
			} else if (c == ',') {
				fields.add(current.toString());
				current.setLength(0);
			} else {
				current.append(c);
			}
		}
		fields.add(current.toString());
		return fields;
	}

	static JsonNode typed(String cell) {
		String value = cell.trim();
		if (value.isEmpty()) {
			return NODES.nullNode();
		}
		if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
			return NODES.booleanNode(Boolean.parseBoolean(value));
		}
		if (value.matches("-?\\d{1,18}")) {
			return NODES.numberNode(Long.parseLong(value));
		}
		if (value.matches("-?\\d*\\.\\d+([eE][-+]?\\d+)?")) {
			return NODES.numberNode(Double.parseDouble(value));
		}
		return NODES.textNode(cell);
	}

	private static String stripBom(String line) {
		return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
	}
}
