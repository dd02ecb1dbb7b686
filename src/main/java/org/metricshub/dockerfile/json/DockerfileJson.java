package org.metricshub.dockerfile.json;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Dockerfile Parser
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import org.metricshub.dockerfile.parser.Node;
import org.metricshub.dockerfile.parser.ParseResult;

/**
 * Jackson-based JSON rendering of a parse result.
 * <p>
 * A node is written as an object with its {@code value}, {@code next},
 * {@code children}, {@code attributes}, {@code original}, {@code flags},
 * {@code startLine} and {@code endLine}. Members without content are omitted.
 * <p>
 * {@code next} is the whole argument chain as a flat array, so the nesting
 * depth of the document only grows with nested instructions, like ONBUILD.
 */
public final class DockerfileJson {

	private final ObjectMapper mapper;

	/**
	 * Creates a renderer writing indented JSON.
	 */
	public DockerfileJson() {
		this(createObjectMapper());
	}

	/**
	 * @param mapper mapper used to write the JSON documents
	 */
	public DockerfileJson(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * Creates the ObjectMapper used by default.
	 *
	 * @return an ObjectMapper writing indented JSON
	 */
	public static ObjectMapper createObjectMapper() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.enable(SerializationFeature.INDENT_OUTPUT);
		return mapper;
	}

	/**
	 * @param result parse result
	 * @return the JSON document of the parse result
	 */
	public String toJson(ParseResult result) {
		try {
			return mapper.writeValueAsString(toTree(result));
		} catch (JsonProcessingException e) {
			throw new DockerfileJsonException("Failed to write the parse result as JSON", e);
		}
	}

	/**
	 * @param result parse result
	 * @return the JSON tree of the parse result: escape token, warnings and AST
	 */
	public ObjectNode toTree(ParseResult result) {
		ObjectNode json = mapper.createObjectNode();
		json.put("escapeToken", String.valueOf(result.getEscapeToken()));
		ArrayNode warnings = json.putArray("warnings");
		for (String warning : result.getWarnings()) {
			warnings.add(warning);
		}
		json.set("ast", toTree(result.getAst()));
		return json;
	}

	/**
	 * @param node node of a parse tree
	 * @return the JSON tree of the node, its argument chain and its descendants
	 */
	public ObjectNode toTree(Node node) {
		ObjectNode json = toObject(node);
		if (node.getNext() != null) {
			ArrayNode next = json.putArray("next");
			for (Node member = node.getNext(); member != null; member = member.getNext()) {
				next.add(toObject(member));
			}
		}
		return json;
	}

	/**
	 * @return the members of a node, except its {@code next} chain
	 */
	private ObjectNode toObject(Node node) {
		ObjectNode json = mapper.createObjectNode();
		if (!node.getValue().isEmpty()) {
			json.put("value", node.getValue());
		}
		if (!node.getFlags().isEmpty()) {
			ArrayNode flags = json.putArray("flags");
			for (String flag : node.getFlags()) {
				flags.add(flag);
			}
		}
		if (!node.getAttributes().isEmpty()) {
			ObjectNode attributes = json.putObject("attributes");
			for (Map.Entry<String, Boolean> attribute : node.getAttributes().entrySet()) {
				attributes.put(attribute.getKey(), attribute.getValue().booleanValue());
			}
		}
		if (!node.getOriginal().isEmpty()) {
			json.put("original", node.getOriginal());
		}
		if (node.getStartLine() > 0) {
			json.put("startLine", node.getStartLine());
			json.put("endLine", node.getEndLine());
		}
		if (!node.getChildren().isEmpty()) {
			ArrayNode children = json.putArray("children");
			for (Node child : node.getChildren()) {
				children.add(toTree(child));
			}
		}
		return json;
	}
}
