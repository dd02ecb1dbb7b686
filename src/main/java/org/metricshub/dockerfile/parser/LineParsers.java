package org.metricshub.dockerfile.parser;

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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Argument parsers of the built-in Dockerfile instructions.
 * <p>
 * Each parser receives the arguments of an instruction, without the keyword
 * and without the builder flags, and returns the argument chain that is
 * attached as the {@code next} of the instruction node.
 */
public final class LineParsers {

	/** Attribute set on instructions whose arguments were written as a JSON array. */
	public static final String ATTRIBUTE_JSON = "json";

	static final String NOT_STRING_ARRAY = "when using JSON array syntax, arrays must be comprised of strings only";

	static final Pattern TOKEN_WHITESPACE = Pattern.compile("[\\t\\u000B\\f\\r ]+");

	// stricter than Docker, which takes the leading array and ignores the text after it
	private static final ObjectMapper MAPPER = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

	private static final Map<String, Boolean> JSON_ATTRIBUTES = Collections.singletonMap(ATTRIBUTE_JSON, Boolean.TRUE);

	private static final int IN_SPACES = 0;
	private static final int IN_WORD = 1;
	private static final int IN_QUOTE = 2;

	private LineParsers() {}

	/**
	 * Ignores the arguments. The instruction is still part of the tree,
	 * without any argument.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return empty arguments
	 */
	public static ParsedArguments parseIgnore(String rest, Directive d) {
		return ParsedArguments.empty();
	}

	/**
	 * Parses a statement made of another statement, like ONBUILD:
	 * {@code ONBUILD RUN foo bar} gives {@code (onbuild (run "foo bar"))}.
	 *
	 * @param rest arguments, a full instruction line
	 * @param d directives in effect
	 * @return a chain made of one node whose only child is the nested instruction
	 */
	public static ParsedArguments parseSubCommand(String rest, Directive d) {
		if (rest.isEmpty()) {
			return ParsedArguments.empty();
		}

		Node child = InstructionDispatcher.newNodeFromLine(rest, d);
		Node node = new Node();
		node.addChild(child);
		return ParsedArguments.of(node);
	}

	/**
	 * Splits a statement into words, delimited by spaces or quoted. Quotes
	 * are kept in the words; they are stripped later, when the instruction is
	 * evaluated. The escape token keeps the next character in the word,
	 * except inside single quotes.
	 *
	 * @param rest text to split
	 * @param d directives in effect
	 * @return the words
	 */
	static List<String> parseWords(String rest, Directive d) {
		char escapeToken = d.getEscapeToken();
		List<String> words = new ArrayList<String>();
		int phase = IN_SPACES;
		StringBuilder word = new StringBuilder();
		char quote = '\000';
		boolean blankOK = false;
		char ch = 0;

		for (int pos = 0; pos <= rest.length(); pos++) {
			if (pos != rest.length()) {
				ch = rest.charAt(pos);
			}

			if (phase == IN_SPACES) {
				if (pos == rest.length()) {
					break;
				}
				if (DockerfileParser.isSpace(ch)) {
					continue;
				}
				phase = IN_WORD;
			}
			if ((phase == IN_WORD || phase == IN_QUOTE) && pos == rest.length()) {
				if (blankOK || word.length() > 0) {
					words.add(word.toString());
				}
				break;
			}
			if (phase == IN_WORD) {
				if (DockerfileParser.isSpace(ch)) {
					phase = IN_SPACES;
					if (blankOK || word.length() > 0) {
						words.add(word.toString());
					}
					word.setLength(0);
					blankOK = false;
					continue;
				}
				if (ch == '\'' || ch == '"') {
					quote = ch;
					blankOK = true;
					phase = IN_QUOTE;
				}
				if (ch == escapeToken) {
					if (pos + 1 == rest.length()) {
						// escape token at the end of the line
						continue;
					}
					// outside quotes, keep the escape token and the escaped char, even a quote
					word.append(ch);
					pos++;
					ch = rest.charAt(pos);
				}
				word.append(ch);
				continue;
			}
			if (phase == IN_QUOTE) {
				if (ch == quote) {
					phase = IN_WORD;
				}
				// nothing can be escaped within single quotes
				if (ch == escapeToken && quote != '\'') {
					if (pos + 1 == rest.length()) {
						phase = IN_WORD;
						continue;
					}
					pos++;
					word.append(ch);
					ch = rest.charAt(pos);
				}
				word.append(ch);
			}
		}

		return words;
	}

	/**
	 * Parses environment-like statements. Both the legacy {@code KEY name value}
	 * form and the {@code KEY name=value ...} form are supported: the first
	 * word tells which one is used. Variables are not expanded here.
	 *
	 * @param rest arguments
	 * @param key instruction name, used in error messages
	 * @param d directives in effect
	 * @return chain alternating names and values, or {@code null} without arguments
	 */
	static Node parseNameVal(String rest, String key, Directive d) {
		List<String> words = parseWords(rest, d);
		if (words.isEmpty()) {
			return null;
		}

		// legacy form
		if (!words.get(0).contains("=")) {
			String[] parts = TOKEN_WHITESPACE.split(rest, 2);
			if (parts.length < 2) {
				throw new ArgumentSyntaxException(key + " must have two arguments");
			}
			return newKeyValueNode(parts[0], parts[1]);
		}

		Node rootNode = null;
		Node prevNode = null;
		for (String word : words) {
			int eq = word.indexOf('=');
			if (eq < 0) {
				throw new ArgumentSyntaxException(
						"Syntax error - can't find = in " + Node.quote(word) + ". Must be of the form: name=value");
			}
			Node node = newKeyValueNode(word.substring(0, eq), word.substring(eq + 1));
			if (rootNode == null) {
				rootNode = node;
			}
			if (prevNode != null) {
				prevNode.setNext(node);
			}
			prevNode = node.getNext();
		}

		return rootNode;
	}

	private static Node newKeyValueNode(String key, String value) {
		return new Node(key, new Node(value));
	}

	/**
	 * Parses the arguments of ENV.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return chain alternating names and values
	 */
	public static ParsedArguments parseEnv(String rest, Directive d) {
		return ParsedArguments.of(parseNameVal(rest, "ENV", d));
	}

	/**
	 * Parses the arguments of LABEL.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return chain alternating names and values
	 */
	public static ParsedArguments parseLabel(String rest, Directive d) {
		return ParsedArguments.of(parseNameVal(rest, "LABEL", d));
	}

	/**
	 * Parses keyword definitions and assignments, like
	 * {@code name1 name2= name3="" name4=value}. Each word becomes a node;
	 * assignments are not split.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return one node per word
	 */
	public static ParsedArguments parseNameOrNameVal(String rest, Directive d) {
		return ParsedArguments.of(chain(parseWords(rest, d)));
	}

	/**
	 * Parses a whitespace-delimited list of arguments.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return one node per argument
	 */
	public static ParsedArguments parseStringsWhitespaceDelimited(String rest, Directive d) {
		if (rest.isEmpty()) {
			return ParsedArguments.empty();
		}
		List<String> values = new ArrayList<String>();
		Collections.addAll(values, TOKEN_WHITESPACE.split(rest, -1));
		return ParsedArguments.of(chain(values));
	}

	/**
	 * Keeps the arguments as one single string.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return a single node
	 */
	public static ParsedArguments parseString(String rest, Directive d) {
		if (rest.isEmpty()) {
			return ParsedArguments.empty();
		}
		return ParsedArguments.of(new Node(rest));
	}

	/**
	 * Parses a JSON array of strings.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return one node per array element, with the {@code json} attribute
	 * @throws ArgumentSyntaxException if the arguments are not a JSON array of strings
	 */
	public static ParsedArguments parseJSON(String rest, Directive d) {
		ParsedArguments parsed = tryParseJSON(rest);
		if (parsed == null) {
			throw new ArgumentSyntaxException("Error parsing \"" + DockerfileParser.trimLeft(rest) + "\" as a JSON array");
		}
		return parsed;
	}

	/**
	 * @return the parsed array, or {@code null} when the text is not a JSON array
	 * @throws ArgumentSyntaxException when the text is a JSON array with non-string elements
	 */
	private static ParsedArguments tryParseJSON(String rest) {
		String text = DockerfileParser.trimLeft(rest);
		if (!text.startsWith("[")) {
			return null;
		}

		JsonNode array;
		try {
			array = MAPPER.readTree(text);
		} catch (JsonProcessingException e) {
			return null;
		}
		if (array == null || !array.isArray()) {
			return null;
		}

		List<String> values = new ArrayList<String>();
		for (JsonNode element : array) {
			if (!element.isTextual()) {
				throw new ArgumentSyntaxException(NOT_STRING_ARRAY);
			}
			values.add(element.textValue());
		}

		return new ParsedArguments(chain(values), JSON_ATTRIBUTES);
	}

	/**
	 * Parses a JSON array of strings when the arguments look like one,
	 * otherwise keeps the arguments as one single string.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return the argument chain
	 */
	public static ParsedArguments parseMaybeJSON(String rest, Directive d) {
		if (rest.isEmpty()) {
			return ParsedArguments.empty();
		}

		ParsedArguments parsed = tryParseJSON(rest);
		if (parsed != null) {
			return parsed;
		}

		return ParsedArguments.of(new Node(rest));
	}

	/**
	 * Parses a JSON array of strings when the arguments look like one,
	 * otherwise splits the arguments on whitespace.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return the argument chain
	 */
	public static ParsedArguments parseMaybeJSONToList(String rest, Directive d) {
		ParsedArguments parsed = tryParseJSON(rest);
		if (parsed != null) {
			return parsed;
		}

		return parseStringsWhitespaceDelimited(rest, d);
	}

	/**
	 * Parses the arguments of HEALTHCHECK: a type, like {@code CMD} or
	 * {@code NONE}, followed by a command parsed like {@link #parseMaybeJSON}.
	 *
	 * @param rest arguments
	 * @param d directives in effect
	 * @return the type node followed by the command chain
	 */
	public static ParsedArguments parseHealthConfig(String rest, Directive d) {
		int sep = 0;
		while (sep < rest.length() && !DockerfileParser.isSpace(rest.charAt(sep))) {
			sep++;
		}
		int next = sep;
		while (next < rest.length() && DockerfileParser.isSpace(rest.charAt(next))) {
			next++;
		}

		if (sep == 0) {
			return ParsedArguments.empty();
		}

		ParsedArguments cmd = parseMaybeJSON(rest.substring(next), d);
		return new ParsedArguments(new Node(rest.substring(0, sep), cmd.getNode()), cmd.getAttributes());
	}

	private static Node chain(List<String> values) {
		Node top = null;
		Node prev = null;
		for (String value : values) {
			Node node = new Node(value);
			if (prev == null) {
				top = node;
			} else {
				prev.setNext(node);
			}
			prev = node;
		}
		return top;
	}
}
