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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps instruction keywords to their argument parser and builds the node of
 * a complete logical line.
 * <p>
 * The keyword is matched case-insensitively and stored lower-cased in the
 * instruction node. Unknown keywords are not an error: they get a node with
 * no arguments.
 */
public final class InstructionDispatcher {

	private static final Map<String, ArgumentParser> DISPATCH;

	static {
		Map<String, ArgumentParser> dispatch = new HashMap<String, ArgumentParser>();
		dispatch.put(Command.ADD, LineParsers::parseMaybeJSONToList);
		dispatch.put(Command.ARG, LineParsers::parseNameOrNameVal);
		dispatch.put(Command.CMD, LineParsers::parseMaybeJSON);
		dispatch.put(Command.COPY, LineParsers::parseMaybeJSONToList);
		dispatch.put(Command.ENTRYPOINT, LineParsers::parseMaybeJSON);
		dispatch.put(Command.ENV, LineParsers::parseEnv);
		dispatch.put(Command.EXPOSE, LineParsers::parseStringsWhitespaceDelimited);
		dispatch.put(Command.FROM, LineParsers::parseStringsWhitespaceDelimited);
		dispatch.put(Command.HEALTHCHECK, LineParsers::parseHealthConfig);
		dispatch.put(Command.LABEL, LineParsers::parseLabel);
		dispatch.put(Command.MAINTAINER, LineParsers::parseString);
		dispatch.put(Command.ONBUILD, LineParsers::parseSubCommand);
		dispatch.put(Command.RUN, LineParsers::parseMaybeJSON);
		dispatch.put(Command.SHELL, LineParsers::parseMaybeJSON);
		dispatch.put(Command.STOPSIGNAL, LineParsers::parseString);
		dispatch.put(Command.USER, LineParsers::parseString);
		dispatch.put(Command.VOLUME, LineParsers::parseMaybeJSONToList);
		dispatch.put(Command.WORKDIR, LineParsers::parseString);
		DISPATCH = Collections.unmodifiableMap(dispatch);
	}

	private static final ArgumentParser IGNORE = LineParsers::parseIgnore;

	private InstructionDispatcher() {}

	/**
	 * Returns the argument parser of a keyword.
	 *
	 * @param keyword instruction keyword, in any case
	 * @return the registered parser, or the parser that ignores all arguments
	 */
	public static ArgumentParser getParser(String keyword) {
		ArgumentParser parser = DISPATCH.get(keyword.toLowerCase(Locale.ROOT));
		return parser == null ? IGNORE : parser;
	}

	/**
	 * @param keyword instruction keyword, in any case
	 * @return whether a dedicated argument parser is registered for this keyword
	 */
	public static boolean isKnown(String keyword) {
		return DISPATCH.containsKey(keyword.toLowerCase(Locale.ROOT));
	}

	/**
	 * @return sorted set of the keywords with a dedicated argument parser
	 */
	public static Set<String> keywords() {
		return Collections.unmodifiableSet(new TreeSet<String>(DISPATCH.keySet()));
	}

	/**
	 * Splits a logical line into keyword, flags and arguments, and builds the
	 * instruction node with the parser registered for the keyword.
	 *
	 * @param line complete logical line
	 * @param directive parser directives in effect
	 * @return the instruction node, without line information
	 * @throws ArgumentSyntaxException if the arguments are malformed
	 */
	static Node newNodeFromLine(String line, Directive directive) {
		SplitCommand split = splitCommand(line);

		ParsedArguments parsed = getParser(split.cmd).parse(split.args, directive);

		Node node = new Node(split.cmd, parsed.getNode());
		node.setOriginal(line);
		node.setFlags(split.flags);
		node.setAttributes(parsed.getAttributes());
		return node;
	}

	/**
	 * Keyword, builder flags and arguments of a logical line.
	 */
	static final class SplitCommand {
		final String cmd;
		final List<String> flags;
		final String args;

		SplitCommand(String cmd, List<String> flags, String args) {
			this.cmd = cmd;
			this.flags = flags;
			this.args = args;
		}
	}

	/**
	 * Splits a line into the lower-cased keyword, the builder flags and the
	 * arguments. Leading and trailing whitespace do not matter.
	 *
	 * @param line logical line
	 * @return the parts of the line
	 */
	static SplitCommand splitCommand(String line) {
		String[] cmdline = LineParsers.TOKEN_WHITESPACE.split(line.trim(), 2);
		String cmd = cmdline[0].toLowerCase(Locale.ROOT);

		String args = "";
		List<String> flags = new ArrayList<String>();
		if (cmdline.length == 2) {
			args = extractBuilderFlags(cmdline[1], flags);
		}

		return new SplitCommand(cmd, flags, args.trim());
	}

	/**
	 * Extracts the leading {@code --flag} words of the arguments. Quotes are
	 * removed from the flags and a backslash escapes the next character. A
	 * lone {@code --} ends the flags.
	 *
	 * @param line arguments of an instruction
	 * @param words list receiving the flags
	 * @return the remaining part of the line
	 */
	static String extractBuilderFlags(String line, List<String> words) {
		final int inSpaces = 0;
		final int inWord = 1;
		final int inQuote = 2;

		int phase = inSpaces;
		StringBuilder word = new StringBuilder();
		char quote = '\000';
		boolean blankOK = false;
		char ch = 0;

		for (int pos = 0; pos <= line.length(); pos++) {
			if (pos != line.length()) {
				ch = line.charAt(pos);
			}

			if (phase == inSpaces) {
				if (pos == line.length()) {
					break;
				}
				if (DockerfileParser.isSpace(ch)) {
					continue;
				}

				// only keep going if the next word starts with --
				if (ch != '-' || pos + 1 == line.length() || line.charAt(pos + 1) != '-') {
					return line.substring(pos);
				}

				phase = inWord;
			}
			if ((phase == inWord || phase == inQuote) && pos == line.length()) {
				if (!"--".contentEquals(word) && (blankOK || word.length() > 0)) {
					words.add(word.toString());
				}
				break;
			}
			if (phase == inWord) {
				if (DockerfileParser.isSpace(ch)) {
					phase = inSpaces;
					if ("--".contentEquals(word)) {
						return line.substring(pos);
					}
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
					phase = inQuote;
					continue;
				}
				if (ch == '\\') {
					if (pos + 1 == line.length()) {
						continue;
					}
					pos++;
					ch = line.charAt(pos);
				}
				word.append(ch);
				continue;
			}
			if (phase == inQuote) {
				if (ch == quote) {
					phase = inWord;
					continue;
				}
				if (ch == '\\') {
					if (pos + 1 == line.length()) {
						phase = inWord;
						continue;
					}
					pos++;
					ch = line.charAt(pos);
				}
				word.append(ch);
			}
		}

		return "";
	}
}
