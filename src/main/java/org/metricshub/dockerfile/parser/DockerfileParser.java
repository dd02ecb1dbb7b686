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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.metricshub.dockerfile.util.DockerfileLogger;
import org.metricshub.dockerfile.util.DockerfileSource;
import org.metricshub.dockerfile.util.ParserSettings;
import org.slf4j.Logger;

/**
 * Converts a Dockerfile into a parse tree.
 * <p>
 * Physical lines are joined into logical lines when they end with the escape
 * token, or when they open a JSON array that is not closed yet. Whole-line
 * comments are dropped, and the escape parser directive is honored when it
 * comes before anything else. Each logical line then goes through the
 * {@link InstructionDispatcher} and becomes a child of the root node.
 * <p>
 * An instance can be reused: each call to {@code parse} starts from fresh
 * directives and a fresh tree.
 */
public class DockerfileParser {

	private static final Logger LOG = DockerfileLogger.getLogger(DockerfileParser.class);

	static final String EMPTY_CONTINUATION_WARNING = "[WARNING]: Empty continuation line found in:\n    ";
	static final String EMPTY_CONTINUATION_DEPRECATION = "[WARNING]: Empty continuation lines will become errors in a future release.";

	private static final char UTF8_BOM = '\uFEFF';

	private final ParserSettings settings;

	/**
	 * Creates a parser with the default settings.
	 */
	public DockerfileParser() {
		this(new ParserSettings());
	}

	/**
	 * Creates a parser with the specified settings.
	 *
	 * @param settings parser settings, like the maximum line length
	 */
	public DockerfileParser(ParserSettings settings) {
		this.settings = settings;
	}

	/**
	 * Parses a Dockerfile held in a string.
	 *
	 * @param dockerfile contents of the Dockerfile
	 * @return the parse result
	 * @throws DockerfileParseException if the Dockerfile is invalid
	 */
	public ParseResult parse(String dockerfile) {
		try {
			return parse(new StringReader(dockerfile));
		} catch (IOException e) {
			// a StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Parses a Dockerfile read from a stream, decoded with the charset of the settings.
	 *
	 * @param in the Dockerfile
	 * @return the parse result
	 * @throws IOException if reading fails
	 * @throws DockerfileParseException if the Dockerfile is invalid
	 */
	public ParseResult parse(InputStream in) throws IOException {
		return parse(new InputStreamReader(in, settings.getCharset()));
	}

	/**
	 * Parses the Dockerfile of the specified source. The reader of the source
	 * is closed afterwards.
	 *
	 * @param source the Dockerfile
	 * @return the parse result
	 * @throws IOException if reading fails
	 * @throws DockerfileParseException if the Dockerfile is invalid
	 */
	public ParseResult parse(DockerfileSource source) throws IOException {
		LOG.debug("Parsing {}", source.getDescription());
		try (Reader reader = source.getReader()) {
			return parse(reader);
		}
	}

	/**
	 * Reads lines from a reader and parses them into a tree.
	 *
	 * @param reader the Dockerfile
	 * @return the parse result
	 * @throws IOException if reading fails
	 * @throws DockerfileParseException if the Dockerfile is invalid
	 */
	public ParseResult parse(Reader reader) throws IOException {
		Directive d = new Directive();
		LineReader lines = new LineReader(reader, settings.getMaxLineLength());
		Node root = Node.newRoot();
		List<String> warnings = new ArrayList<String>();

		String raw;
		while ((raw = lines.readLine()) != null) {
			if (lines.getLineNumber() == 1) {
				raw = stripByteOrderMark(raw);
			}
			String processed = processLine(d, raw, true);
			int startLine = lines.getLineNumber();

			Continuation continuation = continuateLine(processed, d);
			if (continuation.complete && continuation.line.isEmpty()) {
				continue;
			}

			boolean hasEmptyContinuationLine = false;
			while (!continuation.complete && (raw = lines.readLine()) != null) {
				processed = processLine(d, raw, false);

				if (isComment(raw)) {
					continue;
				}
				if (isEmptyContinuationLine(processed)) {
					hasEmptyContinuationLine = true;
					continue;
				}

				continuation = continuateLine(continuation.line + processed, d);
			}

			String line = continuation.line;
			if (hasEmptyContinuationLine) {
				String warning = EMPTY_CONTINUATION_WARNING + line;
				LOG.warn("Empty continuation line in instruction at line {}", startLine);
				warnings.add(warning);
			}

			Node child;
			try {
				child = InstructionDispatcher.newNodeFromLine(line, d);
			} catch (ArgumentSyntaxException e) {
				throw new ArgumentSyntaxException(startLine, e.getMessage(), e);
			}
			root.addChild(child, startLine, lines.getLineNumber());
			LOG.debug("Lines {}-{}: {}", startLine, lines.getLineNumber(), child.getValue());
		}

		if (!warnings.isEmpty()) {
			warnings.add(EMPTY_CONTINUATION_DEPRECATION);
		}

		if (root.getStartLine() < 0) {
			throw new NoInstructionsException();
		}

		return new ParseResult(root, d.getEscapeToken(), warnings);
	}

	/**
	 * Logical line being assembled, and whether it is complete.
	 */
	static final class Continuation {
		final String line;
		final boolean complete;

		Continuation(String line, boolean complete) {
			this.line = line;
			this.complete = complete;
		}
	}

	/**
	 * Decides whether a logical line needs the next physical line. A trailing
	 * escape token is removed from the line; an open JSON array is kept as is.
	 *
	 * @param line logical line assembled so far
	 * @param d directives in effect
	 * @return the line, possibly stripped of its trailing escape, and whether it is complete
	 */
	static Continuation continuateLine(String line, Directive d) {
		if (endsWithEscape(line, d)) {
			return new Continuation(stripTrailingEscape(line, d), false);
		}
		if (hasOpenJsonArray(line)) {
			return new Continuation(line, false);
		}
		return new Continuation(line, true);
	}

	/**
	 * @param line logical line assembled so far
	 * @param d directives in effect
	 * @return whether the line ends with the escape token, possibly followed by blanks
	 */
	static boolean endsWithEscape(String line, Directive d) {
		return d.getLineEscapePattern().matcher(line).find();
	}

	/**
	 * @param line line ending with the escape token
	 * @param d directives in effect
	 * @return the line without the trailing escape token and blanks
	 */
	static String stripTrailingEscape(String line, Directive d) {
		Matcher matcher = d.getLineEscapePattern().matcher(line);
		return matcher.replaceAll("");
	}

	/**
	 * @param line logical line assembled so far
	 * @return whether the line contains a {@code [} that is not followed by any {@code ]}
	 */
	static boolean hasOpenJsonArray(String line) {
		int open = line.lastIndexOf('[');
		return open >= 0 && line.indexOf(']', open) < 0;
	}

	/**
	 * Prepares a physical line: leading whitespace is removed when the line
	 * starts a new statement, and whole-line comments are emptied. The line
	 * is also checked for a parser directive.
	 * <p>
	 * Leading whitespace of continuation lines is kept, as older versions did.
	 */
	private static String processLine(Directive d, String token, boolean stripLeftWhitespace) {
		if (stripLeftWhitespace) {
			token = trimLeft(token);
		}
		d.possibleParserDirective(token);
		return trimComments(token);
	}

	static String stripByteOrderMark(String line) {
		if (!line.isEmpty() && line.charAt(0) == UTF8_BOM) {
			return line.substring(1);
		}
		return line;
	}

	static String trimComments(String line) {
		return line.startsWith("#") ? "" : line;
	}

	static boolean isComment(String line) {
		return trimLeft(line).startsWith("#");
	}

	static boolean isEmptyContinuationLine(String line) {
		return trimLeft(line).isEmpty();
	}

	/**
	 * @param s text to trim
	 * @return the text without its leading whitespace
	 */
	static String trimLeft(String s) {
		int i = 0;
		while (i < s.length() && isSpace(s.charAt(i))) {
			i++;
		}
		return s.substring(i);
	}

	/**
	 * Whitespace as understood by the parser: ASCII blanks and line breaks,
	 * NEL, NO-BREAK SPACE and the Unicode space separators.
	 *
	 * @param ch character to test
	 * @return whether {@code ch} is whitespace
	 */
	static boolean isSpace(char ch) {
		switch (ch) {
		case '\t':
		case '\n':
		case '\u000B':
		case '\f':
		case '\r':
		case ' ':
		case '\u0085':
		case '\u00A0':
			return true;
		default:
			return ch > '\u00FF' && (Character.isSpaceChar(ch) || Character.isWhitespace(ch));
		}
	}
}
