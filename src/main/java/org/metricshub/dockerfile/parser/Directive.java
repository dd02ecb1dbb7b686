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

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.dockerfile.util.DockerfileLogger;
import org.slf4j.Logger;

/**
 * Holds the state of parser directives while a Dockerfile is being parsed.
 * <p>
 * Parser directives, like {@code # escape=`}, must precede any instruction
 * or other comment, and the escape directive cannot be repeated. A fresh
 * instance is used for each parse.
 */
public class Directive {

	private static final Logger LOG = DockerfileLogger.getLogger(Directive.class);

	/** Default escape token */
	public static final char DEFAULT_ESCAPE_TOKEN = '\\';

	private static final Pattern ESCAPE_COMMAND = Pattern
			.compile("^#[ \\t]*escape[ \\t]*=[ \\t]*(?<escapechar>.).*$", Pattern.DOTALL);

	private char escapeToken;
	private Pattern lineEscapePattern;
	private boolean processingComplete;
	private boolean escapeSeen;

	/**
	 * Creates a directive state with the default escape token.
	 */
	public Directive() {
		setEscapeToken(String.valueOf(DEFAULT_ESCAPE_TOKEN));
	}

	/**
	 * @return the current escape token
	 */
	public char getEscapeToken() {
		return escapeToken;
	}

	/**
	 * @return the pattern matching the escape token and trailing blanks at the end of a line
	 */
	Pattern getLineEscapePattern() {
		return lineEscapePattern;
	}

	/**
	 * @return whether parser directives are no longer recognized
	 */
	public boolean isProcessingComplete() {
		return processingComplete;
	}

	/**
	 * Sets the escape token used for line continuation and word escaping.
	 *
	 * @param s the new escape token, either a backtick or a backslash
	 * @throws InvalidEscapeTokenException if {@code s} is any other value
	 */
	void setEscapeToken(String s) {
		if (!"`".equals(s) && !"\\".equals(s)) {
			throw new InvalidEscapeTokenException(s);
		}
		escapeToken = s.charAt(0);
		lineEscapePattern = Pattern.compile(Pattern.quote(s) + "[ \\t]*\\z");
	}

	/**
	 * Looks for a parser directive, like {@code # escape=<char>}, in the
	 * specified physical line. The first line that is not a directive closes
	 * the directive window for good.
	 *
	 * @param line a physical line, comments not stripped
	 * @throws DuplicateEscapeDirectiveException if the escape directive was already seen
	 * @throws InvalidEscapeTokenException if the directive names an unsupported token
	 */
	void possibleParserDirective(String line) {
		if (processingComplete) {
			return;
		}

		Matcher matcher = ESCAPE_COMMAND.matcher(line.toLowerCase(Locale.ROOT));
		if (matcher.matches()) {
			if (escapeSeen) {
				throw new DuplicateEscapeDirectiveException();
			}
			escapeSeen = true;
			setEscapeToken(matcher.group("escapechar"));
			LOG.debug("Escape token set to {}", escapeToken);
			return;
		}

		processingComplete = true;
	}
}
