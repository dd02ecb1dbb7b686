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

/**
 * Writes a parse result back as a Dockerfile: the escape directive when the
 * escape token is not the default one, then one line per instruction.
 * <p>
 * Each instruction is written as the logical line it was parsed from, so
 * continuations and comments are gone. Parsing the output gives the same tree,
 * with two exceptions:
 * <ul>
 * <li>a line that leaves a JSON array open, like {@code RUN echo [} at the end
 * of a file: written before another instruction, it absorbs it;</li>
 * <li>a last line that still ends with the escape token once the continuation
 * token was removed, like {@code RUN x \\} at the end of a file: it is kept as
 * {@code RUN x \}, and parsing it again drops that token.</li>
 * </ul>
 */
public final class DockerfileFormatter {

	private DockerfileFormatter() {}

	/**
	 * @param result parse result
	 * @return the Dockerfile text, one instruction per line
	 */
	public static String format(ParseResult result) {
		StringBuilder sb = new StringBuilder();
		if (result.getEscapeToken() != Directive.DEFAULT_ESCAPE_TOKEN) {
			sb.append("# escape=").append(result.getEscapeToken()).append('\n');
		}
		for (Node instruction : result.getAst().getChildren()) {
			sb.append(instruction.getOriginal()).append('\n');
		}
		return sb.toString();
	}
}
