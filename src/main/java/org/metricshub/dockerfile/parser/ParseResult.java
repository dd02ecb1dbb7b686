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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing a Dockerfile: the tree, the escape token in effect and
 * the warnings raised along the way.
 */
public final class ParseResult {

	private final Node ast;
	private final char escapeToken;
	private final List<String> warnings;

	ParseResult(Node ast, char escapeToken, List<String> warnings) {
		this.ast = ast;
		this.escapeToken = escapeToken;
		this.warnings = Collections.unmodifiableList(new ArrayList<String>(warnings));
	}

	/**
	 * @return the root node, with one child per instruction
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Node getAst() {
		return ast;
	}

	/**
	 * @return the escape token of the Dockerfile, backslash unless overridden by a directive
	 */
	public char getEscapeToken() {
		return escapeToken;
	}

	/**
	 * @return the non-fatal warnings, in the order they were raised
	 */
	public List<String> getWarnings() {
		return warnings;
	}

	/**
	 * Prints the warnings, one per line. Nothing is printed when there is no warning.
	 *
	 * @param out where the warnings are printed
	 */
	public void printWarnings(PrintStream out) {
		if (warnings.isEmpty()) {
			return;
		}
		out.print(String.join("\n", warnings) + "\n");
		out.flush();
	}
}
