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
 * Turns the raw argument text of one instruction into a node chain and
 * its attributes.
 * <p>
 * Implementations must be deterministic and free of side effects: the
 * same parser instance is shared by every parse.
 */
@FunctionalInterface
public interface ArgumentParser {

	/**
	 * Parses the arguments of an instruction.
	 *
	 * @param rest argument text, the keyword and builder flags removed
	 * @param directive parser directives in effect, for the escape token
	 * @return the argument chain and attributes, never {@code null}
	 * @throws ArgumentSyntaxException when the arguments are malformed
	 */
	ParsedArguments parse(String rest, Directive directive);
}
