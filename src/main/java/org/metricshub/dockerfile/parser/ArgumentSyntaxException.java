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
 * Thrown by an {@link ArgumentParser} when the arguments of an instruction
 * cannot be turned into a node chain. The message is the parser's own.
 */
public class ArgumentSyntaxException extends DockerfileParseException {

	private static final long serialVersionUID = 1L;

	public ArgumentSyntaxException(String msg) {
		super(msg);
	}

	public ArgumentSyntaxException(String msg, Throwable cause) {
		super(msg, cause);
	}

	public ArgumentSyntaxException(int lineno, String msg, Throwable cause) {
		super(lineno, msg, cause);
	}
}
