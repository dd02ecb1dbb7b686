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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an {@link ArgumentParser}: the head of the argument chain
 * (possibly {@code null}) and the attributes describing how the arguments
 * were written.
 */
public final class ParsedArguments {

	private static final ParsedArguments EMPTY = new ParsedArguments(null, null);

	private final Node node;
	private final Map<String, Boolean> attributes;

	/**
	 * @param node head of the argument chain, {@code null} when there are no arguments
	 * @param attributes attributes for the instruction node, may be {@code null}
	 */
	public ParsedArguments(Node node, Map<String, Boolean> attributes) {
		this.node = node;
		this.attributes = attributes == null
				? Collections.<String, Boolean>emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<String, Boolean>(attributes));
	}

	/**
	 * @param node head of the argument chain
	 * @return arguments without attributes
	 */
	public static ParsedArguments of(Node node) {
		return node == null ? EMPTY : new ParsedArguments(node, null);
	}

	/**
	 * @return arguments with no chain and no attributes
	 */
	public static ParsedArguments empty() {
		return EMPTY;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Node getNode() {
		return node;
	}

	public Map<String, Boolean> getAttributes() {
		return attributes;
	}
}
