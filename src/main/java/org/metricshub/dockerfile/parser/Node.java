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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Element of a Dockerfile parse tree.
 * <p>
 * A node has three structural members: its value, the {@code next} node and
 * its children. The value is the token itself, {@code next} is the following
 * non-child token of the same statement and the children are nested
 * statements. Written as an s-expression:
 *
 * <pre>
 * (value next (child child-next child-next-next) next-next)
 * </pre>
 * <p>
 * The root node of a parse has one child per instruction. Each instruction
 * node holds the lower-cased keyword as its value and the arguments as its
 * {@code next} chain. Only instruction nodes carry flags.
 */
public class Node {

	private String value = "";
	private Node next;
	private final List<Node> children = new ArrayList<Node>();
	private final Map<String, Boolean> attributes = new LinkedHashMap<String, Boolean>();
	private String original = "";
	private final List<String> flags = new ArrayList<String>();
	private int startLine;
	private int endLine;

	/**
	 * Creates an empty node.
	 */
	public Node() {}

	/**
	 * Creates a node holding the specified token.
	 *
	 * @param value token value
	 */
	public Node(String value) {
		this.value = value == null ? "" : value;
	}

	/**
	 * Creates a node holding the specified token, followed by {@code next}.
	 *
	 * @param value token value
	 * @param next the following node of the chain, may be {@code null}
	 */
	public Node(String value, Node next) {
		this(value);
		this.next = next;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = value == null ? "" : value;
	}

	/**
	 * @return the next node of the chain, or {@code null} at the end of the chain
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Node getNext() {
		return next;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setNext(Node next) {
		if (next == this) {
			throw new IllegalArgumentException("A node cannot follow itself");
		}
		this.next = next;
	}

	/**
	 * @return unmodifiable view of the children of this node
	 */
	public List<Node> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * @return unmodifiable view of the attributes set by the argument parser
	 */
	public Map<String, Boolean> getAttributes() {
		return Collections.unmodifiableMap(attributes);
	}

	/**
	 * Returns whether the specified attribute is set on this node.
	 *
	 * @param name attribute name, like {@code json}
	 * @return {@code true} if the attribute was set to {@code true}
	 */
	public boolean hasAttribute(String name) {
		return Boolean.TRUE.equals(attributes.get(name));
	}

	void setAttributes(Map<String, Boolean> newAttributes) {
		attributes.clear();
		if (newAttributes != null) {
			attributes.putAll(newAttributes);
		}
	}

	/**
	 * @return the logical line this node was built from
	 */
	public String getOriginal() {
		return original;
	}

	void setOriginal(String original) {
		this.original = original == null ? "" : original;
	}

	/**
	 * @return unmodifiable view of the builder flags, like {@code --from=build}
	 */
	public List<String> getFlags() {
		return Collections.unmodifiableList(flags);
	}

	void setFlags(List<String> newFlags) {
		flags.clear();
		if (newFlags != null) {
			flags.addAll(newFlags);
		}
	}

	/**
	 * @return 1-based physical line where this node begins, or {@code -1} for an empty root
	 */
	public int getStartLine() {
		return startLine;
	}

	/**
	 * @return 1-based physical line where this node ends (inclusive)
	 */
	public int getEndLine() {
		return endLine;
	}

	private void lines(int start, int end) {
		if (start > end) {
			throw new IllegalArgumentException("Start line " + start + " is after end line " + end);
		}
		this.startLine = start;
		this.endLine = end;
	}

	static Node newRoot() {
		Node root = new Node();
		root.startLine = -1;
		root.endLine = -1;
		return root;
	}

	/**
	 * Appends a child node and records its line span. The span of this node is
	 * extended to cover the child.
	 *
	 * @param child node to append
	 * @param start first physical line of the child
	 * @param end last physical line of the child
	 */
	public void addChild(Node child, int start, int end) {
		child.lines(start, end);
		if (startLine < 0) {
			startLine = start;
		}
		endLine = end;
		children.add(child);
	}

	/**
	 * Appends a child node without line information, as argument parsers
	 * do for nested statements.
	 *
	 * @param child node to append
	 */
	public void addChild(Node child) {
		children.add(child);
	}

	/**
	 * Dumps the tree rooted at this node as a list of s-expressions, one
	 * per child, suitable for printing.
	 *
	 * @return the dump of this node
	 */
	public String dump() {
		StringBuilder str = new StringBuilder(value);

		if (!flags.isEmpty()) {
			str.append(" [");
			for (int i = 0; i < flags.size(); i++) {
				if (i > 0) {
					str.append(' ');
				}
				str.append(quote(flags.get(i)));
			}
			str.append(']');
		}

		for (Node child : children) {
			str.append('(').append(child.dump()).append(")\n");
		}

		for (Node n = next; n != null; n = n.next) {
			if (n.children.isEmpty()) {
				str.append(' ').append(quote(n.value));
			} else {
				str.append(' ').append(n.dump());
			}
		}

		return str.toString().trim();
	}

	/**
	 * Quotes a token the way the dump renders it: double quotes around,
	 * with backslash escapes for quotes, backslashes and control characters.
	 *
	 * @param s token to quote
	 * @return the quoted token
	 */
	static String quote(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
			case '"':
				sb.append("\\\"");
				break;
			case '\\':
				sb.append("\\\\");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\r':
				sb.append("\\r");
				break;
			case '\t':
				sb.append("\\t");
				break;
			case '\f':
				sb.append("\\f");
				break;
			case '\u000B':
				sb.append("\\v");
				break;
			default:
				if (Character.isISOControl(c)) {
					sb.append(String.format("\\x%02x", (int) c));
				} else {
					sb.append(c);
				}
			}
		}
		return sb.append('"').toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return dump();
	}
}
