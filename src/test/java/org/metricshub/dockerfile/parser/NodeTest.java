package org.metricshub.dockerfile.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class NodeTest {

	@Test
	public void testQuote() {
		assertEquals("\"plain\"", Node.quote("plain"));
		assertEquals("\"a\\\"b\\\\c\\n\\t\"", Node.quote("a\"b\\c\n\t"));
		assertEquals("\"\\x01\"", Node.quote("\u0001"));
		assertEquals("\"caf\u00e9\"", Node.quote("caf\u00e9"));
	}

	@Test
	public void testDumpChain() {
		Node node = new Node("copy", new Node("a", new Node("b")));
		node.setFlags(Arrays.asList("--from=x", "--chmod=755"));
		assertEquals("copy [\"--from=x\" \"--chmod=755\"] \"a\" \"b\"", node.dump());
		assertEquals(node.dump(), node.toString());
	}

	@Test
	public void testDumpRoot() {
		Node root = Node.newRoot();
		root.addChild(new Node("from", new Node("alpine")), 1, 1);
		root.addChild(new Node("user", new Node("nobody")), 2, 2);
		assertEquals("(from \"alpine\")\n(user \"nobody\")", root.dump());
	}

	@Test
	public void testRootSpan() {
		Node root = Node.newRoot();
		assertEquals(-1, root.getStartLine());
		assertEquals(-1, root.getEndLine());

		Node first = new Node("from");
		root.addChild(first, 2, 3);
		root.addChild(new Node("run"), 5, 7);
		assertEquals(2, root.getStartLine());
		assertEquals(7, root.getEndLine());
		assertEquals(2, first.getStartLine());
		assertEquals(3, first.getEndLine());
	}

	@Test
	public void testInvalidSpan() {
		Node root = Node.newRoot();
		assertThrows(IllegalArgumentException.class, () -> root.addChild(new Node("run"), 4, 3));
		assertTrue(root.getChildren().isEmpty());
	}

	@Test
	public void testNodeCannotFollowItself() {
		Node node = new Node("a");
		assertThrows(IllegalArgumentException.class, () -> node.setNext(node));
	}

	@Test
	public void testUnmodifiableViews() {
		Node node = new Node("a");
		assertThrows(UnsupportedOperationException.class, () -> node.getChildren().add(new Node()));
		assertThrows(UnsupportedOperationException.class, () -> node.getFlags().add("--x"));
		assertThrows(UnsupportedOperationException.class, () -> node.getAttributes().put("json", Boolean.TRUE));
	}

	@Test
	public void testAttributes() {
		Node node = new Node("cmd");
		assertFalse(node.hasAttribute("json"));
		node.setAttributes(Collections.singletonMap("json", Boolean.TRUE));
		assertTrue(node.hasAttribute("json"));
		node.setAttributes(null);
		assertFalse(node.hasAttribute("json"));
	}

	@Test
	public void testNullValue() {
		assertEquals("", new Node(null).getValue());
		Node node = new Node("x");
		node.setValue(null);
		assertEquals("", node.getValue());
	}
}
