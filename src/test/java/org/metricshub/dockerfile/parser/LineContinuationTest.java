package org.metricshub.dockerfile.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class LineContinuationTest {

	private static Directive backtick() {
		Directive d = new Directive();
		d.setEscapeToken("`");
		return d;
	}

	@Test
	public void testEndsWithEscape() {
		Directive d = new Directive();
		assertTrue(DockerfileParser.endsWithEscape("RUN a \\", d));
		assertTrue("trailing blanks after the escape token", DockerfileParser.endsWithEscape("RUN a \\ \t ", d));
		assertFalse(DockerfileParser.endsWithEscape("RUN a\\ b", d));
		assertFalse(DockerfileParser.endsWithEscape("RUN a `", d));
		assertTrue(DockerfileParser.endsWithEscape("RUN a `", backtick()));
		assertFalse(DockerfileParser.endsWithEscape("RUN a \\", backtick()));
	}

	@Test
	public void testStripTrailingEscape() {
		Directive d = new Directive();
		assertEquals("RUN a ", DockerfileParser.stripTrailingEscape("RUN a \\  ", d));
		assertEquals("only the last escape token is removed", "RUN a \\", DockerfileParser.stripTrailingEscape("RUN a \\\\", d));
		assertEquals("RUN a", DockerfileParser.stripTrailingEscape("RUN a`", backtick()));
	}

	@Test
	public void testHasOpenJsonArray() {
		assertTrue(DockerfileParser.hasOpenJsonArray("COPY [\"a\","));
		assertTrue(DockerfileParser.hasOpenJsonArray("COPY ["));
		assertTrue(DockerfileParser.hasOpenJsonArray("RUN x ] [ y"));
		assertFalse(DockerfileParser.hasOpenJsonArray("COPY [\"a\", \"b\"]"));
		assertFalse(DockerfileParser.hasOpenJsonArray("RUN [ ] ]"));
		assertFalse(DockerfileParser.hasOpenJsonArray("RUN echo hello"));
	}

	@Test
	public void testContinuateLine() {
		Directive d = new Directive();

		DockerfileParser.Continuation c = DockerfileParser.continuateLine("RUN a \\", d);
		assertFalse(c.complete);
		assertEquals("RUN a ", c.line);

		c = DockerfileParser.continuateLine("COPY [\"a\",", d);
		assertFalse(c.complete);
		assertEquals("the open array is kept as is", "COPY [\"a\",", c.line);

		c = DockerfileParser.continuateLine("COPY [\"a\", \\", d);
		assertFalse(c.complete);
		assertEquals("escape rule comes first", "COPY [\"a\", ", c.line);

		c = DockerfileParser.continuateLine("RUN a", d);
		assertTrue(c.complete);
		assertEquals("RUN a", c.line);

		c = DockerfileParser.continuateLine("", d);
		assertTrue(c.complete);
		assertEquals("", c.line);
	}

	@Test
	public void testComments() {
		assertTrue(DockerfileParser.isComment("# comment"));
		assertTrue(DockerfileParser.isComment("  \t# comment"));
		assertFalse(DockerfileParser.isComment("RUN a # b"));
		assertEquals("", DockerfileParser.trimComments("# comment"));
		assertEquals("comments are whole-line only", "RUN a # b", DockerfileParser.trimComments("RUN a # b"));
		assertEquals("  # indented", DockerfileParser.trimComments("  # indented"));
	}

	@Test
	public void testWhitespace() {
		assertTrue(DockerfileParser.isEmptyContinuationLine(""));
		assertTrue(DockerfileParser.isEmptyContinuationLine(" \t\u000B\f\r"));
		assertFalse(DockerfileParser.isEmptyContinuationLine("  a"));
		assertEquals("a b ", DockerfileParser.trimLeft("  \ta b "));
		assertTrue(DockerfileParser.isSpace(' '));
		assertTrue(DockerfileParser.isSpace('\u00A0'));
		assertTrue(DockerfileParser.isSpace('\u2003'));
		assertFalse(DockerfileParser.isSpace('\uFEFF'));
		assertFalse(DockerfileParser.isSpace('a'));
	}

	@Test
	public void testByteOrderMark() {
		assertEquals("FROM a", DockerfileParser.stripByteOrderMark("\uFEFFFROM a"));
		assertEquals("FROM a", DockerfileParser.stripByteOrderMark("FROM a"));
		assertEquals("", DockerfileParser.stripByteOrderMark(""));
	}
}
