package org.metricshub.dockerfile.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class LineParsersTest {

	private final Directive directive = new Directive();

	private Node parseLine(String line) {
		return InstructionDispatcher.newNodeFromLine(line, directive);
	}

	@Test
	public void testParseWords() {
		assertEquals(Arrays.asList("a", "b", "c"), LineParsers.parseWords("a b  \tc ", directive));
		assertEquals(
				"quotes are kept in the words",
				Arrays.asList("a", "\"b c\"", "'d e'"),
				LineParsers.parseWords("a \"b c\" 'd e'", directive));
		assertEquals(Arrays.asList("a\\ b"), LineParsers.parseWords("a\\ b", directive));
		assertEquals(Arrays.asList("'a\\b'"), LineParsers.parseWords("'a\\b'", directive));
		assertEquals(Arrays.asList("x=\"\""), LineParsers.parseWords("x=\"\"", directive));
		assertEquals(Collections.emptyList(), LineParsers.parseWords("   ", directive));
	}

	@Test
	public void testParseWordsWithBacktick() {
		Directive d = new Directive();
		d.setEscapeToken("`");
		assertEquals(Arrays.asList("a` b", "c\\d"), LineParsers.parseWords("a` b c\\d", d));
	}

	@Test
	public void testEnvNameValue() {
		Node node = parseLine("ENV a=1 b=\"x y\"");
		assertEquals("env \"a\" \"1\" \"b\" \"\\\"x y\\\"\"", node.dump());
	}

	@Test
	public void testEnvLegacyForm() {
		assertEquals("env \"name\" \"some value\"", parseLine("ENV name some value").dump());
	}

	@Test
	public void testEnvLegacyFormWithoutValue() {
		ArgumentSyntaxException e = assertThrows(ArgumentSyntaxException.class, () -> parseLine("ENV name"));
		assertEquals("ENV must have two arguments", e.getMessage());
	}

	@Test
	public void testLabelMissingEquals() {
		ArgumentSyntaxException e = assertThrows(ArgumentSyntaxException.class, () -> parseLine("LABEL a=1 b"));
		assertEquals("Syntax error - can't find = in \"b\". Must be of the form: name=value", e.getMessage());
	}

	@Test
	public void testEnvWithoutArguments() {
		assertEquals("env", parseLine("ENV").dump());
	}

	@Test
	public void testArgNameOrNameValue() {
		assertEquals("arg \"a\" \"b=2\" \"c=\\\"\\\"\"", parseLine("ARG a b=2 c=\"\"").dump());
	}

	@Test
	public void testWhitespaceDelimited() {
		assertEquals("expose \"80\" \"443\"", parseLine("EXPOSE 80  443").dump());
		assertEquals("from \"alpine:3.19\" \"AS\" \"base\"", parseLine("FROM alpine:3.19 AS base").dump());
	}

	@Test
	public void testParseString() {
		assertEquals("maintainer \"John Doe <john@example.com>\"", parseLine("MAINTAINER John Doe <john@example.com>").dump());
		assertEquals("workdir", parseLine("WORKDIR").dump());
	}

	@Test
	public void testMaybeJsonArray() {
		Node node = parseLine("CMD [\"echo\", \"hi\"]");
		assertEquals("cmd \"echo\" \"hi\"", node.dump());
		assertTrue(node.hasAttribute(LineParsers.ATTRIBUTE_JSON));
	}

	@Test
	public void testMaybeJsonFallsBackToString() {
		Node node = parseLine("RUN echo [ hi");
		assertEquals("run \"echo [ hi\"", node.dump());
		assertFalse(node.hasAttribute(LineParsers.ATTRIBUTE_JSON));

		assertEquals("malformed array", "run \"[ \\\"a\\\"\"", parseLine("RUN [ \"a\"").dump());
		assertEquals("trailing text after the array", "run \"[\\\"a\\\"] b\"", parseLine("RUN [\"a\"] b").dump());
	}

	@Test
	public void testEmptyJsonArray() {
		Node node = parseLine("CMD []");
		assertEquals("cmd", node.dump());
		assertTrue(node.hasAttribute(LineParsers.ATTRIBUTE_JSON));
	}

	@Test
	public void testJsonArrayOfNonStrings() {
		ArgumentSyntaxException e = assertThrows(ArgumentSyntaxException.class, () -> parseLine("ENTRYPOINT [\"a\", 1]"));
		assertEquals(LineParsers.NOT_STRING_ARRAY, e.getMessage());
	}

	@Test
	public void testMaybeJsonToList() {
		assertEquals("copy \"a\" \"b\" \"c\"", parseLine("COPY a b  c").dump());
		Node node = parseLine("VOLUME [\"/data\", \"/logs\"]");
		assertEquals("volume \"/data\" \"/logs\"", node.dump());
		assertTrue(node.hasAttribute(LineParsers.ATTRIBUTE_JSON));
	}

	@Test
	public void testParseJson() {
		ParsedArguments parsed = LineParsers.parseJSON("  [\"a\", \"b\"]", directive);
		assertEquals("a", parsed.getNode().getValue());
		assertEquals("b", parsed.getNode().getNext().getValue());
		assertNull(parsed.getNode().getNext().getNext());
		assertEquals(Boolean.TRUE, parsed.getAttributes().get(LineParsers.ATTRIBUTE_JSON));

		ArgumentSyntaxException e = assertThrows(ArgumentSyntaxException.class, () -> LineParsers.parseJSON("not json", directive));
		assertEquals("Error parsing \"not json\" as a JSON array", e.getMessage());
	}

	@Test
	public void testHealthcheck() {
		assertEquals("healthcheck \"NONE\"", parseLine("HEALTHCHECK NONE").dump());
		assertEquals(
				"healthcheck [\"--interval=5s\"] \"CMD\" \"curl -f http://localhost/\"",
				parseLine("HEALTHCHECK --interval=5s CMD curl -f http://localhost/").dump());

		Node node = parseLine("HEALTHCHECK CMD [\"curl\", \"-f\"]");
		assertEquals("healthcheck \"CMD\" \"curl\" \"-f\"", node.dump());
		assertTrue(node.hasAttribute(LineParsers.ATTRIBUTE_JSON));
		assertEquals("healthcheck", parseLine("HEALTHCHECK").dump());
	}

	@Test
	public void testOnbuild() {
		Node node = parseLine("ONBUILD RUN echo hi");
		assertEquals("onbuild (run \"echo hi\")", node.dump());
		Node nested = node.getNext().getChildren().get(0);
		assertEquals("run", nested.getValue());
		assertEquals("RUN echo hi", nested.getOriginal());
		assertEquals("onbuild", parseLine("ONBUILD").dump());
	}

	@Test
	public void testIgnore() {
		assertNull(LineParsers.parseIgnore("whatever", directive).getNode());
		assertEquals("unknown", parseLine("UNKNOWN a b").dump());
	}
}
