package org.metricshub.dockerfile.json;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Test;
import org.metricshub.dockerfile.parser.DockerfileParser;
import org.metricshub.dockerfile.parser.ParseResult;

public class DockerfileJsonTest {

	private final DockerfileJson json = new DockerfileJson();

	@Test
	public void testTree() {
		ParseResult result = new DockerfileParser().parse("FROM alpine\nCOPY --chown=1 [\"a\", \"b\"]\n");
		ObjectNode tree = json.toTree(result);

		assertEquals("\\", tree.get("escapeToken").asText());
		assertEquals(0, tree.get("warnings").size());

		JsonNode ast = tree.get("ast");
		assertFalse("the root has no value", ast.has("value"));
		assertEquals(1, ast.get("startLine").asInt());
		assertEquals(2, ast.get("endLine").asInt());
		assertEquals(2, ast.get("children").size());

		JsonNode from = ast.get("children").get(0);
		assertEquals("from", from.get("value").asText());
		assertEquals("FROM alpine", from.get("original").asText());
		assertEquals("alpine", from.get("next").get(0).get("value").asText());
		assertFalse(from.has("flags"));
		assertFalse(from.has("attributes"));
		assertFalse("arguments carry no line information", from.get("next").get(0).has("startLine"));

		JsonNode copy = ast.get("children").get(1);
		assertEquals("--chown=1", copy.get("flags").get(0).asText());
		assertTrue(copy.get("attributes").get("json").asBoolean());
		assertEquals(2, copy.get("next").size());
		assertEquals("a", copy.get("next").get(0).get("value").asText());
		assertEquals("b", copy.get("next").get(1).get("value").asText());
		assertFalse(copy.get("next").get(0).has("next"));
	}

	@Test
	public void testWarningsAndEscapeToken() {
		ParseResult result = new DockerfileParser().parse("# escape=`\nRUN a `\n\n b\n");
		ObjectNode tree = json.toTree(result);
		assertEquals("`", tree.get("escapeToken").asText());
		assertEquals(2, tree.get("warnings").size());
		assertEquals(result.getWarnings().get(0), tree.get("warnings").get(0).asText());
	}

	@Test
	public void testToJsonIsValidJson() throws Exception {
		ParseResult result = new DockerfileParser().parse("ONBUILD RUN echo \"hi\"\n");
		String text = json.toJson(result);
		JsonNode parsed = new ObjectMapper().readTree(text);
		assertEquals(json.toTree(result), parsed);

		JsonNode onbuild = parsed.get("ast").get("children").get(0);
		assertEquals("onbuild", onbuild.get("value").asText());
		JsonNode nested = onbuild.get("next").get(0).get("children").get(0);
		assertEquals("run", nested.get("value").asText());
		assertEquals("echo \"hi\"", nested.get("next").get(0).get("value").asText());
	}

	@Test
	public void testLongArgumentChain() {
		StringBuilder dockerfile = new StringBuilder("FROM alpine\nEXPOSE");
		for (int port = 1; port <= 2500; port++) {
			dockerfile.append(' ').append(port);
		}
		dockerfile.append('\n');
		ParseResult result = new DockerfileParser().parse(dockerfile.toString());

		String text = json.toJson(result);

		JsonNode expose = json.toTree(result).get("ast").get("children").get(1);
		assertEquals(2500, expose.get("next").size());
		assertEquals("2500", expose.get("next").get(2499).get("value").asText());
		assertTrue(text.contains("\"2500\""));
	}
}
