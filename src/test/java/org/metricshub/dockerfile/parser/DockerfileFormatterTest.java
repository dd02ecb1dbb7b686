package org.metricshub.dockerfile.parser;

import static org.junit.Assert.assertEquals;
import static org.metricshub.dockerfile.DockerfileTestSupport.loadDockerfile;

import org.junit.Test;

public class DockerfileFormatterTest {

	private static final DockerfileParser PARSER = new DockerfileParser();

	@Test
	public void testFormat() {
		ParseResult result = PARSER.parse("# comment\nFROM alpine\nRUN echo \\\n  hi\n\nUSER nobody\n");
		assertEquals("FROM alpine\nRUN echo   hi\nUSER nobody\n", DockerfileFormatter.format(result));
	}

	@Test
	public void testFormatKeepsEscapeDirective() {
		ParseResult result = PARSER.parse("# escape=`\nFROM alpine\nRUN echo `\n  hi\n");
		assertEquals("# escape=`\nFROM alpine\nRUN echo   hi\n", DockerfileFormatter.format(result));
	}

	@Test
	public void testMultistageRoundTrip() throws Exception {
		assertRoundTrip(loadDockerfile("multistage.Dockerfile"));
	}

	@Test
	public void testWindowsRoundTrip() throws Exception {
		assertRoundTrip(loadDockerfile("windows.Dockerfile"));
	}

	@Test
	public void testTrailingEscapeTokenOnLastLine() {
		ParseResult first = PARSER.parse("FROM alpine\nRUN x \\\\\n");
		assertEquals("(from \"alpine\")\n(run \"x \\\\\")", first.getAst().dump());

		String formatted = DockerfileFormatter.format(first);
		assertEquals("FROM alpine\nRUN x \\\n", formatted);

		ParseResult second = PARSER.parse(formatted);
		assertEquals("the remaining escape token is read as a continuation", "(from \"alpine\")\n(run \"x\")", second.getAst().dump());
	}

	private static void assertRoundTrip(String dockerfile) {
		ParseResult first = PARSER.parse(dockerfile);
		ParseResult second = PARSER.parse(DockerfileFormatter.format(first));
		assertEquals(first.getAst().dump(), second.getAst().dump());
		assertEquals(first.getEscapeToken(), second.getEscapeToken());
	}
}
