package org.metricshub.dockerfile.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.io.StringReader;
import org.junit.Test;

public class LineReaderTest {

	private static LineReader reader(String text, int max) {
		return new LineReader(new StringReader(text), max);
	}

	@Test
	public void testLines() throws IOException {
		LineReader lines = reader("a\r\nb\n\nc", 100);
		assertEquals("a", lines.readLine());
		assertEquals("b", lines.readLine());
		assertEquals("", lines.readLine());
		assertEquals("c", lines.readLine());
		assertNull(lines.readLine());
		assertEquals(4, lines.getLineNumber());
	}

	@Test
	public void testTrailingNewline() throws IOException {
		LineReader lines = reader("a\n", 100);
		assertEquals("a", lines.readLine());
		assertNull(lines.readLine());
		assertEquals(1, lines.getLineNumber());
	}

	@Test
	public void testEmptyInput() throws IOException {
		LineReader lines = reader("", 100);
		assertNull(lines.readLine());
		assertEquals(0, lines.getLineNumber());
	}

	@Test
	public void testOnlyOneCarriageReturnIsDropped() throws IOException {
		LineReader lines = reader("a\r\r\nb\r", 100);
		assertEquals("a\r", lines.readLine());
		assertEquals("b", lines.readLine());
		assertNull(lines.readLine());
	}

	@Test
	public void testLineTooLong() throws IOException {
		LineReader lines = reader("abc\nabcd\n", 3);
		assertEquals("abc", lines.readLine());
		LineTooLongException e = assertThrows(LineTooLongException.class, lines::readLine);
		assertEquals(2, e.getLineNumber());
		assertEquals(3, e.getMaxLineLength());
		assertEquals("dockerfile line greater than max allowed size of 3", e.getMessage());
	}
}
