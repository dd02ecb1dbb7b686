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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Reads the physical lines of a Dockerfile, refusing lines longer than a
 * configured maximum.
 * <p>
 * Lines are delimited by {@code \n}; one {@code \r} before the delimiter is
 * dropped. A final line without delimiter is returned when it is not empty.
 */
class LineReader {

	private final BufferedReader reader;
	private final int maxLineLength;
	private final StringBuilder buffer = new StringBuilder();
	private int lineNumber;

	/**
	 * @param reader source of the Dockerfile
	 * @param maxLineLength maximum number of characters in a line
	 */
	LineReader(Reader reader, int maxLineLength) {
		this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
		this.maxLineLength = maxLineLength;
	}

	/**
	 * @return number of lines read so far
	 */
	int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Reads the next physical line.
	 *
	 * @return the line without its delimiter, or {@code null} at the end of the input
	 * @throws IOException if reading fails
	 * @throws LineTooLongException if the line exceeds the maximum length
	 */
	String readLine() throws IOException {
		buffer.setLength(0);
		int c;
		while ((c = reader.read()) >= 0) {
			if (c == '\n') {
				return endLine();
			}
			buffer.append((char) c);
			if (buffer.length() > maxLineLength) {
				throw new LineTooLongException(lineNumber + 1, maxLineLength);
			}
		}
		if (buffer.length() == 0) {
			return null;
		}
		return endLine();
	}

	private String endLine() {
		lineNumber++;
		int length = buffer.length();
		if (length > 0 && buffer.charAt(length - 1) == '\r') {
			buffer.setLength(length - 1);
		}
		return buffer.toString();
	}
}
