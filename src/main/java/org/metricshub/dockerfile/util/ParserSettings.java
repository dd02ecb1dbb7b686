package org.metricshub.dockerfile.util;

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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * A simple container for the parameters of a Dockerfile parse.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking the parser programmatically, from within Java code.
 */
public class ParserSettings {

	/**
	 * Default maximum length of one physical line, in characters.
	 */
	public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024 - 1;

	/**
	 * How the dump tool renders a parsed Dockerfile.
	 */
	public enum OutputFormat {
		/** S-expression like dump, one instruction per line. */
		DUMP,
		/** JSON document describing the whole parse result. */
		JSON
	}

	/**
	 * Maximum number of characters accepted in a single physical line.
	 */
	private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

	/**
	 * Charset used to decode Dockerfiles read from files or streams;
	 * <code>UTF-8</code> by default.
	 */
	private Charset charset = StandardCharsets.UTF_8;

	/**
	 * Output format of the dump tool.
	 */
	private OutputFormat outputFormat = OutputFormat.DUMP;

	/**
	 * Whether the dump tool prints parser warnings on stderr;
	 * <code>true</code> by default.
	 */
	private boolean printWarnings = true;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("maxLineLength = ").append(getMaxLineLength()).append(newLine);
		desc.append("charset = ").append(getCharset()).append(newLine);
		desc.append("outputFormat = ").append(getOutputFormat()).append(newLine);
		desc.append("printWarnings = ").append(isPrintWarnings()).append(newLine);

		return desc.toString();
	}

	public int getMaxLineLength() {
		return maxLineLength;
	}

	/**
	 * Sets the maximum length of a physical line.
	 *
	 * @param maxLineLength number of characters, must be positive
	 */
	public void setMaxLineLength(int maxLineLength) {
		if (maxLineLength <= 0) {
			throw new IllegalArgumentException("Maximum line length must be positive: " + maxLineLength);
		}
		this.maxLineLength = maxLineLength;
	}

	public Charset getCharset() {
		return charset;
	}

	public void setCharset(Charset charset) {
		this.charset = charset == null ? StandardCharsets.UTF_8 : charset;
	}

	public OutputFormat getOutputFormat() {
		return outputFormat;
	}

	public void setOutputFormat(OutputFormat outputFormat) {
		this.outputFormat = outputFormat;
	}

	public boolean isPrintWarnings() {
		return printWarnings;
	}

	public void setPrintWarnings(boolean printWarnings) {
		this.printWarnings = printWarnings;
	}
}
