package org.metricshub.dockerfile;

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
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.dockerfile.json.DockerfileJson;
import org.metricshub.dockerfile.parser.DockerfileParser;
import org.metricshub.dockerfile.parser.ParseResult;
import org.metricshub.dockerfile.util.DockerfileFileSource;
import org.metricshub.dockerfile.util.DockerfileLogger;
import org.metricshub.dockerfile.util.DockerfileSource;
import org.metricshub.dockerfile.util.ParserSettings;
import org.slf4j.Logger;

/**
 * Command-line interface of the Dockerfile dump tool: parses Dockerfiles and
 * prints their parse tree.
 */
public final class Cli {

	private static final Logger LOG = DockerfileLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "dockerfile-parser.jar";
		}
		JAR_NAME = myName;
	}

	private final ParserSettings settings = new ParserSettings();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	private final List<String> filePaths = new ArrayList<String>();
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which the Dockerfile is read when no file is specified
	 * @param out stream where parse trees are written
	 * @param err stream where warnings are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.in = in;
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the mutable {@link ParserSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ParserSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the Dockerfiles specified on the command line.
	 *
	 * @return defensive copy of the file paths, empty when reading standard input
	 */
	public List<String> getFilePaths() {
		return new ArrayList<String>(filePaths);
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: remaining args are Dockerfiles
				break;
			} else if (arg.equals("-")) {
				// single dash indicates end of options as well
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : parse this Dockerfile
				checkParameterHasArgument(args, argIdx);
				filePaths.add(args[++argIdx]);
			} else if (arg.equals("-j") || arg.equals("--json")) {
				settings.setOutputFormat(ParserSettings.OutputFormat.JSON);
			} else if (arg.equals("--max-line-length")) {
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				try {
					settings.setMaxLineLength(Integer.parseInt(value));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid maximum line length: " + value, e);
				}
			} else if (arg.equals("--no-warnings")) {
				settings.setPrintWarnings(false);
			} else if (arg.equals("-h") || arg.equals("--help")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		while (argIdx < args.length) {
			filePaths.add(args[argIdx++]);
		}
		LOG.debug("Settings:\n{}", settings.toDescriptionString());
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Parses the Dockerfiles and prints their tree.
	 *
	 * @throws IOException if a Dockerfile cannot be read
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		List<DockerfileSource> sources = new ArrayList<DockerfileSource>();
		if (filePaths.isEmpty()) {
			sources.add(new DockerfileSource(DockerfileSource.DESCRIPTION_STDIN, new InputStreamReader(in, settings.getCharset())));
		} else {
			for (String filePath : filePaths) {
				sources.add(new DockerfileFileSource(filePath, settings.getCharset()));
			}
		}

		DockerfileParser parser = new DockerfileParser(settings);
		DockerfileJson json = new DockerfileJson();
		for (DockerfileSource source : sources) {
			ParseResult result = parser.parse(source);
			if (sources.size() > 1) {
				out.println("# " + source.getDescription());
			}
			if (settings.getOutputFormat() == ParserSettings.OutputFormat.JSON) {
				out.println(json.toJson(result));
			} else {
				out.println(result.getAst().dump());
			}
			if (settings.isPrintWarnings()) {
				result.printWarnings(err);
			}
		}
		out.flush();
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-j|--json]" +
								" [--max-line-length n]" +
								" [--no-warnings]" +
								" [-f Dockerfile]..." +
								" [Dockerfile]...");
		dest.println();
		dest.println(" -f filename = Parse filename. Standard input is parsed when no file is specified.");
		dest.println(" -j, --json = Print the parse result as JSON instead of s-expressions.");
		dest.println(" --max-line-length n = Maximum number of characters in one line (default " + ParserSettings.DEFAULT_MAX_LINE_LENGTH + ").");
		dest.println(" --no-warnings = Do not print parser warnings.");
		dest.println();
		dest.println(" -h or --help = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream read when no file is specified
	 * @param os output stream for parse trees
	 * @param es error stream for warnings
	 * @return configured and executed CLI instance
	 * @throws IOException if a Dockerfile cannot be read
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}
}
