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

/**
 * Dockerfile instruction keywords known to the parser, in their canonical
 * lower-case form.
 */
public final class Command {

	public static final String ADD = "add";
	public static final String ARG = "arg";
	public static final String CMD = "cmd";
	public static final String COPY = "copy";
	public static final String ENTRYPOINT = "entrypoint";
	public static final String ENV = "env";
	public static final String EXPOSE = "expose";
	public static final String FROM = "from";
	public static final String HEALTHCHECK = "healthcheck";
	public static final String LABEL = "label";
	public static final String MAINTAINER = "maintainer";
	public static final String ONBUILD = "onbuild";
	public static final String RUN = "run";
	public static final String SHELL = "shell";
	public static final String STOPSIGNAL = "stopsignal";
	public static final String USER = "user";
	public static final String VOLUME = "volume";
	public static final String WORKDIR = "workdir";

	private Command() {}
}
