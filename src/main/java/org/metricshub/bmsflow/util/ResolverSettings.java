package org.metricshub.bmsflow.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * BmsFlow
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
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.metricshub.bmsflow.jrt.RandomSource;
import org.metricshub.bmsflow.jrt.ThreadLocalRandomSource;

/**
 * A simple container for the parameters of a resolution.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when using BmsFlow programmatically, from within Java code.
 */
public class ResolverSettings {

	/**
	 * Where the values of {@code #RANDOM} and {@code #SWITCH} come from;
	 * unseeded by default.
	 */
	private RandomSource randomSource = ThreadLocalRandomSource.INSTANCE;

	/**
	 * Whether common typos found in published charts are accepted;
	 * <code>true</code> by default.
	 */
	private boolean relaxed = true;

	/**
	 * Whether switches are resolved with isolated branches (tree resolution)
	 * instead of fallthrough; <code>false</code> by default.
	 */
	private boolean treeMode = false;

	/**
	 * Whether the command line exits with a failure code when diagnostics were
	 * reported; <code>false</code> by default.
	 */
	private boolean failOnWarnings = false;

	/**
	 * Encoding of chart files; UTF-8 by default.
	 */
	private Charset charset = StandardCharsets.UTF_8;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("randomSource = ").append(getRandomSource().getClass().getSimpleName()).append(newLine);
		desc.append("relaxed = ").append(isRelaxed()).append(newLine);
		desc.append("treeMode = ").append(isTreeMode()).append(newLine);
		desc.append("failOnWarnings = ").append(isFailOnWarnings()).append(newLine);
		desc.append("charset = ").append(getCharset()).append(newLine);

		return desc.toString();
	}

	public RandomSource getRandomSource() {
		return randomSource;
	}

	public void setRandomSource(RandomSource randomSource) {
		this.randomSource = randomSource;
	}

	public boolean isRelaxed() {
		return relaxed;
	}

	public void setRelaxed(boolean relaxed) {
		this.relaxed = relaxed;
	}

	public boolean isTreeMode() {
		return treeMode;
	}

	public void setTreeMode(boolean treeMode) {
		this.treeMode = treeMode;
	}

	public boolean isFailOnWarnings() {
		return failOnWarnings;
	}

	public void setFailOnWarnings(boolean failOnWarnings) {
		this.failOnWarnings = failOnWarnings;
	}

	public Charset getCharset() {
		return charset;
	}

	public void setCharset(Charset charset) {
		this.charset = charset;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to print to (stdout by default)
	 *
	 * @param pOutputStream OutputStream to use for print statements
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}
}
