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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Represents one BMS chart content source.
 * This is usually either a string given by the caller,
 * the standard input, or a chart file
 * (see {@link ChartFileSource}).
 */
public class ChartSource {

	/** Description of charts read from the standard input. */
	public static final String DESCRIPTION_STDIN = "<stdin>";

	/** Description of charts given as strings. */
	public static final String DESCRIPTION_STRING = "<string>";

	private String description;
	private Reader reader;

	/**
	 * @param description a name for the source, used in error messages
	 * @param reader a {@link java.io.Reader} serving the chart text
	 */
	public ChartSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @param chart the chart text
	 * @return a source reading {@code chart}
	 */
	public static ChartSource fromString(String chart) {
		return new ChartSource(DESCRIPTION_STRING, new StringReader(chart));
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the chart contents.
	 *
	 * @return The reader which contains the chart contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
