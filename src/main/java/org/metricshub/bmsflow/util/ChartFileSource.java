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
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Represents one BMS chart file content source.
 */
public class ChartFileSource extends ChartSource {

	private String filePath;
	private Charset charset;
	private Reader fileReader;

	/**
	 * Reads the file as UTF-8.
	 *
	 * @param filePath path of the chart
	 */
	public ChartFileSource(String filePath) {
		this(filePath, StandardCharsets.UTF_8);
	}

	/**
	 * @param filePath path of the chart
	 * @param charset encoding of the chart, often {@code Shift_JIS} for older charts
	 */
	public ChartFileSource(String filePath, Charset charset) {
		super(filePath, null);
		this.filePath = filePath;
		this.charset = charset;
		this.fileReader = null;
	}

	public String getFilePath() {
		return filePath;
	}

	public Charset getCharset() {
		return charset;
	}

	/** {@inheritDoc} */
	@Override
	public Reader getReader() {
		if (fileReader == null) {
			try {
				fileReader = Files.newBufferedReader(Paths.get(filePath), charset);
			} catch (IOException ex) {
				throw new UncheckedIOException("Failed to open chart source for reading: " + filePath, ex);
			}
		}

		return fileReader;
	}
}
