package org.metricshub.bmsflow.jrt;

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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link RandomSource} returning pre-chosen values, one per call, whatever
 * the requested bound. The sequence starts over once exhausted.
 * <p>
 * Useful to force a branch of a chart, or in tests.
 */
public class FixedRandomSource implements RandomSource {

	private final List<BigInteger> values;
	private int index;

	public FixedRandomSource(List<BigInteger> values) {
		if (values == null || values.isEmpty()) {
			throw new IllegalArgumentException("At least one value is required");
		}
		this.values = Collections.unmodifiableList(new ArrayList<BigInteger>(values));
	}

	/**
	 * @param values the values to return, in order
	 * @return a source returning {@code values} in a loop
	 */
	public static FixedRandomSource of(long... values) {
		List<BigInteger> list = new ArrayList<BigInteger>(values.length);
		for (long value : values) {
			list.add(BigInteger.valueOf(value));
		}
		return new FixedRandomSource(list);
	}

	/**
	 * Parses a comma-separated list of values, as given on the command line.
	 *
	 * @param text for example {@code "1,2,3"}
	 * @return the new source
	 * @throws IllegalArgumentException when a value is not a non-negative integer
	 */
	public static FixedRandomSource parse(String text) {
		List<BigInteger> list = new ArrayList<BigInteger>();
		for (String part : text.split(",")) {
			String trimmed = part.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			BigInteger value;
			try {
				value = new BigInteger(trimmed);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Not an integer: " + trimmed, e);
			}
			if (value.signum() < 0) {
				throw new IllegalArgumentException("Negative value: " + trimmed);
			}
			list.add(value);
		}
		return new FixedRandomSource(list);
	}

	@Override
	public synchronized BigInteger next(BigInteger max) {
		BigInteger value = values.get(index);
		index = (index + 1) % values.size();
		return value;
	}

	/**
	 * @return the values this source cycles through
	 */
	public List<BigInteger> getValues() {
		return values;
	}
}
