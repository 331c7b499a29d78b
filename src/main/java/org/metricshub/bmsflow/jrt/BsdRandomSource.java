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

/**
 * Seeded {@link RandomSource} backed by {@link BSDRandom}, so that a chart
 * resolved with a given seed always yields the same tokens.
 * <p>
 * Values are drawn by rejection sampling over 31-bit words, which keeps the
 * distribution uniform for any {@code max}.
 */
public class BsdRandomSource implements RandomSource {

	private static final int WORD_BITS = 31;

	private final BSDRandom random;

	public BsdRandomSource(int seed) {
		this.random = new BSDRandom(seed);
	}

	@Override
	public synchronized BigInteger next(BigInteger max) {
		if (max.signum() <= 0) {
			throw new IllegalArgumentException("max must be positive: " + max);
		}
		int bits = max.bitLength();
		BigInteger candidate;
		do {
			candidate = nextBits(bits);
		} while (candidate.compareTo(max) >= 0);
		return candidate.add(BigInteger.ONE);
	}

	private BigInteger nextBits(int bits) {
		BigInteger result = BigInteger.ZERO;
		int remaining = bits;
		while (remaining > 0) {
			int take = Math.min(WORD_BITS, remaining);
			int word = random.nextInt() >>> (WORD_BITS - take);
			result = result.shiftLeft(take).or(BigInteger.valueOf(word));
			remaining -= take;
		}
		return result;
	}
}
