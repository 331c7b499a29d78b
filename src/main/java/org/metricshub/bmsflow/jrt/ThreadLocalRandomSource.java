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
import java.util.concurrent.ThreadLocalRandom;

/**
 * Default {@link RandomSource}: unseeded and safe to share between threads.
 */
public class ThreadLocalRandomSource implements RandomSource {

	/** Shared instance. */
	public static final ThreadLocalRandomSource INSTANCE = new ThreadLocalRandomSource();

	@Override
	public BigInteger next(BigInteger max) {
		if (max.signum() <= 0) {
			throw new IllegalArgumentException("max must be positive: " + max);
		}
		ThreadLocalRandom rnd = ThreadLocalRandom.current();
		if (max.bitLength() < 63) {
			return BigInteger.valueOf(rnd.nextLong(max.longValue()) + 1);
		}
		BigInteger candidate;
		do {
			candidate = new BigInteger(max.bitLength(), rnd);
		} while (candidate.compareTo(max) >= 0);
		return candidate.add(BigInteger.ONE);
	}
}
