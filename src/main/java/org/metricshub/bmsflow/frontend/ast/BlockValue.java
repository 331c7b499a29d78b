package org.metricshub.bmsflow.frontend.ast;

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
import java.util.Objects;

/**
 * How the value of a random or switch scope is obtained: drawn uniformly in
 * {@code [1, max]} ({@code #RANDOM}, {@code #SWITCH}) or fixed
 * ({@code #SETRANDOM}, {@code #SETSWITCH}).
 */
public final class BlockValue {

	private final boolean random;
	private final BigInteger value;

	private BlockValue(boolean random, BigInteger value) {
		Objects.requireNonNull(value, "value");
		if (value.signum() < 0) {
			throw new IllegalArgumentException("Block value must not be negative: " + value);
		}
		this.random = random;
		this.value = value;
	}

	/**
	 * @param max upper bound of the drawn value
	 * @return a {@code Random{max}} block value
	 */
	public static BlockValue random(BigInteger max) {
		return new BlockValue(true, max);
	}

	public static BlockValue random(long max) {
		return random(BigInteger.valueOf(max));
	}

	/**
	 * @param value the value the scope is bound to
	 * @return a {@code Set{value}} block value
	 */
	public static BlockValue set(BigInteger value) {
		return new BlockValue(false, value);
	}

	public static BlockValue set(long value) {
		return set(BigInteger.valueOf(value));
	}

	public boolean isRandom() {
		return random;
	}

	/**
	 * @return the upper bound for a random block, the bound value otherwise
	 */
	public BigInteger getValue() {
		return value;
	}

	/**
	 * Tells whether {@code cond} is a value this block can produce. Always
	 * {@code true} for {@code Set} blocks, whose values are not range checked.
	 *
	 * @param cond a branch condition
	 * @return {@code false} when {@code cond} is out of {@code [1, max]}
	 */
	public boolean inRange(BigInteger cond) {
		if (!random) {
			return true;
		}
		return cond.signum() > 0 && cond.compareTo(value) <= 0;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof BlockValue)) {
			return false;
		}
		BlockValue other = (BlockValue) obj;
		return random == other.random && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(random, value);
	}

	@Override
	public String toString() {
		return (random ? "Random{" : "Set{") + value + "}";
	}
}
