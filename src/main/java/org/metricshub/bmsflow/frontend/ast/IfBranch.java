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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.bmsflow.frontend.Token;

/**
 * One branch of an {@link IfBlock}: the {@code #IF}, {@code #ELSEIF} or
 * {@code #ELSE} token and the units up to the next branch or {@code #ENDIF}.
 */
public final class IfBranch {

	/** Condition key of the {@code #ELSE} branch. */
	public static final BigInteger ELSE_KEY = BigInteger.ZERO;

	private final Token header;
	private final boolean rejected;
	private final List<Unit> units = new ArrayList<Unit>();

	public IfBranch(Token header, boolean rejected) {
		this.header = header;
		this.rejected = rejected;
	}

	/**
	 * @return the {@code #IF}, {@code #ELSEIF} or {@code #ELSE} token
	 */
	public Token getHeader() {
		return header;
	}

	/**
	 * @return the condition, {@link #ELSE_KEY} for {@code #ELSE}
	 */
	public BigInteger getCondition() {
		return isElse() ? ELSE_KEY : header.getValue();
	}

	public boolean isElse() {
		return header.getValue() == null;
	}

	/**
	 * @return {@code true} when the condition was a duplicate or out of range;
	 *         such a branch never matches
	 */
	public boolean isRejected() {
		return rejected;
	}

	public List<Unit> getUnits() {
		return Collections.unmodifiableList(units);
	}

	/**
	 * Appends a unit; used by the tree builder.
	 *
	 * @param unit the unit
	 */
	public void append(Unit unit) {
		units.add(unit);
	}
}
