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
import org.metricshub.bmsflow.frontend.TokenType;

/**
 * One {@code #CASE n} or {@code #DEF} branch of a switch scope, with the units
 * up to its {@code #SKIP} or the next branch.
 */
public final class CaseBranch {

	private final Token header;
	private final boolean rejected;
	private final List<Unit> units = new ArrayList<Unit>();
	private Token skip;

	public CaseBranch(Token header, boolean rejected) {
		this.header = header;
		this.rejected = rejected;
	}

	public Token getHeader() {
		return header;
	}

	public boolean isDefault() {
		return header.getType() == TokenType.DEF;
	}

	/**
	 * @return the case value, {@code null} for {@code #DEF}
	 */
	public BigInteger getCondition() {
		return header.getValue();
	}

	public boolean isRejected() {
		return rejected;
	}

	public List<Unit> getUnits() {
		return Collections.unmodifiableList(units);
	}

	public void append(Unit unit) {
		units.add(unit);
	}

	/**
	 * @return the {@code #SKIP} ending the branch, or {@code null}
	 */
	public Token getSkip() {
		return skip;
	}

	public void setSkip(Token skip) {
		this.skip = skip;
	}
}
