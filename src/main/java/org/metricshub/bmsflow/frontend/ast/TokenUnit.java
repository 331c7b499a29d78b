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

import java.util.Objects;
import org.metricshub.bmsflow.frontend.SourcePosition;
import org.metricshub.bmsflow.frontend.Token;
import org.metricshub.bmsflow.frontend.TokenType;

/**
 * Leaf of the control-flow tree wrapping one payload token.
 * <p>
 * The only directive found in a leaf is a {@code #SKIP} nested in a branch
 * inside a case: it stops the case only when reached.
 */
public final class TokenUnit implements Unit {

	private final Token token;

	public TokenUnit(Token token) {
		this.token = Objects.requireNonNull(token, "token");
	}

	public Token getToken() {
		return token;
	}

	/**
	 * @return {@code true} for a nested {@code #SKIP}
	 */
	public boolean isSkip() {
		return token.getType() == TokenType.SKIP;
	}

	@Override
	public SourcePosition getPosition() {
		return token.getPosition();
	}

	@Override
	public <R> R accept(UnitVisitor<R> visitor) {
		return visitor.visitToken(this);
	}

	@Override
	public String toString() {
		return token.toString();
	}
}
