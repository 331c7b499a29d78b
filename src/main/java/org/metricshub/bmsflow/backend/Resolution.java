package org.metricshub.bmsflow.backend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.bmsflow.frontend.Token;
import org.metricshub.bmsflow.jrt.UnexpectedControlFlowException;

/**
 * Result of a resolution pass: the payload tokens to keep, in source order,
 * and the diagnostics found on the way.
 */
public final class Resolution {

	private final List<Token> tokens;
	private final List<Diagnostic> diagnostics;

	public Resolution(List<Token> tokens, List<Diagnostic> diagnostics) {
		this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
	}

	/**
	 * @return the kept payload tokens; never contains a control-flow directive
	 */
	public List<Token> getTokens() {
		return tokens;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public boolean hasDiagnostics() {
		return !diagnostics.isEmpty();
	}

	/**
	 * Guard for consumers of resolved tokens.
	 *
	 * @param token a token about to be consumed
	 * @return {@code token}
	 * @throws UnexpectedControlFlowException when {@code token} is a control-flow directive
	 */
	public static Token requirePayload(Token token) {
		if (token.isDirective()) {
			throw new UnexpectedControlFlowException(
					token.getPosition().getLine(),
					"Unresolved control-flow directive " + token + " at " + token.getPosition());
		}
		return token;
	}

	@Override
	public String toString() {
		return "Resolution{" + tokens.size() + " tokens, " + diagnostics.size() + " diagnostics}";
	}
}
