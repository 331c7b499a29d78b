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

import java.math.BigInteger;
import java.util.Set;
import org.metricshub.bmsflow.frontend.ast.BlockValue;

/**
 * Checks branch conditions against the scope they are declared in.
 * <p>
 * Each method returns {@code null} when the condition is accepted, or the
 * kind of warning to report when the branch must be rejected. Accepted
 * values are added to {@code seen}; rejected ones are not.
 */
public final class ConditionValidator {

	private ConditionValidator() {}

	/**
	 * Validates an {@code #IF} or {@code #ELSEIF} condition.
	 *
	 * @param scope value of the enclosing random scope
	 * @param seen conditions already used in the same {@code #IF} chain
	 * @param cond the condition to check
	 * @return {@code null} when valid, the warning kind otherwise
	 */
	public static WarningKind validateIf(BlockValue scope, Set<BigInteger> seen, BigInteger cond) {
		if (seen.contains(cond)) {
			return WarningKind.RANDOM_DUPLICATE_IF_BRANCH_VALUE;
		}
		if (!scope.inRange(cond)) {
			return WarningKind.RANDOM_IF_BRANCH_VALUE_OUT_OF_RANGE;
		}
		seen.add(cond);
		return null;
	}

	/**
	 * Validates a {@code #CASE} value.
	 *
	 * @param scope value of the enclosing switch scope
	 * @param seen case values already used in the same switch
	 * @param cond the case value
	 * @return {@code null} when valid, the warning kind otherwise
	 */
	public static WarningKind validateCase(BlockValue scope, Set<BigInteger> seen, BigInteger cond) {
		if (seen.contains(cond)) {
			return WarningKind.SWITCH_DUPLICATE_CASE_VALUE;
		}
		if (!scope.inRange(cond)) {
			return WarningKind.SWITCH_CASE_VALUE_OUT_OF_RANGE;
		}
		seen.add(cond);
		return null;
	}

	/**
	 * @param defSeen whether the switch already has a {@code #DEF}
	 * @return {@code null} for the first {@code #DEF}, the warning kind otherwise
	 */
	public static WarningKind validateDef(boolean defSeen) {
		return defSeen ? WarningKind.SWITCH_DUPLICATE_DEF : null;
	}

	/**
	 * Checks a value returned by a random source.
	 *
	 * @param scope the scope the value was drawn for
	 * @param value the drawn value
	 * @param kind the warning to report when out of range
	 * @return {@code null} when in range, {@code kind} otherwise
	 */
	public static WarningKind validateGenerated(BlockValue scope, BigInteger value, WarningKind kind) {
		return scope.inRange(value) ? null : kind;
	}
}
