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

/**
 * Kinds of non-fatal problems found while resolving the control flow of a
 * chart.
 */
public enum WarningKind {
	UNMATCHED_END_IF("#ENDIF without a matching #IF"),
	UNMATCHED_END_RANDOM("#ENDRANDOM without a matching #RANDOM"),
	UNMATCHED_END_SWITCH("#ENDSW without a matching #SWITCH"),
	UNMATCHED_IF("#IF outside of any #RANDOM scope"),
	UNMATCHED_ELSE_IF("#ELSEIF without a matching #IF"),
	UNMATCHED_ELSE("#ELSE without a matching #IF"),
	UNMATCHED_SKIP("#SKIP outside of any #CASE or #DEF"),
	UNMATCHED_CASE("#CASE outside of any #SWITCH scope"),
	UNMATCHED_DEF("#DEF outside of any #SWITCH scope"),
	RANDOM_DUPLICATE_IF_BRANCH_VALUE("duplicate #IF / #ELSEIF value in the same chain"),
	RANDOM_IF_BRANCH_VALUE_OUT_OF_RANGE("#IF / #ELSEIF value out of the #RANDOM range"),
	RANDOM_VALUE_OUT_OF_RANGE("random source returned a value out of the #RANDOM range"),
	SWITCH_DUPLICATE_CASE_VALUE("duplicate #CASE value in the same #SWITCH"),
	SWITCH_CASE_VALUE_OUT_OF_RANGE("#CASE value out of the #SWITCH range"),
	SWITCH_DUPLICATE_DEF("more than one #DEF in the same #SWITCH"),
	SWITCH_VALUE_OUT_OF_RANGE("random source returned a value out of the #SWITCH range");

	private final String message;

	WarningKind(String message) {
		this.message = message;
	}

	public String getMessage() {
		return message;
	}
}
